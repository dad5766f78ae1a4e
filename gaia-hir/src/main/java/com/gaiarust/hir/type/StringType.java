package com.gaiarust.hir.type;

/**
 * 堆上分配的 String 类型（单例）
 */
public final class StringType extends HirType {

    public static final StringType INSTANCE = new StringType();

    private StringType() {
    }

    @Override
    public String toDisplayString() {
        return "String";
    }

    @Override
    public <R> R accept(HirTypeVisitor<R> visitor) {
        return visitor.visitString(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof StringType;
    }

    @Override
    public int hashCode() {
        return StringType.class.hashCode();
    }
}
