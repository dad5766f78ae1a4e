package com.gaiarust.hir.type;

/**
 * 未解析的类型占位符，以唯一 id 区分。显示为 ?T0, ?T1 ...
 */
public final class TypeVariable extends HirType {

    private final int id;

    public TypeVariable(int id) {
        if (id < 0) throw new IllegalArgumentException("type variable id must be non-negative: " + id);
        this.id = id;
    }

    public int getId() {
        return id;
    }

    @Override
    public String toDisplayString() {
        return "?T" + id;
    }

    @Override
    public <R> R accept(HirTypeVisitor<R> visitor) {
        return visitor.visitVariable(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TypeVariable)) return false;
        return id == ((TypeVariable) o).id;
    }

    @Override
    public int hashCode() {
        return 31 * id + 7;
    }
}
