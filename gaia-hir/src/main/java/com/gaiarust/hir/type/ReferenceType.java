package com.gaiarust.hir.type;

import java.util.Objects;

/**
 * 引用类型: &amp;'a T, &amp;mut T。
 * 源码中省略生命周期时 lifetimeName 为 null，由省略规则补全。
 */
public final class ReferenceType extends HirType {

    private final String lifetimeName;
    private final boolean mutable;
    private final HirType inner;

    public ReferenceType(String lifetimeName, boolean mutable, HirType inner) {
        this.lifetimeName = normalizeLifetime(lifetimeName);
        this.mutable = mutable;
        this.inner = Objects.requireNonNull(inner, "inner");
    }

    /** 去掉前导撇号: "'a" 与 "a" 视为同一生命周期 */
    static String normalizeLifetime(String name) {
        if (name == null) return null;
        return name.startsWith("'") ? name.substring(1) : name;
    }

    public String getLifetimeName() {
        return lifetimeName;
    }

    public boolean hasLifetime() {
        return lifetimeName != null;
    }

    public boolean isMutable() {
        return mutable;
    }

    public HirType getInner() {
        return inner;
    }

    /** 返回带指定生命周期的副本 */
    public ReferenceType withLifetime(String lifetimeName) {
        return new ReferenceType(lifetimeName, mutable, inner);
    }

    @Override
    public String toDisplayString() {
        StringBuilder sb = new StringBuilder("&");
        if (lifetimeName != null) sb.append('\'').append(lifetimeName).append(' ');
        if (mutable) sb.append("mut ");
        return sb.append(inner.toDisplayString()).toString();
    }

    @Override
    public <R> R accept(HirTypeVisitor<R> visitor) {
        return visitor.visitReference(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ReferenceType)) return false;
        ReferenceType that = (ReferenceType) o;
        return mutable == that.mutable
                && Objects.equals(lifetimeName, that.lifetimeName)
                && inner.equals(that.inner);
    }

    @Override
    public int hashCode() {
        return Objects.hash(lifetimeName, mutable, inner);
    }
}
