package com.gaiarust.hir.type;

import java.util.Objects;

/**
 * 裸指针: *const T, *mut T
 */
public final class PointerType extends HirType {

    private final boolean mutable;
    private final HirType inner;

    public PointerType(boolean mutable, HirType inner) {
        this.mutable = mutable;
        this.inner = Objects.requireNonNull(inner, "inner");
    }

    public boolean isMutable() {
        return mutable;
    }

    public HirType getInner() {
        return inner;
    }

    @Override
    public String toDisplayString() {
        return (mutable ? "*mut " : "*const ") + inner.toDisplayString();
    }

    @Override
    public <R> R accept(HirTypeVisitor<R> visitor) {
        return visitor.visitPointer(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PointerType)) return false;
        PointerType that = (PointerType) o;
        return mutable == that.mutable && inner.equals(that.inner);
    }

    @Override
    public int hashCode() {
        return Objects.hash("ptr", mutable, inner);
    }
}
