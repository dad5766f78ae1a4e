package com.gaiarust.hir.type;

import java.util.Objects;

/**
 * Vec&lt;T&gt;
 */
public final class VecType extends HirType {

    private final HirType element;

    public VecType(HirType element) {
        this.element = Objects.requireNonNull(element, "element");
    }

    public HirType getElement() {
        return element;
    }

    @Override
    public String toDisplayString() {
        return "Vec<" + element.toDisplayString() + ">";
    }

    @Override
    public <R> R accept(HirTypeVisitor<R> visitor) {
        return visitor.visitVec(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VecType)) return false;
        return element.equals(((VecType) o).element);
    }

    @Override
    public int hashCode() {
        return Objects.hash("Vec", element);
    }
}
