package com.gaiarust.hir.type;

import java.util.Objects;

/**
 * trait 对象: dyn Trait
 */
public final class TraitObjectType extends HirType {

    private final String traitName;

    public TraitObjectType(String traitName) {
        this.traitName = Objects.requireNonNull(traitName, "traitName");
    }

    public String getTraitName() {
        return traitName;
    }

    @Override
    public String toDisplayString() {
        return "dyn " + traitName;
    }

    @Override
    public <R> R accept(HirTypeVisitor<R> visitor) {
        return visitor.visitTraitObject(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TraitObjectType)) return false;
        return traitName.equals(((TraitObjectType) o).traitName);
    }

    @Override
    public int hashCode() {
        return Objects.hash("dyn", traitName);
    }
}
