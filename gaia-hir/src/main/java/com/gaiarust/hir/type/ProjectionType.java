package com.gaiarust.hir.type;

import java.util.Objects;

/**
 * 关联类型投影: &lt;impl&gt;::Name。只能通过显式绑定解析，没有推断回退。
 */
public final class ProjectionType extends HirType {

    private final String implId;
    private final String assocName;

    public ProjectionType(String implId, String assocName) {
        this.implId = Objects.requireNonNull(implId, "implId");
        this.assocName = Objects.requireNonNull(assocName, "assocName");
    }

    public String getImplId() {
        return implId;
    }

    public String getAssocName() {
        return assocName;
    }

    @Override
    public String toDisplayString() {
        return "<" + implId + ">::" + assocName;
    }

    @Override
    public <R> R accept(HirTypeVisitor<R> visitor) {
        return visitor.visitProjection(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProjectionType)) return false;
        ProjectionType that = (ProjectionType) o;
        return implId.equals(that.implId) && assocName.equals(that.assocName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(implId, assocName);
    }
}
