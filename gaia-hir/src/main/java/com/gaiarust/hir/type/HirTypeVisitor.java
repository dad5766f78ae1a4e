package com.gaiarust.hir.type;

/**
 * HirType 访问者接口，用于替代 instanceof 分派。
 */
public interface HirTypeVisitor<R> {
    R visitPrimitive(PrimitiveType type);
    R visitString(StringType type);
    R visitVec(VecType type);
    R visitNamed(NamedType type);
    R visitReference(ReferenceType type);
    R visitPointer(PointerType type);
    R visitTraitObject(TraitObjectType type);
    R visitVariable(TypeVariable type);
    R visitProjection(ProjectionType type);
}
