package com.gaiarust.analysis.solver;

import com.gaiarust.hir.type.HirType;
import com.gaiarust.hir.type.HirTypeVisitor;
import com.gaiarust.hir.type.NamedType;
import com.gaiarust.hir.type.PointerType;
import com.gaiarust.hir.type.PrimitiveType;
import com.gaiarust.hir.type.ProjectionType;
import com.gaiarust.hir.type.ReferenceType;
import com.gaiarust.hir.type.StringType;
import com.gaiarust.hir.type.TraitObjectType;
import com.gaiarust.hir.type.TypeVariable;
import com.gaiarust.hir.type.VecType;

import java.util.ArrayList;
import java.util.List;

/**
 * 结构化类型替换：默认原样重建（子节点未变时返回原对象），
 * 子类覆盖叶子节点的 visit 方法决定替换内容。
 */
public abstract class TypeRewriter implements HirTypeVisitor<HirType> {

    public HirType rewrite(HirType type) {
        return type.accept(this);
    }

    @Override
    public HirType visitPrimitive(PrimitiveType type) {
        return type;
    }

    @Override
    public HirType visitString(StringType type) {
        return type;
    }

    @Override
    public HirType visitVec(VecType type) {
        HirType element = rewrite(type.getElement());
        return element == type.getElement() ? type : new VecType(element);
    }

    @Override
    public HirType visitNamed(NamedType type) {
        if (!type.hasTypeArgs()) return type;
        List<HirType> args = new ArrayList<HirType>();
        boolean changed = false;
        for (HirType arg : type.getTypeArgs()) {
            HirType sub = rewrite(arg);
            if (sub != arg) changed = true;
            args.add(sub);
        }
        return changed ? new NamedType(type.getName(), args) : type;
    }

    @Override
    public HirType visitReference(ReferenceType type) {
        HirType inner = rewrite(type.getInner());
        return inner == type.getInner()
                ? type
                : new ReferenceType(type.getLifetimeName(), type.isMutable(), inner);
    }

    @Override
    public HirType visitPointer(PointerType type) {
        HirType inner = rewrite(type.getInner());
        return inner == type.getInner() ? type : new PointerType(type.isMutable(), inner);
    }

    @Override
    public HirType visitTraitObject(TraitObjectType type) {
        return type;
    }

    @Override
    public HirType visitVariable(TypeVariable type) {
        return type;
    }

    @Override
    public HirType visitProjection(ProjectionType type) {
        return type;
    }
}
