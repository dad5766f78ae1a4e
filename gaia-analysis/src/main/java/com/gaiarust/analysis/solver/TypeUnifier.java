package com.gaiarust.analysis.solver;

import com.gaiarust.hir.type.HirType;
import com.gaiarust.hir.type.HirTypeVisitor;
import com.gaiarust.hir.type.HirTypes;
import com.gaiarust.hir.type.NamedType;
import com.gaiarust.hir.type.PointerType;
import com.gaiarust.hir.type.PrimitiveType;
import com.gaiarust.hir.type.ProjectionType;
import com.gaiarust.hir.type.ReferenceType;
import com.gaiarust.hir.type.StringType;
import com.gaiarust.hir.type.TraitObjectType;
import com.gaiarust.hir.type.TypeVariable;
import com.gaiarust.hir.type.VecType;

import java.util.List;

/**
 * 类型统一。
 * <p>
 * 两侧先代入已知绑定；任一侧为占位符时绑定它，否则按结构逐层比较。
 * 引用比较可变性和被引用类型，生命周期由生命周期求解器负责，这里忽略。
 * 数值类型之间不做隐式提升。{@code !} 与任何类型统一。
 */
public final class TypeUnifier {

    private final Substitution substitution;

    public TypeUnifier(Substitution substitution) {
        this.substitution = substitution;
    }

    /**
     * @return 两个类型能否统一；能统一时顺带记录占位符绑定
     * @throws TypeCheckException INFINITE_TYPE
     */
    public boolean unify(HirType expected, HirType found) {
        final HirType a = substitution.apply(expected);
        final HirType b = substitution.apply(found);
        if (a.equals(b)) return true;

        if (a instanceof TypeVariable) {
            substitution.bind((TypeVariable) a, b);
            return true;
        }
        if (b instanceof TypeVariable) {
            substitution.bind((TypeVariable) b, a);
            return true;
        }
        if (HirTypes.NEVER.equals(a) || HirTypes.NEVER.equals(b)) return true;

        return a.accept(new HirTypeVisitor<Boolean>() {
            @Override
            public Boolean visitVec(VecType type) {
                return b instanceof VecType && unify(type.getElement(), ((VecType) b).getElement());
            }

            @Override
            public Boolean visitNamed(NamedType type) {
                if (!(b instanceof NamedType)) return false;
                NamedType other = (NamedType) b;
                return type.getName().equals(other.getName())
                        && unifyAll(type.getTypeArgs(), other.getTypeArgs());
            }

            @Override
            public Boolean visitReference(ReferenceType type) {
                if (!(b instanceof ReferenceType)) return false;
                ReferenceType other = (ReferenceType) b;
                return type.isMutable() == other.isMutable() && unify(type.getInner(), other.getInner());
            }

            @Override
            public Boolean visitPointer(PointerType type) {
                if (!(b instanceof PointerType)) return false;
                PointerType other = (PointerType) b;
                return type.isMutable() == other.isMutable() && unify(type.getInner(), other.getInner());
            }

            // 叶子类型：已在 equals 中比较过
            @Override
            public Boolean visitPrimitive(PrimitiveType type) { return false; }
            @Override
            public Boolean visitString(StringType type) { return false; }
            @Override
            public Boolean visitTraitObject(TraitObjectType type) { return false; }
            @Override
            public Boolean visitVariable(TypeVariable type) { return false; }
            @Override
            public Boolean visitProjection(ProjectionType type) { return false; }
        });
    }

    private boolean unifyAll(List<HirType> left, List<HirType> right) {
        if (left.size() != right.size()) return false;
        for (int i = 0; i < left.size(); i++) {
            if (!unify(left.get(i), right.get(i))) return false;
        }
        return true;
    }
}
