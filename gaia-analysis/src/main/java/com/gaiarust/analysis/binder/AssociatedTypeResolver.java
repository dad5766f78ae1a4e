package com.gaiarust.analysis.binder;

import com.gaiarust.analysis.constraint.ConstraintError;
import com.gaiarust.analysis.constraint.ConstraintException;
import com.gaiarust.analysis.solver.TypeRewriter;
import com.gaiarust.hir.decl.HirImpl;
import com.gaiarust.hir.type.HirType;
import com.gaiarust.hir.type.ProjectionType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 关联类型绑定表：(implId, 名称) → 具体类型。
 * 只做显式绑定的查找，未绑定即报错，不做推断。
 */
public final class AssociatedTypeResolver {

    private final Map<String, Map<String, HirType>> bindings = new LinkedHashMap<String, Map<String, HirType>>();

    /**
     * 绑定 implId::assocName = type。重复绑定到相同类型不报错。
     *
     * @throws ConstraintException ASSOCIATED_TYPE_CONFLICT
     */
    public void bind(String implId, String assocName, HirType type) {
        Map<String, HirType> impl = bindings.get(implId);
        if (impl == null) {
            impl = new LinkedHashMap<String, HirType>();
            bindings.put(implId, impl);
        }
        HirType existing = impl.get(assocName);
        if (existing != null && !existing.equals(type)) {
            throw new ConstraintException(ConstraintError.associatedTypeConflict(key(implId, assocName),
                    Arrays.asList(existing.toDisplayString(), type.toDisplayString())));
        }
        impl.put(assocName, type);
    }

    /** 登记 impl 块中的所有 type X = Y */
    public void registerImpl(HirImpl impl) {
        for (Map.Entry<String, HirType> e : impl.getAssocTypeBindings().entrySet()) {
            bind(impl.getImplId(), e.getKey(), e.getValue());
        }
    }

    public boolean isBound(String implId, String assocName) {
        Map<String, HirType> impl = bindings.get(implId);
        return impl != null && impl.containsKey(assocName);
    }

    /**
     * @throws ConstraintException ASSOCIATED_TYPE_UNBOUND
     */
    public HirType resolve(String implId, String assocName) {
        Map<String, HirType> impl = bindings.get(implId);
        HirType type = impl != null ? impl.get(assocName) : null;
        if (type == null) {
            throw new ConstraintException(ConstraintError.associatedTypeUnbound(key(implId, assocName)));
        }
        return type;
    }

    /** implId 下的所有绑定 */
    public Map<String, HirType> bindingsOf(String implId) {
        Map<String, HirType> impl = bindings.get(implId);
        return impl != null
                ? Collections.unmodifiableMap(impl)
                : Collections.<String, HirType>emptyMap();
    }

    /**
     * 替换 type 中所有投影。绑定的目标本身含投影时继续替换；
     * 绑定之间互相引用成环时报 CYCLIC_TYPE_CONSTRAINT。
     */
    public HirType resolveType(HirType type) {
        return new ProjectionExpander().rewrite(type);
    }

    private final class ProjectionExpander extends TypeRewriter {
        private final Set<String> inProgress = new LinkedHashSet<String>();

        @Override
        public HirType visitProjection(ProjectionType type) {
            String key = key(type.getImplId(), type.getAssocName());
            if (!inProgress.add(key)) {
                List<String> path = new ArrayList<String>(inProgress);
                path.add(key);
                throw new ConstraintException(ConstraintError.cyclicTypeConstraint(key, path));
            }
            HirType resolved = rewrite(resolve(type.getImplId(), type.getAssocName()));
            inProgress.remove(key);
            return resolved;
        }
    }

    private static String key(String implId, String assocName) {
        return implId + "::" + assocName;
    }
}
