package com.gaiarust.analysis.solver;

import com.gaiarust.hir.type.HirType;
import com.gaiarust.hir.type.TypeVariable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 类型占位符的绑定表。绑定前做 occurs 检查，因此表中不存在 ?T0 := Vec&lt;?T0&gt; 这样的绑定。
 */
public final class Substitution {

    private final Map<Integer, HirType> bindings = new LinkedHashMap<Integer, HirType>();

    private final TypeRewriter applier = new TypeRewriter() {
        @Override
        public HirType visitVariable(TypeVariable type) {
            HirType bound = bindings.get(type.getId());
            return bound != null ? rewrite(bound) : type;
        }
    };

    /**
     * 绑定占位符。
     *
     * @throws TypeCheckException INFINITE_TYPE，当 variable 出现在 type 内部
     */
    public void bind(TypeVariable variable, HirType type) {
        HirType resolved = apply(type);
        if (resolved.equals(variable)) return;
        if (occursIn(variable, resolved)) {
            throw new TypeCheckException(TypeError.infiniteType(variable, resolved));
        }
        HirType existing = bindings.get(variable.getId());
        if (existing != null) {
            throw new IllegalStateException(variable + " is already bound to " + existing);
        }
        bindings.put(variable.getId(), resolved);
    }

    /** 把已知绑定代入 type，直到不含已绑定的占位符 */
    public HirType apply(HirType type) {
        return applier.rewrite(type);
    }

    public boolean isBound(TypeVariable variable) {
        return bindings.containsKey(variable.getId());
    }

    public Map<Integer, HirType> asMap() {
        return Collections.unmodifiableMap(bindings);
    }

    public int size() {
        return bindings.size();
    }

    /** variable 是否出现在 type 中（type 应已代入） */
    public static boolean occursIn(final TypeVariable variable, HirType type) {
        final boolean[] found = {false};
        new TypeRewriter() {
            @Override
            public HirType visitVariable(TypeVariable candidate) {
                if (candidate.equals(variable)) found[0] = true;
                return candidate;
            }
        }.rewrite(type);
        return found[0];
    }
}
