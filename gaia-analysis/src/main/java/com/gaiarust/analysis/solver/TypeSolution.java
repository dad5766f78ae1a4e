package com.gaiarust.analysis.solver;

import com.gaiarust.hir.type.HirType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 求解成功后的绑定快照：名称 → 类型。不可变。
 */
public final class TypeSolution {

    public static final TypeSolution EMPTY = new TypeSolution(Collections.<String, HirType>emptyMap());

    private final Map<String, HirType> bindings;

    public TypeSolution(Map<String, HirType> bindings) {
        this.bindings = Collections.unmodifiableMap(new LinkedHashMap<String, HirType>(bindings));
    }

    /** 查找绑定，不存在返回 null */
    public HirType lookup(String name) {
        return bindings.get(name);
    }

    public boolean contains(String name) {
        return bindings.containsKey(name);
    }

    public Map<String, HirType> asMap() {
        return bindings;
    }

    public int size() {
        return bindings.size();
    }

    @Override
    public String toString() {
        return bindings.toString();
    }
}
