package com.gaiarust.hir.decl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * where 子句中的一项: genericParam: Bound1 + Bound2 ...
 * <p>
 * genericParam 可以是类型参数（T）或生命周期（'a）；
 * bound 可以是 trait 名、?Sized、生命周期（'b）或带关联类型等式的 trait（Iterator&lt;Item = u8&gt;）。
 */
public class HirWhereClause {

    private final String genericParam;
    private final List<String> bounds;

    public HirWhereClause(String genericParam, List<String> bounds) {
        this.genericParam = genericParam;
        this.bounds = bounds != null
                ? Collections.unmodifiableList(new ArrayList<String>(bounds))
                : Collections.<String>emptyList();
    }

    public String getGenericParam() {
        return genericParam;
    }

    public List<String> getBounds() {
        return bounds;
    }

    /** 约束对象是否为生命周期（'a: 'b 形式） */
    public boolean isLifetimeClause() {
        return genericParam != null && genericParam.startsWith("'");
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(genericParam).append(": ");
        for (int i = 0; i < bounds.size(); i++) {
            if (i > 0) sb.append(" + ");
            sb.append(bounds.get(i));
        }
        return sb.toString();
    }
}
