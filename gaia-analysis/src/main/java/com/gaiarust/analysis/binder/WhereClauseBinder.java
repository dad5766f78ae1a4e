package com.gaiarust.analysis.binder;

import com.gaiarust.analysis.AnalysisConfig;
import com.gaiarust.analysis.constraint.Constraint;
import com.gaiarust.analysis.constraint.ConstraintError;
import com.gaiarust.analysis.constraint.ConstraintException;
import com.gaiarust.analysis.constraint.ConstraintSet;
import com.gaiarust.analysis.lifetime.LifetimeContext;
import com.gaiarust.hir.decl.HirWhereClause;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * where 子句 → 约束。
 * <ul>
 *   <li>{@code T: Clone + Debug} → 每个 trait 一条 TraitBound</li>
 *   <li>{@code T: 'a} → LifetimeBound</li>
 *   <li>{@code T: ?Sized} → 取消隐式的 SizedBound</li>
 *   <li>{@code T: Iterator<Item = u8>} → TraitBound(T, Iterator) + TypeEquality(&lt;T as Iterator&gt;::Item, u8)</li>
 *   <li>{@code 'a: 'b} → 生命周期上下文中的 outlives 约束</li>
 * </ul>
 */
public final class WhereClauseBinder {

    private static final String RELAX_SIZED = "?Sized";

    private final AnalysisConfig config;

    public WhereClauseBinder() {
        this(new AnalysisConfig());
    }

    public WhereClauseBinder(AnalysisConfig config) {
        this.config = config;
    }

    /** 降级单个类型 where 子句；生命周期子句返回空列表 */
    public List<Constraint> lower(HirWhereClause clause) {
        List<Constraint> result = new ArrayList<Constraint>();
        if (clause.isLifetimeClause()) return result;
        String type = clause.getGenericParam();
        for (String raw : clause.getBounds()) {
            String bound = raw.trim();
            if (bound.isEmpty() || bound.equals(RELAX_SIZED)) continue;
            if (bound.equals("Sized")) {
                result.add(Constraint.sizedBound(type));
            } else if (bound.startsWith("'")) {
                result.add(Constraint.lifetimeBound(type, bound));
            } else {
                lowerTraitBound(type, bound, result);
            }
        }
        return result;
    }

    private static void lowerTraitBound(String type, String bound, List<Constraint> out) {
        int lt = bound.indexOf('<');
        if (lt < 0 || !bound.endsWith(">")) {
            out.add(Constraint.traitBound(type, bound));
            return;
        }
        String traitName = bound.substring(0, lt).trim();
        List<String> plainArgs = new ArrayList<String>();
        List<String[]> assocEqualities = new ArrayList<String[]>();
        for (String arg : splitTopLevel(bound.substring(lt + 1, bound.length() - 1))) {
            int eq = topLevelEquals(arg);
            if (eq > 0) {
                assocEqualities.add(new String[]{arg.substring(0, eq).trim(), arg.substring(eq + 1).trim()});
            } else if (!arg.isEmpty()) {
                plainArgs.add(arg);
            }
        }
        String traitRef = plainArgs.isEmpty() ? traitName : traitName + "<" + join(plainArgs) + ">";
        out.add(Constraint.traitBound(type, traitRef));
        for (String[] eq : assocEqualities) {
            out.add(Constraint.typeEquality("<" + type + " as " + traitRef + ">::" + eq[0], eq[1]));
        }
    }

    /**
     * 为条目作用域建立约束集：每个类型参数一条隐式 SizedBound（?Sized 时省略），再加入所有子句。
     *
     * @throws ConstraintException TOO_MANY_BOUNDS
     */
    public ConstraintSet bindGenerics(List<String> typeParams, List<HirWhereClause> clauses) {
        Set<String> relaxed = new HashSet<String>();
        Map<String, Integer> boundCounts = new LinkedHashMap<String, Integer>();
        for (HirWhereClause clause : clauses) {
            if (clause.isLifetimeClause()) continue;
            String type = clause.getGenericParam();
            for (String bound : clause.getBounds()) {
                if (bound.trim().equals(RELAX_SIZED)) relaxed.add(type);
            }
            Integer before = boundCounts.get(type);
            int count = (before != null ? before : 0) + clause.getBounds().size();
            if (count > config.getMaxBoundsPerType()) {
                throw new ConstraintException(ConstraintError.tooManyBounds(type, config.getMaxBoundsPerType()));
            }
            boundCounts.put(type, count);
        }

        ConstraintSet set = new ConstraintSet(config);
        for (String typeParam : typeParams) {
            if (!relaxed.contains(typeParam)) set.addConstraint(Constraint.sizedBound(typeParam));
        }
        for (HirWhereClause clause : clauses) {
            for (Constraint c : lower(clause)) {
                set.addConstraint(c);
            }
        }
        return set;
    }

    /**
     * 'a: 'b + 'c 子句加入生命周期上下文。
     *
     * @return 加入的约束数量
     * @throws com.gaiarust.analysis.lifetime.LifetimeException UNREGISTERED_LIFETIME
     */
    public int bindLifetimeBounds(List<HirWhereClause> clauses, LifetimeContext ctx) {
        int added = 0;
        for (HirWhereClause clause : clauses) {
            if (!clause.isLifetimeClause()) continue;
            for (String bound : clause.getBounds()) {
                String reason = "where " + clause.getGenericParam() + ": " + bound.trim();
                if (ctx.addOutlivesConstraint(clause.getGenericParam(), bound.trim(), reason)) added++;
            }
        }
        return added;
    }

    // ============ 语法工具 ============

    private static List<String> splitTopLevel(String s) {
        List<String> parts = new ArrayList<String>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '<' || c == '(' || c == '[') depth++;
            else if (c == '>' || c == ')' || c == ']') depth--;
            else if (c == ',' && depth == 0) {
                parts.add(s.substring(start, i).trim());
                start = i + 1;
            }
        }
        parts.add(s.substring(start).trim());
        return parts;
    }

    private static int topLevelEquals(String arg) {
        int depth = 0;
        for (int i = 0; i < arg.length(); i++) {
            char c = arg.charAt(i);
            if (c == '<' || c == '(' || c == '[') depth++;
            else if (c == '>' || c == ')' || c == ']') depth--;
            else if (c == '=' && depth == 0) return i;
        }
        return -1;
    }

    private static String join(List<String> parts) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < parts.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(parts.get(i));
        }
        return sb.toString();
    }
}
