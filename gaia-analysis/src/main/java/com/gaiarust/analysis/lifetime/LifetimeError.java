package com.gaiarust.analysis.lifetime;

import com.gaiarust.analysis.DiagnosticCode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 生命周期检查的结构化错误值。
 */
public final class LifetimeError {

    private final DiagnosticCode code;
    private final String name;
    private final List<Lifetime> path;
    private final List<String> reasons;
    private final int limit;

    private LifetimeError(DiagnosticCode code, String name, List<Lifetime> path, List<String> reasons, int limit) {
        this.code = code;
        this.name = name;
        this.path = path == null
                ? Collections.<Lifetime>emptyList()
                : Collections.unmodifiableList(new ArrayList<Lifetime>(path));
        this.reasons = reasons == null
                ? Collections.<String>emptyList()
                : Collections.unmodifiableList(new ArrayList<String>(reasons));
        this.limit = limit;
    }

    /** name 不带撇号 */
    public static LifetimeError unregisteredLifetime(String name) {
        return new LifetimeError(DiagnosticCode.UNREGISTERED_LIFETIME, name, null, null, -1);
    }

    /** path 首尾相同：'a → 'b → 'a */
    public static LifetimeError cyclicLifetime(List<Lifetime> path, List<String> reasons) {
        return new LifetimeError(DiagnosticCode.CYCLIC_LIFETIME, null, path, reasons, -1);
    }

    /** 返回引用无法从参数确定生命周期；name 为函数名 */
    public static LifetimeError ambiguousReturnLifetime(String function) {
        return new LifetimeError(DiagnosticCode.AMBIGUOUS_RETURN_LIFETIME, function, null, null, -1);
    }

    public static LifetimeError fixpointLimitExceeded(int limit) {
        return new LifetimeError(DiagnosticCode.FIXPOINT_LIMIT_EXCEEDED, null, null, null, limit);
    }

    public DiagnosticCode getCode() {
        return code;
    }

    public String getName() {
        return name;
    }

    public List<Lifetime> getPath() {
        return path;
    }

    /** 环上每条边的原因，与 path 中相邻两项对应 */
    public List<String> getReasons() {
        return reasons;
    }

    public int getLimit() {
        return limit;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LifetimeError)) return false;
        LifetimeError that = (LifetimeError) o;
        return code == that.code && limit == that.limit && Objects.equals(name, that.name)
                && path.equals(that.path) && reasons.equals(that.reasons);
    }

    @Override
    public int hashCode() {
        return Objects.hash(code, name, path, reasons, limit);
    }

    @Override
    public String toString() {
        switch (code) {
            case UNREGISTERED_LIFETIME:
                return "use of unregistered lifetime '" + name;
            case CYCLIC_LIFETIME:
                StringBuilder sb = new StringBuilder("cyclic outlives constraints: ");
                for (int i = 0; i < path.size(); i++) {
                    if (i > 0) sb.append(" -> ");
                    sb.append(path.get(i).toDisplayString());
                }
                return sb.toString();
            case AMBIGUOUS_RETURN_LIFETIME:
                return "cannot infer the lifetime of the returned reference of '" + name + "'";
            case FIXPOINT_LIMIT_EXCEEDED:
                return "lifetime closure exceeded " + limit + " iteration(s)";
            default:
                return code.name();
        }
    }
}
