package com.gaiarust.analysis.constraint;

import com.gaiarust.analysis.DiagnosticCode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 约束存储的结构化错误值。
 */
public final class ConstraintError {

    private final DiagnosticCode code;
    private final String key;
    private final List<String> path;
    private final int limit;

    private ConstraintError(DiagnosticCode code, String key, List<String> path, int limit) {
        this.code = code;
        this.key = key;
        this.path = path == null
                ? Collections.<String>emptyList()
                : Collections.unmodifiableList(new ArrayList<String>(path));
        this.limit = limit;
    }

    /** 经过结构包含边的等式环，即无限类型（T == Vec&lt;T&gt;） */
    public static ConstraintError cyclicTypeConstraint(String key, List<String> path) {
        return new ConstraintError(DiagnosticCode.CYCLIC_TYPE_CONSTRAINT, key, path, -1);
    }

    public static ConstraintError tooManyBounds(String key, int limit) {
        return new ConstraintError(DiagnosticCode.TOO_MANY_BOUNDS, key, null, limit);
    }

    /** key 为 impl::Name */
    public static ConstraintError associatedTypeUnbound(String key) {
        return new ConstraintError(DiagnosticCode.ASSOCIATED_TYPE_UNBOUND, key, null, -1);
    }

    /** 同一关联类型绑定到两个不同的类型；path 为 [已有类型, 新类型] */
    public static ConstraintError associatedTypeConflict(String key, List<String> types) {
        return new ConstraintError(DiagnosticCode.ASSOCIATED_TYPE_CONFLICT, key, types, -1);
    }

    public static ConstraintError fixpointLimitExceeded(int limit) {
        return new ConstraintError(DiagnosticCode.FIXPOINT_LIMIT_EXCEEDED, null, null, limit);
    }

    public DiagnosticCode getCode() {
        return code;
    }

    /** 出错的类型键，没有时为 null */
    public String getKey() {
        return key;
    }

    /** 环上依次经过的名称 */
    public List<String> getPath() {
        return path;
    }

    /** 触发的上限值，不适用时为 -1 */
    public int getLimit() {
        return limit;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConstraintError)) return false;
        ConstraintError that = (ConstraintError) o;
        return code == that.code && limit == that.limit
                && Objects.equals(key, that.key) && path.equals(that.path);
    }

    @Override
    public int hashCode() {
        return Objects.hash(code, key, path, limit);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(code.name());
        if (key != null) sb.append(' ').append(key);
        if (!path.isEmpty()) sb.append(' ').append(path);
        if (limit >= 0) sb.append(" limit=").append(limit);
        return sb.toString();
    }
}
