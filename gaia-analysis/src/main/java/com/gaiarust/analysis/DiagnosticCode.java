package com.gaiarust.analysis;

/**
 * 语义错误分类。各求解器的结构化错误值都携带其中一个代码。
 */
public enum DiagnosticCode {
    // 类型求解
    UNBOUND_VARIABLE,
    ARITY_MISMATCH,
    TYPE_MISMATCH,
    UNKNOWN_FUNCTION,
    NON_NUMERIC_OPERAND,
    NOT_DEREFERENCEABLE,
    INFINITE_TYPE,

    // 约束存储
    CYCLIC_TYPE_CONSTRAINT,
    TOO_MANY_BOUNDS,

    // 生命周期
    UNREGISTERED_LIFETIME,
    CYCLIC_LIFETIME,
    AMBIGUOUS_RETURN_LIFETIME,

    // 关联类型
    ASSOCIATED_TYPE_UNBOUND,
    ASSOCIATED_TYPE_CONFLICT,

    // 不动点迭代超出上限
    FIXPOINT_LIMIT_EXCEEDED
}
