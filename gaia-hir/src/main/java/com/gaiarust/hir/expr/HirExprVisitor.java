package com.gaiarust.hir.expr;

/**
 * HIR 表达式访问者接口。
 *
 * @param <R> 返回类型
 * @param <C> 上下文类型
 */
public interface HirExprVisitor<R, C> {
    R visitVariable(HirVariable node, C context);
    R visitIntLiteral(HirIntLiteral node, C context);
    R visitFloatLiteral(HirFloatLiteral node, C context);
    R visitBoolLiteral(HirBoolLiteral node, C context);
    R visitStringLiteral(HirStringLiteral node, C context);
    R visitBinary(HirBinary node, C context);
    R visitUnary(HirUnary node, C context);
    R visitCall(HirCall node, C context);
}
