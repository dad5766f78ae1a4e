package com.gaiarust.hir.expr;

import com.gaiarust.hir.SourceLocation;

/**
 * 一元表达式: -x, !x, &amp;x, &amp;mut x, *x
 */
public class HirUnary extends HirExpr {
    private final UnaryOp operator;
    private final HirExpr operand;

    public HirUnary(SourceLocation location, UnaryOp operator, HirExpr operand) {
        super(location);
        this.operator = operator;
        this.operand = operand;
    }

    public UnaryOp getOperator() {
        return operator;
    }

    public HirExpr getOperand() {
        return operand;
    }

    @Override
    public <R, C> R accept(HirExprVisitor<R, C> visitor, C context) {
        return visitor.visitUnary(this, context);
    }

    @Override
    public String toString() {
        return operator.toSourceString() + operand;
    }

    /**
     * 一元运算符
     */
    public enum UnaryOp {
        NEG("-"),
        NOT("!"),
        REF("&"),
        REF_MUT("&mut "),
        DEREF("*");

        private final String source;

        UnaryOp(String source) {
            this.source = source;
        }

        public String toSourceString() {
            return source;
        }

        /** 根据源码运算符查找（忽略首尾空白），未知返回 null */
        public static UnaryOp fromSource(String source) {
            String trimmed = source.trim();
            for (UnaryOp op : values()) {
                if (op.source.trim().equals(trimmed)) return op;
            }
            return null;
        }
    }
}
