package com.gaiarust.hir.expr;

import com.gaiarust.hir.SourceLocation;

/**
 * 整数字面量（不带后缀）。
 */
public class HirIntLiteral extends HirExpr {

    private final long value;

    public HirIntLiteral(SourceLocation location, long value) {
        super(location);
        this.value = value;
    }

    public long getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(HirExprVisitor<R, C> visitor, C context) {
        return visitor.visitIntLiteral(this, context);
    }

    @Override
    public String toString() {
        return Long.toString(value);
    }
}
