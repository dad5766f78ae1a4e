package com.gaiarust.hir.expr;

import com.gaiarust.hir.SourceLocation;

/**
 * 浮点字面量。
 */
public class HirFloatLiteral extends HirExpr {

    private final double value;

    public HirFloatLiteral(SourceLocation location, double value) {
        super(location);
        this.value = value;
    }

    public double getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(HirExprVisitor<R, C> visitor, C context) {
        return visitor.visitFloatLiteral(this, context);
    }

    @Override
    public String toString() {
        return Double.toString(value);
    }
}
