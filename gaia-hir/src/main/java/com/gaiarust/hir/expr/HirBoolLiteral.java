package com.gaiarust.hir.expr;

import com.gaiarust.hir.SourceLocation;

/**
 * 布尔字面量。
 */
public class HirBoolLiteral extends HirExpr {

    private final boolean value;

    public HirBoolLiteral(SourceLocation location, boolean value) {
        super(location);
        this.value = value;
    }

    public boolean getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(HirExprVisitor<R, C> visitor, C context) {
        return visitor.visitBoolLiteral(this, context);
    }

    @Override
    public String toString() {
        return Boolean.toString(value);
    }
}
