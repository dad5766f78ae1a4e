package com.gaiarust.hir.expr;

import com.gaiarust.hir.SourceLocation;

/**
 * 变量引用。
 */
public class HirVariable extends HirExpr {

    private final String name;

    public HirVariable(SourceLocation location, String name) {
        super(location);
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public <R, C> R accept(HirExprVisitor<R, C> visitor, C context) {
        return visitor.visitVariable(this, context);
    }

    @Override
    public String toString() {
        return name;
    }
}
