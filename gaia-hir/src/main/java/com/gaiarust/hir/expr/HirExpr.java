package com.gaiarust.hir.expr;

import com.gaiarust.hir.HirNode;
import com.gaiarust.hir.SourceLocation;

/**
 * HIR 表达式基类。
 */
public abstract class HirExpr implements HirNode {

    protected final SourceLocation location;

    protected HirExpr(SourceLocation location) {
        this.location = location != null ? location : SourceLocation.UNKNOWN;
    }

    @Override
    public SourceLocation getLocation() {
        return location;
    }

    public abstract <R, C> R accept(HirExprVisitor<R, C> visitor, C context);
}
