package com.gaiarust.hir.decl;

import com.gaiarust.hir.HirNode;
import com.gaiarust.hir.SourceLocation;

/**
 * 函数体语句基类。
 */
public abstract class HirStmt implements HirNode {

    protected final SourceLocation location;

    protected HirStmt(SourceLocation location) {
        this.location = location != null ? location : SourceLocation.UNKNOWN;
    }

    @Override
    public SourceLocation getLocation() {
        return location;
    }

    public abstract <R, C> R accept(HirStmtVisitor<R, C> visitor, C context);
}
