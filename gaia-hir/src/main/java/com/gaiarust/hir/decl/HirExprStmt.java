package com.gaiarust.hir.decl;

import com.gaiarust.hir.SourceLocation;
import com.gaiarust.hir.expr.HirExpr;

/**
 * 表达式语句。函数体最后一条表达式语句视为返回值。
 */
public class HirExprStmt extends HirStmt {

    private final HirExpr expr;

    public HirExprStmt(SourceLocation location, HirExpr expr) {
        super(location);
        this.expr = expr;
    }

    public HirExpr getExpr() {
        return expr;
    }

    @Override
    public <R, C> R accept(HirStmtVisitor<R, C> visitor, C context) {
        return visitor.visitExprStmt(this, context);
    }
}
