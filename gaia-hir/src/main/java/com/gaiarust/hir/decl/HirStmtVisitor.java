package com.gaiarust.hir.decl;

/**
 * 语句访问者接口。
 */
public interface HirStmtVisitor<R, C> {
    R visitLet(HirLet node, C context);
    R visitExprStmt(HirExprStmt node, C context);
}
