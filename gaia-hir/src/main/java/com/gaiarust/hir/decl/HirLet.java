package com.gaiarust.hir.decl;

import com.gaiarust.hir.SourceLocation;
import com.gaiarust.hir.expr.HirExpr;
import com.gaiarust.hir.type.HirType;

/**
 * let 绑定: let name[: declaredType] = init
 */
public class HirLet extends HirStmt {

    private final String name;
    private final HirType declaredType;
    private final HirExpr init;

    public HirLet(SourceLocation location, String name, HirType declaredType, HirExpr init) {
        super(location);
        this.name = name;
        this.declaredType = declaredType;
        this.init = init;
    }

    public String getName() {
        return name;
    }

    /** 未标注类型时为 null */
    public HirType getDeclaredType() {
        return declaredType;
    }

    public boolean hasDeclaredType() {
        return declaredType != null;
    }

    public HirExpr getInit() {
        return init;
    }

    @Override
    public <R, C> R accept(HirStmtVisitor<R, C> visitor, C context) {
        return visitor.visitLet(this, context);
    }
}
