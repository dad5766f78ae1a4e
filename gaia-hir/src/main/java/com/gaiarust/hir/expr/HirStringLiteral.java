package com.gaiarust.hir.expr;

import com.gaiarust.hir.SourceLocation;

/**
 * 字符串字面量，类型为 &amp;'static str。
 */
public class HirStringLiteral extends HirExpr {

    private final String value;

    public HirStringLiteral(SourceLocation location, String value) {
        super(location);
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(HirExprVisitor<R, C> visitor, C context) {
        return visitor.visitStringLiteral(this, context);
    }

    @Override
    public String toString() {
        return '"' + value + '"';
    }
}
