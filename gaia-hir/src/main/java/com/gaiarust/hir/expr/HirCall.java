package com.gaiarust.hir.expr;

import com.gaiarust.hir.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 函数调用表达式，按名称调用已登记签名的函数。
 */
public class HirCall extends HirExpr {

    private final String name;
    private final List<HirExpr> args;

    public HirCall(SourceLocation location, String name, List<HirExpr> args) {
        super(location);
        this.name = name;
        this.args = args != null && !args.isEmpty()
                ? Collections.unmodifiableList(new ArrayList<HirExpr>(args))
                : Collections.<HirExpr>emptyList();
    }

    public String getName() {
        return name;
    }

    public List<HirExpr> getArgs() {
        return args;
    }

    @Override
    public <R, C> R accept(HirExprVisitor<R, C> visitor, C context) {
        return visitor.visitCall(this, context);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(name).append('(');
        for (int i = 0; i < args.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(args.get(i));
        }
        return sb.append(')').toString();
    }
}
