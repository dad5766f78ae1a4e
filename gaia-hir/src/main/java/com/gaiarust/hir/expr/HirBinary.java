package com.gaiarust.hir.expr;

import com.gaiarust.hir.SourceLocation;

/**
 * 二元表达式
 */
public class HirBinary extends HirExpr {
    private final HirExpr left;
    private final BinaryOp operator;
    private final HirExpr right;

    public HirBinary(SourceLocation location, HirExpr left, BinaryOp operator, HirExpr right) {
        super(location);
        this.left = left;
        this.operator = operator;
        this.right = right;
    }

    public HirExpr getLeft() {
        return left;
    }

    public BinaryOp getOperator() {
        return operator;
    }

    public HirExpr getRight() {
        return right;
    }

    @Override
    public <R, C> R accept(HirExprVisitor<R, C> visitor, C context) {
        return visitor.visitBinary(this, context);
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator.toSourceString() + " " + right + ")";
    }

    /**
     * 二元运算符
     */
    public enum BinaryOp {
        // 算术
        ADD("+", Category.ARITHMETIC),
        SUB("-", Category.ARITHMETIC),
        MUL("*", Category.ARITHMETIC),
        DIV("/", Category.ARITHMETIC),
        MOD("%", Category.ARITHMETIC),

        // 比较
        EQ("==", Category.COMPARISON),
        NE("!=", Category.COMPARISON),
        LT("<", Category.COMPARISON),
        GT(">", Category.COMPARISON),
        LE("<=", Category.COMPARISON),
        GE(">=", Category.COMPARISON),

        // 逻辑
        AND("&&", Category.LOGICAL),
        OR("||", Category.LOGICAL),

        // 位运算
        BIT_AND("&", Category.BITWISE),
        BIT_OR("|", Category.BITWISE),
        BIT_XOR("^", Category.BITWISE),
        SHL("<<", Category.BITWISE),
        SHR(">>", Category.BITWISE);

        /** 运算符分组，决定操作数要求和结果类型 */
        public enum Category {
            ARITHMETIC, COMPARISON, LOGICAL, BITWISE
        }

        private final String source;
        private final Category category;

        BinaryOp(String source, Category category) {
            this.source = source;
            this.category = category;
        }

        /** 返回源码中对应的运算符 */
        public String toSourceString() {
            return source;
        }

        public Category getCategory() {
            return category;
        }

        /** 根据源码运算符查找，未知返回 null */
        public static BinaryOp fromSource(String source) {
            for (BinaryOp op : values()) {
                if (op.source.equals(source)) return op;
            }
            return null;
        }
    }
}
