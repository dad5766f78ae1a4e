package com.gaiarust.hir.expr;

import com.gaiarust.hir.SourceLocation;

import java.util.Arrays;

/**
 * 不带源码位置的表达式工厂，供降级阶段之外的调用方（测试、JSON 读取）使用。
 */
public final class HirExprs {

    private HirExprs() {}

    public static HirVariable var(String name) {
        return new HirVariable(SourceLocation.UNKNOWN, name);
    }

    public static HirIntLiteral intLit(long value) {
        return new HirIntLiteral(SourceLocation.UNKNOWN, value);
    }

    public static HirFloatLiteral floatLit(double value) {
        return new HirFloatLiteral(SourceLocation.UNKNOWN, value);
    }

    public static HirBoolLiteral boolLit(boolean value) {
        return new HirBoolLiteral(SourceLocation.UNKNOWN, value);
    }

    public static HirStringLiteral strLit(String value) {
        return new HirStringLiteral(SourceLocation.UNKNOWN, value);
    }

    public static HirBinary binary(HirExpr left, HirBinary.BinaryOp op, HirExpr right) {
        return new HirBinary(SourceLocation.UNKNOWN, left, op, right);
    }

    public static HirUnary unary(HirUnary.UnaryOp op, HirExpr operand) {
        return new HirUnary(SourceLocation.UNKNOWN, op, operand);
    }

    public static HirCall call(String name, HirExpr... args) {
        return new HirCall(SourceLocation.UNKNOWN, name, Arrays.asList(args));
    }
}
