package com.gaiarust.analysis.solver;

import com.gaiarust.analysis.DiagnosticCode;
import com.gaiarust.hir.type.HirType;

import java.util.Objects;

/**
 * 类型求解的结构化错误值。
 * 不适用的字段为 null（类型 / 名称）或 -1（数量 / 位置）。
 */
public final class TypeError {

    private final DiagnosticCode code;
    private final String name;
    private final HirType expected;
    private final HirType found;
    private final int expectedCount;
    private final int foundCount;
    private final int position;

    private TypeError(DiagnosticCode code, String name, HirType expected, HirType found,
                      int expectedCount, int foundCount, int position) {
        this.code = code;
        this.name = name;
        this.expected = expected;
        this.found = found;
        this.expectedCount = expectedCount;
        this.foundCount = foundCount;
        this.position = position;
    }

    public static TypeError unboundVariable(String name) {
        return new TypeError(DiagnosticCode.UNBOUND_VARIABLE, name, null, null, -1, -1, -1);
    }

    public static TypeError unknownFunction(String name) {
        return new TypeError(DiagnosticCode.UNKNOWN_FUNCTION, name, null, null, -1, -1, -1);
    }

    public static TypeError arityMismatch(String function, int expected, int found) {
        return new TypeError(DiagnosticCode.ARITY_MISMATCH, function, null, null, expected, found, -1);
    }

    public static TypeError typeMismatch(HirType expected, HirType found) {
        return new TypeError(DiagnosticCode.TYPE_MISMATCH, null, expected, found, -1, -1, -1);
    }

    /** 调用实参不匹配；position 从 0 开始 */
    public static TypeError argumentMismatch(String function, HirType expected, HirType found, int position) {
        return new TypeError(DiagnosticCode.TYPE_MISMATCH, function, expected, found, -1, -1, position);
    }

    /** 带名称的不匹配（let 声明类型、返回类型） */
    public static TypeError bindingMismatch(String name, HirType expected, HirType found) {
        return new TypeError(DiagnosticCode.TYPE_MISMATCH, name, expected, found, -1, -1, -1);
    }

    public static TypeError nonNumericOperand(HirType found) {
        return new TypeError(DiagnosticCode.NON_NUMERIC_OPERAND, null, null, found, -1, -1, -1);
    }

    public static TypeError notDereferenceable(HirType found) {
        return new TypeError(DiagnosticCode.NOT_DEREFERENCEABLE, null, null, found, -1, -1, -1);
    }

    /** 占位符出现在自己要绑定的类型中 */
    public static TypeError infiniteType(HirType variable, HirType type) {
        return new TypeError(DiagnosticCode.INFINITE_TYPE, null, variable, type, -1, -1, -1);
    }

    public DiagnosticCode getCode() {
        return code;
    }

    /** 变量名、函数名或绑定名 */
    public String getName() {
        return name;
    }

    public HirType getExpected() {
        return expected;
    }

    public HirType getFound() {
        return found;
    }

    public int getExpectedCount() {
        return expectedCount;
    }

    public int getFoundCount() {
        return foundCount;
    }

    public int getPosition() {
        return position;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TypeError)) return false;
        TypeError that = (TypeError) o;
        return code == that.code && expectedCount == that.expectedCount
                && foundCount == that.foundCount && position == that.position
                && Objects.equals(name, that.name)
                && Objects.equals(expected, that.expected)
                && Objects.equals(found, that.found);
    }

    @Override
    public int hashCode() {
        return Objects.hash(code, name, expected, found, expectedCount, foundCount, position);
    }

    @Override
    public String toString() {
        switch (code) {
            case UNBOUND_VARIABLE:
                return "unbound variable '" + name + "'";
            case UNKNOWN_FUNCTION:
                return "unknown function '" + name + "'";
            case ARITY_MISMATCH:
                return "'" + name + "' expects " + expectedCount + " argument(s), found " + foundCount;
            case TYPE_MISMATCH:
                StringBuilder sb = new StringBuilder("expected ").append(expected.toDisplayString())
                        .append(", found ").append(found.toDisplayString());
                if (position >= 0) sb.append(" (argument ").append(position).append(" of '").append(name).append("')");
                else if (name != null) sb.append(" ('").append(name).append("')");
                return sb.toString();
            case NON_NUMERIC_OPERAND:
                return "operand of type " + found.toDisplayString() + " is not numeric";
            case NOT_DEREFERENCEABLE:
                return "type " + found.toDisplayString() + " cannot be dereferenced";
            case INFINITE_TYPE:
                return "infinite type: " + expected.toDisplayString() + " occurs in " + found.toDisplayString();
            default:
                return code.name();
        }
    }
}
