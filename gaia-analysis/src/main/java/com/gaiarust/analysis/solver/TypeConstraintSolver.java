package com.gaiarust.analysis.solver;

import com.gaiarust.hir.expr.HirBinary;
import com.gaiarust.hir.expr.HirBoolLiteral;
import com.gaiarust.hir.expr.HirCall;
import com.gaiarust.hir.expr.HirExpr;
import com.gaiarust.hir.expr.HirExprVisitor;
import com.gaiarust.hir.expr.HirFloatLiteral;
import com.gaiarust.hir.expr.HirIntLiteral;
import com.gaiarust.hir.expr.HirStringLiteral;
import com.gaiarust.hir.expr.HirUnary;
import com.gaiarust.hir.expr.HirVariable;
import com.gaiarust.hir.type.HirType;
import com.gaiarust.hir.type.HirTypes;
import com.gaiarust.hir.type.NamedType;
import com.gaiarust.hir.type.PointerType;
import com.gaiarust.hir.type.ReferenceType;
import com.gaiarust.hir.type.TypeVariable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 表达式类型求解器。
 * <p>
 * 先登记变量和函数签名，再自底向上求解表达式；第一个错误即抛出 {@link TypeCheckException}。
 * 变量的声明类型保持不变（不做 let 多态）；声明为占位符的变量在使用中被细化。
 * 每个条目独占一个实例。
 */
public final class TypeConstraintSolver {

    private static final Logger LOG = Logger.getLogger(TypeConstraintSolver.class.getName());

    private final Map<String, HirType> variables = new LinkedHashMap<String, HirType>();
    private final Map<String, FunctionSignature> functions = new HashMap<String, FunctionSignature>();
    private final Substitution substitution = new Substitution();
    private final TypeUnifier unifier = new TypeUnifier(substitution);
    private final ExprTyper typer = new ExprTyper();
    private TypeRewriter signatureTypes;
    private int nextVariableId;

    // ============ 登记 ============

    /** 登记（或覆盖）变量绑定 */
    public void registerVariable(String name, HirType type) {
        if (name == null || type == null) throw new IllegalArgumentException("name and type are required");
        variables.put(name, type);
    }

    public void registerFunction(String name, List<HirType> paramTypes, HirType returnType) {
        registerFunction(new FunctionSignature(name, null, paramTypes, returnType));
    }

    /** 泛型函数：typeParams 中的名称在调用处实例化为新占位符 */
    public void registerFunction(String name, List<String> typeParams, List<HirType> paramTypes, HirType returnType) {
        registerFunction(new FunctionSignature(name, typeParams, paramTypes, returnType));
    }

    public void registerFunction(FunctionSignature signature) {
        functions.put(signature.getName(), signature);
    }

    /**
     * 调用处对被调签名的参数和返回类型先做一次改写（如展开关联类型投影），再实例化泛型参数。
     * 为 null 时按登记的原样使用。
     */
    public void setSignatureTypes(TypeRewriter signatureTypes) {
        this.signatureTypes = signatureTypes;
    }

    public FunctionSignature lookupFunction(String name) {
        return functions.get(name);
    }

    public TypeVariable freshTypeVariable() {
        return new TypeVariable(nextVariableId++);
    }

    // ============ 求解 ============

    /**
     * 求解单个表达式。
     *
     * @return 代入已知绑定后的类型
     * @throws TypeCheckException 第一个类型错误
     */
    public HirType solveExpr(HirExpr expr) {
        return substitution.apply(expr.accept(typer, null));
    }

    /** 依次求解，返回各表达式的类型 */
    public List<HirType> solveExprs(List<HirExpr> exprs) {
        List<HirType> types = new ArrayList<HirType>(exprs.size());
        for (HirExpr expr : exprs) {
            types.add(solveExpr(expr));
        }
        return types;
    }

    /**
     * let 绑定：有声明类型时与初始化表达式统一，然后登记绑定。
     *
     * @return 绑定的类型（有声明时为声明类型）
     */
    public HirType solveLet(String name, HirType declaredType, HirExpr init) {
        HirType initType = solveExpr(init);
        HirType bound = initType;
        if (declaredType != null) {
            if (!unifier.unify(declaredType, initType)) {
                throw new TypeCheckException(TypeError.bindingMismatch(
                        name, substitution.apply(declaredType), initType));
            }
            bound = declaredType;
        }
        registerVariable(name, bound);
        return substitution.apply(bound);
    }

    /**
     * 检查 found 能否作为 expected 使用（返回值、带名称的绑定）。
     *
     * @throws TypeCheckException TYPE_MISMATCH，name 为出错的绑定名
     */
    public void expect(String name, HirType expected, HirType found) {
        if (!unifier.unify(expected, found)) {
            throw new TypeCheckException(TypeError.bindingMismatch(
                    name, substitution.apply(expected), substitution.apply(found)));
        }
    }

    /**
     * 重新检查所有绑定：代入后不得含有指向自身的占位符。
     *
     * @throws TypeCheckException INFINITE_TYPE
     */
    public void validate() {
        for (Map.Entry<Integer, HirType> e : substitution.asMap().entrySet()) {
            TypeVariable variable = new TypeVariable(e.getKey());
            HirType resolved = substitution.apply(e.getValue());
            if (Substitution.occursIn(variable, resolved)) {
                throw new TypeCheckException(TypeError.infiniteType(variable, resolved));
            }
        }
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("validated " + variables.size() + " binding(s), " + substitution.size() + " placeholder(s)");
        }
    }

    /** 当前所有变量绑定代入后的快照 */
    public TypeSolution getSolution() {
        validate();
        Map<String, HirType> resolved = new LinkedHashMap<String, HirType>();
        for (Map.Entry<String, HirType> e : variables.entrySet()) {
            resolved.put(e.getKey(), substitution.apply(e.getValue()));
        }
        return new TypeSolution(resolved);
    }

    public Substitution getSubstitution() {
        return substitution;
    }

    // ============ 表达式分派 ============

    private final class ExprTyper implements HirExprVisitor<HirType, Void> {

        @Override
        public HirType visitVariable(HirVariable node, Void ctx) {
            HirType type = variables.get(node.getName());
            if (type == null) throw new TypeCheckException(TypeError.unboundVariable(node.getName()));
            return substitution.apply(type);
        }

        @Override
        public HirType visitIntLiteral(HirIntLiteral node, Void ctx) {
            return HirTypes.I32;
        }

        @Override
        public HirType visitFloatLiteral(HirFloatLiteral node, Void ctx) {
            return HirTypes.F64;
        }

        @Override
        public HirType visitBoolLiteral(HirBoolLiteral node, Void ctx) {
            return HirTypes.BOOL;
        }

        @Override
        public HirType visitStringLiteral(HirStringLiteral node, Void ctx) {
            return HirTypes.STATIC_STR;
        }

        @Override
        public HirType visitBinary(HirBinary node, Void ctx) {
            HirType left = node.getLeft().accept(this, ctx);
            HirType right = node.getRight().accept(this, ctx);
            if (!unifier.unify(left, right)) {
                throw new TypeCheckException(TypeError.typeMismatch(
                        substitution.apply(left), substitution.apply(right)));
            }
            // ! 与任何类型统一，取另一侧作为操作数类型
            HirType operand = substitution.apply(left);
            if (HirTypes.NEVER.equals(operand)) operand = substitution.apply(right);
            switch (node.getOperator().getCategory()) {
                case ARITHMETIC:
                    return requireNumeric(operand);
                case COMPARISON:
                    return HirTypes.BOOL;
                case LOGICAL:
                    if (!unifier.unify(HirTypes.BOOL, operand)) {
                        throw new TypeCheckException(TypeError.typeMismatch(HirTypes.BOOL, operand));
                    }
                    return HirTypes.BOOL;
                case BITWISE:
                default:
                    return requireInteger(operand);
            }
        }

        @Override
        public HirType visitUnary(HirUnary node, Void ctx) {
            HirType operand = substitution.apply(node.getOperand().accept(this, ctx));
            switch (node.getOperator()) {
                case NEG:
                    return requireNumeric(operand);
                case NOT:
                    if (HirTypes.isBool(operand) || HirTypes.isInteger(operand)) return operand;
                    if (operand instanceof TypeVariable) {
                        unifier.unify(HirTypes.BOOL, operand);
                        return HirTypes.BOOL;
                    }
                    throw new TypeCheckException(TypeError.typeMismatch(HirTypes.BOOL, operand));
                case REF:
                    return new ReferenceType(null, false, operand);
                case REF_MUT:
                    return new ReferenceType(null, true, operand);
                case DEREF:
                default:
                    if (operand instanceof ReferenceType) return ((ReferenceType) operand).getInner();
                    if (operand instanceof PointerType) return ((PointerType) operand).getInner();
                    throw new TypeCheckException(TypeError.notDereferenceable(operand));
            }
        }

        @Override
        public HirType visitCall(HirCall node, Void ctx) {
            FunctionSignature signature = functions.get(node.getName());
            if (signature == null) throw new TypeCheckException(TypeError.unknownFunction(node.getName()));
            List<HirExpr> args = node.getArgs();
            if (args.size() != signature.arity()) {
                throw new TypeCheckException(TypeError.arityMismatch(
                        node.getName(), signature.arity(), args.size()));
            }
            TypeRewriter instantiation = instantiate(signature);
            for (int i = 0; i < args.size(); i++) {
                HirType param = instantiation.rewrite(signatureType(signature.getParamTypes().get(i)));
                HirType arg = args.get(i).accept(this, ctx);
                if (!unifier.unify(param, arg)) {
                    throw new TypeCheckException(TypeError.argumentMismatch(
                            node.getName(), substitution.apply(param), substitution.apply(arg), i));
                }
            }
            return substitution.apply(instantiation.rewrite(signatureType(signature.getReturnType())));
        }
    }

    private HirType signatureType(HirType declared) {
        return signatureTypes != null ? signatureTypes.rewrite(declared) : declared;
    }

    /** 算术操作数：未解析的占位符默认为 i32 */
    private HirType requireNumeric(HirType operand) {
        if (HirTypes.NEVER.equals(operand)) return operand;
        if (operand instanceof TypeVariable) {
            substitution.bind((TypeVariable) operand, HirTypes.I32);
            return HirTypes.I32;
        }
        if (!HirTypes.isNumeric(operand)) throw new TypeCheckException(TypeError.nonNumericOperand(operand));
        return operand;
    }

    private HirType requireInteger(HirType operand) {
        if (HirTypes.NEVER.equals(operand)) return operand;
        if (operand instanceof TypeVariable) {
            substitution.bind((TypeVariable) operand, HirTypes.I32);
            return HirTypes.I32;
        }
        if (!HirTypes.isInteger(operand)) throw new TypeCheckException(TypeError.nonNumericOperand(operand));
        return operand;
    }

    /** 泛型签名的类型参数替换为本次调用专用的新占位符 */
    private TypeRewriter instantiate(FunctionSignature signature) {
        final Map<String, HirType> fresh;
        if (signature.isGeneric()) {
            fresh = new HashMap<String, HirType>();
            for (String typeParam : signature.getTypeParams()) {
                fresh.put(typeParam, freshTypeVariable());
            }
        } else {
            fresh = Collections.emptyMap();
        }
        return new TypeRewriter() {
            @Override
            public HirType visitNamed(NamedType type) {
                HirType replacement = type.hasTypeArgs() ? null : fresh.get(type.getName());
                return replacement != null ? replacement : super.visitNamed(type);
            }
        };
    }
}
