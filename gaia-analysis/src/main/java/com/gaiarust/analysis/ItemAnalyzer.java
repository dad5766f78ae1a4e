package com.gaiarust.analysis;

import com.gaiarust.analysis.binder.AssociatedTypeResolver;
import com.gaiarust.analysis.binder.WhereClauseBinder;
import com.gaiarust.analysis.constraint.Constraint;
import com.gaiarust.analysis.constraint.ConstraintSet;
import com.gaiarust.analysis.lifetime.ElisionResult;
import com.gaiarust.analysis.lifetime.LifetimeContext;
import com.gaiarust.analysis.lifetime.LifetimeElision;
import com.gaiarust.analysis.lifetime.LifetimeError;
import com.gaiarust.analysis.lifetime.LifetimeException;
import com.gaiarust.analysis.lifetime.LifetimeSolver;
import com.gaiarust.analysis.solver.FunctionSignature;
import com.gaiarust.analysis.solver.TypeConstraintSolver;
import com.gaiarust.analysis.solver.TypeRewriter;
import com.gaiarust.hir.decl.HirExprStmt;
import com.gaiarust.hir.decl.HirFunction;
import com.gaiarust.hir.decl.HirLet;
import com.gaiarust.hir.decl.HirParam;
import com.gaiarust.hir.decl.HirStmt;
import com.gaiarust.hir.decl.HirStmtVisitor;
import com.gaiarust.hir.type.HirType;
import com.gaiarust.hir.type.HirTypes;
import com.gaiarust.hir.type.ProjectionType;
import com.gaiarust.hir.type.ReferenceType;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 单个条目（函数或 impl 方法）的分析。
 * <p>
 * 依次执行 where 约束、生命周期、类型三个阶段，每次分析都使用新建的约束集、
 * 生命周期上下文和类型求解器，第一个错误即终止该条目。
 * 模块级的签名表和关联类型绑定只读共享，因此同一模块的条目可以并行分析，
 * 但单个 ItemAnalyzer 实例不应跨线程使用。
 */
public final class ItemAnalyzer {

    private static final Logger LOG = Logger.getLogger(ItemAnalyzer.class.getName());

    private final AnalysisConfig config;
    private final List<FunctionSignature> signatures;
    private final AssociatedTypeResolver assocTypes;
    private final WhereClauseBinder binder;

    public ItemAnalyzer(AnalysisConfig config, List<FunctionSignature> signatures, AssociatedTypeResolver assocTypes) {
        this.config = config;
        this.signatures = signatures;
        this.assocTypes = assocTypes;
        this.binder = new WhereClauseBinder(config);
    }

    /**
     * @param itemName 报告用名称，impl 方法为 implId::method
     * @throws AnalysisException 第一个错误
     */
    public ItemResult analyze(String itemName, HirFunction function) {
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("analyzing " + itemName);
        }

        // 1. where 约束
        ConstraintSet constraints = binder.bindGenerics(function.getTypeParams(), function.getWhereClauses());
        constraints.propagateConstraints();
        constraints.checkSatisfiable();

        // 2. 生命周期
        List<HirType> paramTypes = new ArrayList<HirType>();
        for (HirParam param : function.getParams()) {
            paramTypes.add(assocTypes.resolveType(param.getType()));
        }
        HirType returnType = function.hasReturnType()
                ? assocTypes.resolveType(function.getReturnType())
                : HirTypes.UNIT;

        LifetimeContext lifetimes = new LifetimeContext();
        for (String name : function.getLifetimeParams()) {
            lifetimes.registerNamedLifetime(name);
        }
        binder.bindLifetimeBounds(function.getWhereClauses(), lifetimes);
        for (Constraint c : constraints.constraints()) {
            if (c.getKind() == Constraint.Kind.LIFETIME_BOUND) requireLifetime(lifetimes, c.getObject());
        }
        for (HirType type : paramTypes) {
            requireLifetimes(lifetimes, type);
        }
        requireLifetimes(lifetimes, returnType);

        ElisionResult elision = LifetimeElision.elideSignature(paramTypes, returnType, lifetimes);
        if (returnType instanceof ReferenceType && !((ReferenceType) returnType).hasLifetime()) {
            elision.requireOutputLifetime(itemName);
        }
        LifetimeSolver lifetimeSolver = new LifetimeSolver(lifetimes, config);
        lifetimeSolver.checkSatisfiable();

        // 3. 类型
        final TypeConstraintSolver solver = new TypeConstraintSolver();
        // 模块签名中的投影在调用处展开，未绑定时由调用方报告
        solver.setSignatureTypes(new TypeRewriter() {
            @Override
            public HirType visitProjection(ProjectionType type) {
                return assocTypes.resolveType(type);
            }
        });
        for (FunctionSignature signature : signatures) {
            solver.registerFunction(signature);
        }
        for (int i = 0; i < paramTypes.size(); i++) {
            solver.registerVariable(function.getParams().get(i).getName(), paramTypes.get(i));
        }

        final List<HirType> statementTypes = new ArrayList<HirType>();
        HirStmtVisitor<HirType, Void> stmtTyper = new HirStmtVisitor<HirType, Void>() {
            @Override
            public HirType visitLet(HirLet stmt, Void ctx) {
                HirType declared = stmt.hasDeclaredType() ? assocTypes.resolveType(stmt.getDeclaredType()) : null;
                return solver.solveLet(stmt.getName(), declared, stmt.getInit());
            }

            @Override
            public HirType visitExprStmt(HirExprStmt stmt, Void ctx) {
                return solver.solveExpr(stmt.getExpr());
            }
        };
        for (HirStmt stmt : function.getBody()) {
            statementTypes.add(stmt.accept(stmtTyper, null));
        }

        List<HirStmt> body = function.getBody();
        HirType bodyType = !body.isEmpty() && body.get(body.size() - 1) instanceof HirExprStmt
                ? statementTypes.get(statementTypes.size() - 1)
                : HirTypes.UNIT;
        // 没有函数体的签名只做声明检查
        if (function.hasReturnType() && !body.isEmpty()) {
            solver.expect(itemName, returnType, bodyType);
        }

        return new ItemResult(itemName, solver.getSolution(), statementTypes,
                solver.getSubstitution().apply(bodyType), elision, constraints, lifetimes.constraints());
    }

    /** 类型中写明的每个生命周期都必须已登记 */
    private static void requireLifetimes(LifetimeContext lifetimes, HirType type) {
        final Set<String> names = new LinkedHashSet<String>();
        new TypeRewriter() {
            @Override
            public HirType visitReference(ReferenceType ref) {
                if (ref.hasLifetime()) names.add(ref.getLifetimeName());
                return super.visitReference(ref);
            }
        }.rewrite(type);
        for (String name : names) {
            requireLifetime(lifetimes, name);
        }
    }

    private static void requireLifetime(LifetimeContext lifetimes, String name) {
        if (!lifetimes.isRegistered(name)) {
            throw new LifetimeException(LifetimeError.unregisteredLifetime(
                    name.startsWith("'") ? name.substring(1) : name));
        }
    }
}
