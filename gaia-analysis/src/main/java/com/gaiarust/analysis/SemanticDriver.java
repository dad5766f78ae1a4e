package com.gaiarust.analysis;

import com.gaiarust.analysis.binder.AssociatedTypeResolver;
import com.gaiarust.analysis.solver.FunctionSignature;
import com.gaiarust.hir.decl.HirFunction;
import com.gaiarust.hir.decl.HirImpl;
import com.gaiarust.hir.decl.HirModule;
import com.gaiarust.hir.decl.HirParam;
import com.gaiarust.hir.type.HirType;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 模块级语义分析驱动。
 * <p>
 * 按模块顺序逐个分析条目（函数，以及 impl 方法 implId::method），
 * 出错的条目转换为一条诊断，其余条目继续分析（failFast 时立即停止）。
 */
public final class SemanticDriver {

    private static final Logger LOG = Logger.getLogger(SemanticDriver.class.getName());

    private final AnalysisConfig config;

    public SemanticDriver() {
        this(new AnalysisConfig());
    }

    public SemanticDriver(AnalysisConfig config) {
        this.config = config;
    }

    /** 在当前线程顺序分析整个模块 */
    public AnalysisResult analyze(HirModule module) {
        List<SemanticDiagnostic> diagnostics = new ArrayList<SemanticDiagnostic>();
        ModuleScope scope = prepare(module, diagnostics);
        List<ItemResult> items = new ArrayList<ItemResult>();
        if (config.isFailFast() && !diagnostics.isEmpty()) {
            return new AnalysisResult(module.getName(), items, diagnostics);
        }

        ItemAnalyzer analyzer = new ItemAnalyzer(config, scope.signatures, scope.assocTypes);
        for (Item item : scope.items) {
            Outcome outcome = run(analyzer, item);
            if (outcome.result != null) {
                items.add(outcome.result);
            } else {
                diagnostics.add(outcome.diagnostic);
                if (config.isFailFast()) break;
            }
        }
        logSummary(module, items, diagnostics);
        return new AnalysisResult(module.getName(), items, diagnostics);
    }

    /**
     * 以条目为粒度并行分析。每个任务使用自己的 {@link ItemAnalyzer}，结果按模块顺序汇总。
     * executor 由调用方管理，这里不会关闭它。
     */
    public AnalysisResult analyzeParallel(HirModule module, ExecutorService executor) {
        List<SemanticDiagnostic> diagnostics = new ArrayList<SemanticDiagnostic>();
        final ModuleScope scope = prepare(module, diagnostics);
        List<ItemResult> items = new ArrayList<ItemResult>();
        if (config.isFailFast() && !diagnostics.isEmpty()) {
            return new AnalysisResult(module.getName(), items, diagnostics);
        }

        List<Future<Outcome>> futures = new ArrayList<Future<Outcome>>();
        for (final Item item : scope.items) {
            futures.add(executor.submit(() ->
                    run(new ItemAnalyzer(config, scope.signatures, scope.assocTypes), item)));
        }

        for (int i = 0; i < futures.size(); i++) {
            Outcome outcome = await(futures.get(i), scope.items.get(i));
            if (outcome.result != null) {
                items.add(outcome.result);
            } else {
                diagnostics.add(outcome.diagnostic);
                if (config.isFailFast()) {
                    for (int j = i + 1; j < futures.size(); j++) {
                        futures.get(j).cancel(true);
                    }
                    break;
                }
            }
        }
        logSummary(module, items, diagnostics);
        return new AnalysisResult(module.getName(), items, diagnostics);
    }

    private static Outcome await(Future<Outcome> future, Item item) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while analyzing " + item.name, e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("analysis of " + item.name + " failed", e.getCause());
        }
    }

    private static Outcome run(ItemAnalyzer analyzer, Item item) {
        try {
            return new Outcome(analyzer.analyze(item.name, item.function), null);
        } catch (AnalysisException e) {
            LOG.log(Level.WARNING, "条目分析失败: " + item.name + " (" + e.getCode() + ")");
            return new Outcome(null, SemanticDiagnostic.fromException(item.name, item.function.getLocation(), e));
        }
    }

    // ============ 模块准备 ============

    /** 收集条目、签名表和关联类型绑定；impl 的绑定冲突记为该 impl 的诊断 */
    private ModuleScope prepare(HirModule module, List<SemanticDiagnostic> diagnostics) {
        ModuleScope scope = new ModuleScope();
        for (HirFunction function : module.getFunctions()) {
            scope.items.add(new Item(function.getName(), function));
            scope.signatures.add(signatureOf(function.getName(), function));
        }
        for (HirImpl impl : module.getImpls()) {
            try {
                scope.assocTypes.registerImpl(impl);
            } catch (AnalysisException e) {
                LOG.log(Level.WARNING, "关联类型绑定失败: " + impl.getImplId());
                diagnostics.add(SemanticDiagnostic.fromException(impl.getImplId(), impl.getLocation(), e));
            }
            for (HirFunction method : impl.getMethods()) {
                String qualified = impl.getImplId() + "::" + method.getName();
                scope.items.add(new Item(qualified, method));
                scope.signatures.add(signatureOf(qualified, method));
            }
        }
        return scope;
    }

    private static FunctionSignature signatureOf(String name, HirFunction function) {
        List<HirType> params = new ArrayList<HirType>();
        for (HirParam param : function.getParams()) {
            params.add(param.getType());
        }
        return new FunctionSignature(name, function.getTypeParams(), params, function.getReturnType());
    }

    private static void logSummary(HirModule module, List<ItemResult> items, List<SemanticDiagnostic> diagnostics) {
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("模块 " + module.getName() + ": " + items.size() + " 个条目通过, "
                    + diagnostics.size() + " 条诊断");
        }
    }

    private static final class ModuleScope {
        final List<Item> items = new ArrayList<Item>();
        final List<FunctionSignature> signatures = new ArrayList<FunctionSignature>();
        final AssociatedTypeResolver assocTypes = new AssociatedTypeResolver();
    }

    private static final class Item {
        final String name;
        final HirFunction function;

        Item(String name, HirFunction function) {
            this.name = name;
            this.function = function;
        }
    }

    private static final class Outcome {
        final ItemResult result;
        final SemanticDiagnostic diagnostic;

        Outcome(ItemResult result, SemanticDiagnostic diagnostic) {
            this.result = result;
            this.diagnostic = diagnostic;
        }
    }
}
