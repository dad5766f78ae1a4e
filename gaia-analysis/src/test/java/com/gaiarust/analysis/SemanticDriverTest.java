package com.gaiarust.analysis;

import com.gaiarust.analysis.lifetime.ElisionResult;
import com.gaiarust.analysis.solver.TypeError;
import com.gaiarust.hir.SourceLocation;
import com.gaiarust.hir.decl.HirExprStmt;
import com.gaiarust.hir.decl.HirFunction;
import com.gaiarust.hir.decl.HirImpl;
import com.gaiarust.hir.decl.HirLet;
import com.gaiarust.hir.decl.HirModule;
import com.gaiarust.hir.decl.HirWhereClause;
import com.gaiarust.hir.expr.HirBinary;
import com.gaiarust.hir.expr.HirExpr;
import com.gaiarust.hir.type.HirType;
import com.gaiarust.hir.type.HirTypeParser;
import com.gaiarust.hir.type.HirTypes;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;

import static com.gaiarust.hir.expr.HirExprs.*;
import static org.assertj.core.api.Assertions.*;

@DisplayName("SemanticDriver 测试")
class SemanticDriverTest {

    private static HirExprStmt expr(HirExpr e) {
        return new HirExprStmt(SourceLocation.UNKNOWN, e);
    }

    private static HirType type(String source) {
        return HirTypeParser.parse(source);
    }

    /** fn add(x: i32, y: i32) -> i32 { x + y } */
    private static HirFunction add() {
        return HirFunction.builder("add")
                .param("x", HirTypes.I32)
                .param("y", HirTypes.I32)
                .returns(HirTypes.I32)
                .stmt(expr(binary(var("x"), HirBinary.BinaryOp.ADD, var("y"))))
                .build();
    }

    /** fn bad() -> i32 { true } */
    private static HirFunction bad() {
        return HirFunction.builder("bad")
                .location(new SourceLocation("m.rs", 7, 1))
                .returns(HirTypes.I32)
                .stmt(expr(boolLit(true)))
                .build();
    }

    /** fn caller() -> i32 { let r = add(1, 2); r } */
    private static HirFunction caller() {
        return HirFunction.builder("caller")
                .returns(HirTypes.I32)
                .stmt(new HirLet(SourceLocation.UNKNOWN, "r", null, call("add", intLit(1), intLit(2))))
                .stmt(expr(var("r")))
                .build();
    }

    private static HirModule module(HirFunction... functions) {
        return new HirModule("m", Arrays.asList(functions), Collections.<HirImpl>emptyList());
    }

    @Nested
    @DisplayName("顺序分析")
    class Sequential {

        @Test
        @DisplayName("出错条目变成诊断，其余条目继续")
        void testContinuesAfterFailure() {
            AnalysisResult result = new SemanticDriver().analyze(module(add(), bad(), caller()));

            assertThat(result.getModuleName()).isEqualTo("m");
            assertThat(result.hasErrors()).isTrue();
            assertThat(result.getItems()).extracting(ItemResult::getItemName).containsExactly("add", "caller");
            assertThat(result.getDiagnostics()).hasSize(1);

            SemanticDiagnostic d = result.getDiagnostics().get(0);
            assertThat(d.getCode()).isEqualTo(DiagnosticCode.TYPE_MISMATCH);
            assertThat(d.getItem()).isEqualTo("bad");
            assertThat(d.getLocation().getLine()).isEqualTo(7);
            TypeError detail = (TypeError) d.getDetail();
            assertThat(detail.getExpected()).isEqualTo(HirTypes.I32);
            assertThat(detail.getFound()).isEqualTo(HirTypes.BOOL);
        }

        @Test
        @DisplayName("条目结果包含变量类型和函数体类型")
        void testItemResult() {
            AnalysisResult result = new SemanticDriver().analyze(module(add(), caller()));

            ItemResult item = result.getItem("caller");
            assertThat(item).isNotNull();
            assertThat(item.getSolution().lookup("r")).isEqualTo(HirTypes.I32);
            assertThat(item.getStatementTypes()).containsExactly(HirTypes.I32, HirTypes.I32);
            assertThat(item.getBodyType()).isEqualTo(HirTypes.I32);
            assertThat(result.hasErrors()).isFalse();
        }

        @Test
        @DisplayName("failFast 在第一个诊断处停止")
        void testFailFast() {
            AnalysisConfig config = new AnalysisConfig();
            config.setFailFast(true);

            AnalysisResult result = new SemanticDriver(config).analyze(module(bad(), add()));

            assertThat(result.getDiagnostics()).hasSize(1);
            assertThat(result.getItems()).isEmpty();
        }

        @Test
        @DisplayName("以 let 结尾的函数体类型为 ()")
        void testBodyEndingWithLet() {
            HirFunction f = HirFunction.builder("f")
                    .returns(HirTypes.I32)
                    .stmt(new HirLet(SourceLocation.UNKNOWN, "x", null, intLit(1)))
                    .build();

            AnalysisResult result = new SemanticDriver().analyze(module(f));

            assertThat(result.getDiagnostics()).extracting(SemanticDiagnostic::getCode)
                    .containsExactly(DiagnosticCode.TYPE_MISMATCH);
        }

        @Test
        @DisplayName("调用未声明的函数")
        void testUnknownFunction() {
            HirFunction f = HirFunction.builder("f").stmt(expr(call("missing", intLit(1)))).build();

            AnalysisResult result = new SemanticDriver().analyze(module(f, add()));

            assertThat(result.getDiagnostics()).hasSize(1);
            SemanticDiagnostic d = result.getDiagnostics().get(0);
            assertThat(d.getCode()).isEqualTo(DiagnosticCode.UNKNOWN_FUNCTION);
            assertThat(d.getItem()).isEqualTo("f");
            assertThat(((TypeError) d.getDetail()).getName()).isEqualTo("missing");
            assertThat(result.getItems()).extracting(ItemResult::getItemName).containsExactly("add");
        }
    }

    @Nested
    @DisplayName("生命周期")
    class Lifetimes {

        @Test
        @DisplayName("唯一引用参数：返回值沿用其生命周期")
        void testElided() {
            HirFunction first = HirFunction.builder("first")
                    .param("s", type("&str"))
                    .returns(type("&str"))
                    .stmt(expr(var("s")))
                    .build();

            AnalysisResult result = new SemanticDriver().analyze(module(first));

            assertThat(result.hasErrors()).isFalse();
            ElisionResult elision = result.getItem("first").getElision();
            assertThat(elision.getRule()).isEqualTo(ElisionResult.Rule.SINGLE_INPUT);
            assertThat(elision.getOutputLifetime()).isEqualTo(elision.getInputLifetime(0));
        }

        @Test
        @DisplayName("返回引用的生命周期有歧义")
        void testAmbiguousReturn() {
            HirFunction pick = HirFunction.builder("pick")
                    .param("n", HirTypes.I32)
                    .param("a", type("&str"))
                    .param("b", type("&str"))
                    .returns(type("&str"))
                    .build();

            AnalysisResult result = new SemanticDriver().analyze(module(pick));

            assertThat(result.getDiagnostics()).extracting(SemanticDiagnostic::getCode)
                    .containsExactly(DiagnosticCode.AMBIGUOUS_RETURN_LIFETIME);
        }

        @Test
        @DisplayName("写明的生命周期必须声明")
        void testUnregistered() {
            HirFunction f = HirFunction.builder("f")
                    .param("x", type("&'a str"))
                    .build();

            AnalysisResult result = new SemanticDriver().analyze(module(f));

            assertThat(result.getDiagnostics()).extracting(SemanticDiagnostic::getCode)
                    .containsExactly(DiagnosticCode.UNREGISTERED_LIFETIME);
        }

        @Test
        @DisplayName("'a: 'b 与 'b: 'a 构成环")
        void testCyclic() {
            HirFunction f = HirFunction.builder("f")
                    .lifetime("'a")
                    .lifetime("'b")
                    .where(new HirWhereClause("'a", Collections.singletonList("'b")))
                    .where(new HirWhereClause("'b", Collections.singletonList("'a")))
                    .param("x", type("&'a str"))
                    .param("y", type("&'b str"))
                    .build();

            AnalysisResult result = new SemanticDriver().analyze(module(f));

            assertThat(result.getDiagnostics()).extracting(SemanticDiagnostic::getCode)
                    .containsExactly(DiagnosticCode.CYCLIC_LIFETIME);
        }

        @Test
        @DisplayName("where 子句产生的 outlives 约束记录在结果中")
        void testOutlivesRecorded() {
            HirFunction f = HirFunction.builder("f")
                    .lifetime("a")
                    .lifetime("b")
                    .where(new HirWhereClause("'a", Collections.singletonList("'b")))
                    .param("x", type("&'a str"))
                    .returns(type("&'b str"))
                    .build();

            AnalysisResult result = new SemanticDriver().analyze(module(f));

            assertThat(result.hasErrors()).isFalse();
            assertThat(result.getItem("f").getOutlives()).hasSize(1);
        }
    }

    @Nested
    @DisplayName("impl 块")
    class Impls {

        private HirImpl counterImpl(String id, HirType item) {
            Map<String, HirType> types = new LinkedHashMap<String, HirType>();
            types.put("Item", item);
            HirFunction next = HirFunction.builder("next")
                    .param("x", type("<" + id + ">::Item"))
                    .returns(type("<" + id + ">::Item"))
                    .stmt(expr(var("x")))
                    .build();
            return new HirImpl(new SourceLocation("m.rs", 3, 1), id, "Iterator",
                    HirTypes.named("Counter"), types, Collections.singletonList(next));
        }

        @Test
        @DisplayName("方法以 implId::name 命名，关联类型被展开")
        void testMethod() {
            HirModule m = new HirModule("m", Collections.<HirFunction>emptyList(),
                    Collections.singletonList(counterImpl("impl1", HirTypes.U32)));

            AnalysisResult result = new SemanticDriver().analyze(m);

            assertThat(result.hasErrors()).isFalse();
            ItemResult item = result.getItem("impl1::next");
            assertThat(item).isNotNull();
            assertThat(item.getBodyType()).isEqualTo(HirTypes.U32);
        }

        @Test
        @DisplayName("调用 impl 方法时展开其签名中的关联类型")
        void testCallMethodFromFunction() {
            HirFunction caller = HirFunction.builder("caller")
                    .param("y", HirTypes.U32)
                    .returns(HirTypes.U32)
                    .stmt(expr(call("impl1::next", var("y"))))
                    .build();
            HirModule m = new HirModule("m", Collections.singletonList(caller),
                    Collections.singletonList(counterImpl("impl1", HirTypes.U32)));

            AnalysisResult result = new SemanticDriver().analyze(m);

            assertThat(result.getDiagnostics()).isEmpty();
            assertThat(result.getItem("caller").getBodyType()).isEqualTo(HirTypes.U32);
        }

        @Test
        @DisplayName("实参与展开后的关联类型不符")
        void testCallMethodWithWrongArgument() {
            HirFunction caller = HirFunction.builder("caller")
                    .stmt(expr(call("impl1::next", boolLit(true))))
                    .build();
            HirModule m = new HirModule("m", Collections.singletonList(caller),
                    Collections.singletonList(counterImpl("impl1", HirTypes.U32)));

            AnalysisResult result = new SemanticDriver().analyze(m);

            assertThat(result.getDiagnostics()).hasSize(1);
            TypeError detail = (TypeError) result.getDiagnostics().get(0).getDetail();
            assertThat(detail.getExpected()).isEqualTo(HirTypes.U32);
            assertThat(detail.getPosition()).isEqualTo(0);
        }

        @Test
        @DisplayName("调用签名含未绑定关联类型的函数")
        void testCallUnboundSignature() {
            HirFunction g = HirFunction.builder("g")
                    .param("x", type("<impl9>::Item"))
                    .build();
            HirFunction h = HirFunction.builder("h")
                    .stmt(expr(call("g", intLit(1))))
                    .build();

            AnalysisResult result = new SemanticDriver().analyze(module(g, h, add()));

            assertThat(result.getDiagnostics()).extracting(SemanticDiagnostic::getItem).containsExactly("g", "h");
            assertThat(result.getDiagnostics()).extracting(SemanticDiagnostic::getCode)
                    .containsOnly(DiagnosticCode.ASSOCIATED_TYPE_UNBOUND);
            assertThat(result.getItems()).extracting(ItemResult::getItemName).containsExactly("add");
        }

        @Test
        @DisplayName("同一 impl 的关联类型冲突")
        void testConflict() {
            HirModule m = new HirModule("m", Collections.<HirFunction>emptyList(),
                    Arrays.asList(counterImpl("impl1", HirTypes.U32), counterImpl("impl1", HirTypes.U8)));

            AnalysisResult result = new SemanticDriver().analyze(m);

            assertThat(result.getDiagnostics()).hasSize(1);
            SemanticDiagnostic d = result.getDiagnostics().get(0);
            assertThat(d.getCode()).isEqualTo(DiagnosticCode.ASSOCIATED_TYPE_CONFLICT);
            assertThat(d.getItem()).isEqualTo("impl1");
        }

        @Test
        @DisplayName("未绑定的关联类型")
        void testUnbound() {
            HirFunction f = HirFunction.builder("f")
                    .param("x", type("<impl9>::Item"))
                    .build();

            AnalysisResult result = new SemanticDriver().analyze(module(f));

            assertThat(result.getDiagnostics()).extracting(SemanticDiagnostic::getCode)
                    .containsExactly(DiagnosticCode.ASSOCIATED_TYPE_UNBOUND);
        }
    }

    @Nested
    @DisplayName("where 约束")
    class WhereClauses {

        @Test
        @DisplayName("约束写入条目的约束集")
        void testBoundsRecorded() {
            HirFunction f = HirFunction.builder("show")
                    .typeParam("T")
                    .where(new HirWhereClause("T", Arrays.asList("Clone", "Debug")))
                    .param("x", type("T"))
                    .build();

            AnalysisResult result = new SemanticDriver().analyze(module(f));

            assertThat(result.hasErrors()).isFalse();
            assertThat(result.getItem("show").getConstraints().traitBoundsOf("T")).containsExactly("Clone", "Debug");
        }

        @Test
        @DisplayName("约束过多")
        void testTooManyBounds() {
            AnalysisConfig config = new AnalysisConfig();
            config.setMaxBoundsPerType(1);
            HirFunction f = HirFunction.builder("show")
                    .typeParam("T")
                    .where(new HirWhereClause("T", Arrays.asList("Clone", "Debug")))
                    .build();

            AnalysisResult result = new SemanticDriver(config).analyze(module(f));

            assertThat(result.getDiagnostics()).extracting(SemanticDiagnostic::getCode)
                    .containsExactly(DiagnosticCode.TOO_MANY_BOUNDS);
        }
    }

    @Nested
    @DisplayName("并行分析")
    class Parallel {

        @Test
        @DisplayName("结果按模块顺序汇总")
        void testOrder() {
            ExecutorService executor = Executors.newFixedThreadPool(3);
            try {
                AnalysisResult result = new SemanticDriver().analyzeParallel(
                        module(add(), bad(), caller()), executor);

                assertThat(result.getItems()).extracting(ItemResult::getItemName).containsExactly("add", "caller");
                List<SemanticDiagnostic> diagnostics = result.getDiagnostics();
                assertThat(diagnostics).extracting(SemanticDiagnostic::getItem).containsExactly("bad");
            } finally {
                executor.shutdownNow();
            }
        }

        @Test
        @DisplayName("与顺序分析结果一致")
        void testSameAsSequential() {
            HirModule m = module(add(), bad(), caller());
            ExecutorService executor = Executors.newFixedThreadPool(2);
            try {
                AnalysisResult parallel = new SemanticDriver().analyzeParallel(m, executor);
                AnalysisResult sequential = new SemanticDriver().analyze(m);

                assertThat(parallel.getDiagnostics()).extracting(SemanticDiagnostic::getMessage)
                        .isEqualTo(sequential.getDiagnostics().stream()
                                .map(SemanticDiagnostic::getMessage)
                                .collect(Collectors.toList()));
                assertThat(parallel.getItem("caller").getBodyType())
                        .isEqualTo(sequential.getItem("caller").getBodyType());
            } finally {
                executor.shutdownNow();
            }
        }
    }
}
