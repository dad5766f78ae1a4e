package com.gaiarust.analysis.constraint;

import com.gaiarust.analysis.AnalysisConfig;
import com.gaiarust.analysis.DiagnosticCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ConstraintSet 测试")
class ConstraintSetTest {

    private ConstraintSet set;

    @BeforeEach
    void setUp() {
        set = new ConstraintSet();
    }

    // ============ 存储与索引 ============

    @Nested
    @DisplayName("存储与索引")
    class Storage {

        @Test
        @DisplayName("结构相同的约束只保存一次")
        void testDeduplicate() {
            assertThat(set.addConstraint(Constraint.traitBound("T", "Clone"))).isTrue();
            assertThat(set.addConstraint(Constraint.traitBound("T", "Clone"))).isFalse();
            assertThat(set.size()).isEqualTo(1);
        }

        @Test
        @DisplayName("等式在两侧都建立索引")
        void testEqualityIndexedUnderBothSides() {
            Constraint eq = Constraint.typeEquality("T", "U");
            set.addConstraint(eq);
            assertThat(set.getConstraints("T")).containsExactly(eq);
            assertThat(set.getConstraints("U")).containsExactly(eq);
        }

        @Test
        @DisplayName("生命周期约束同时以类型和生命周期为键")
        void testLifetimeBoundKeys() {
            Constraint bound = Constraint.lifetimeBound("T", "a");
            set.addConstraint(bound);
            assertThat(set.getConstraints("T")).containsExactly(bound);
            assertThat(set.getConstraints("'a")).containsExactly(bound);
        }

        @Test
        @DisplayName("未提及的键返回空列表")
        void testMissingKey() {
            assertThat(set.getConstraints("Nope")).isEmpty();
        }

        @Test
        @DisplayName("resolve 可重复调用")
        void testResolveIdempotent() {
            set.addConstraint(Constraint.typeEquality("A", "B"));
            set.addConstraint(Constraint.traitBound("A", "Debug"));
            set.resolve();
            set.resolve();
            assertThat(set.getConstraints("A")).hasSize(2);
            assertThat(set.getConstraints("B")).hasSize(1);
        }

        @Test
        @DisplayName("索引视图不可修改")
        void testUnmodifiableView() {
            set.addConstraint(Constraint.sizedBound("T"));
            assertThatThrownBy(() -> set.getConstraints("T").clear())
                    .isInstanceOf(UnsupportedOperationException.class);
            assertThatThrownBy(() -> set.constraints().add(Constraint.sizedBound("U")))
                    .isInstanceOf(UnsupportedOperationException.class);
        }

        @Test
        @DisplayName("merge 保持去重和插入顺序")
        void testMerge() {
            set.addConstraint(Constraint.traitBound("T", "Clone"));
            ConstraintSet other = new ConstraintSet();
            other.addConstraint(Constraint.traitBound("T", "Clone"));
            other.addConstraint(Constraint.sizedBound("T"));

            set.merge(other);

            assertThat(set.constraints()).containsExactly(
                    Constraint.traitBound("T", "Clone"), Constraint.sizedBound("T"));
        }
    }

    // ============ 可满足性 ============

    @Nested
    @DisplayName("checkSatisfiable")
    class Satisfiability {

        @Test
        @DisplayName("纯等式环是合法的等价类")
        void testEqualityCycleIsSatisfiable() {
            set.addConstraint(Constraint.typeEquality("A", "B"));
            set.addConstraint(Constraint.typeEquality("B", "C"));
            set.addConstraint(Constraint.typeEquality("C", "A"));

            assertThatCode(() -> set.checkSatisfiable()).doesNotThrowAnyException();
            assertThat(set.equivalenceClassOf("A")).containsExactlyInAnyOrder("A", "B", "C");
        }

        @Test
        @DisplayName("T = Vec<T> 是无限类型")
        void testInfiniteType() {
            set.addConstraint(Constraint.typeEquality("T", "Vec<T>"));

            assertThatThrownBy(() -> set.checkSatisfiable())
                    .isInstanceOf(ConstraintException.class)
                    .satisfies(e -> {
                        ConstraintError error = ((ConstraintException) e).getError();
                        assertThat(error.getCode()).isEqualTo(DiagnosticCode.CYCLIC_TYPE_CONSTRAINT);
                        assertThat(error.getPath()).contains("Vec<T>", "T");
                    });
        }

        @Test
        @DisplayName("经过等式间接形成的无限类型")
        void testIndirectInfiniteType() {
            set.addConstraint(Constraint.typeEquality("T", "U"));
            set.addConstraint(Constraint.typeEquality("U", "&'a Option<T>"));

            assertThatThrownBy(() -> set.checkSatisfiable())
                    .isInstanceOf(ConstraintException.class)
                    .extracting(e -> ((ConstraintException) e).getCode())
                    .isEqualTo(DiagnosticCode.CYCLIC_TYPE_CONSTRAINT);
        }

        @Test
        @DisplayName("组成部分不回到自身时可满足")
        void testNestedButFinite() {
            set.addConstraint(Constraint.typeEquality("T", "Vec<U>"));
            set.addConstraint(Constraint.typeEquality("U", "HashMap<String, i32>"));
            assertThatCode(() -> set.checkSatisfiable()).doesNotThrowAnyException();
        }

        @Test
        @DisplayName("关联类型投影是原子名称")
        void testProjectionIsAtomic() {
            set.addConstraint(Constraint.typeEquality("<T as Iterator>::Item", "T"));
            assertThatCode(() -> set.checkSatisfiable()).doesNotThrowAnyException();
        }
    }

    // ============ 传播 ============

    @Nested
    @DisplayName("propagateConstraints")
    class Propagation {

        @Test
        @DisplayName("trait 约束沿等式传播")
        void testPropagateAlongEquality() {
            set.addConstraint(Constraint.typeEquality("T", "U"));
            set.addConstraint(Constraint.traitBound("T", "Clone"));

            int derived = set.propagateConstraints();

            assertThat(derived).isEqualTo(1);
            assertThat(set.constraints()).contains(Constraint.traitBound("U", "Clone"));
        }

        @Test
        @DisplayName("等式是对称的")
        void testPropagateBackwards() {
            set.addConstraint(Constraint.typeEquality("T", "U"));
            set.addConstraint(Constraint.traitBound("U", "Debug"));

            set.propagateConstraints();

            assertThat(set.traitBoundsOf("T")).containsExactly("Debug");
        }

        @Test
        @DisplayName("沿等式链传递到不动点")
        void testTransitive() {
            set.addConstraint(Constraint.typeEquality("A", "B"));
            set.addConstraint(Constraint.typeEquality("B", "C"));
            set.addConstraint(Constraint.typeEquality("C", "D"));
            set.addConstraint(Constraint.traitBound("A", "Copy"));

            assertThat(set.propagateConstraints()).isEqualTo(3);
            assertThat(set.traitBoundsOf("D")).containsExactly("Copy");
            assertThat(set.propagateConstraints()).isZero();
        }

        @Test
        @DisplayName("超出迭代上限")
        void testFixpointLimit() {
            AnalysisConfig config = new AnalysisConfig();
            config.setMaxFixpointIterations(2);
            ConstraintSet limited = new ConstraintSet(config);
            limited.addConstraint(Constraint.typeEquality("A", "B"));
            limited.addConstraint(Constraint.typeEquality("B", "C"));
            limited.addConstraint(Constraint.typeEquality("C", "D"));
            limited.addConstraint(Constraint.traitBound("A", "Copy"));

            assertThatThrownBy(limited::propagateConstraints)
                    .isInstanceOf(ConstraintException.class)
                    .extracting(e -> ((ConstraintException) e).getError().getLimit())
                    .isEqualTo(2);
        }
    }

    @Test
    @DisplayName("TypeNames 取出直接组成部分")
    void testComponents() {
        assertThat(TypeNames.components("Vec<T>")).containsExactly("T");
        assertThat(TypeNames.components("HashMap<K, Vec<V>>")).containsExactly("K", "Vec<V>");
        assertThat(TypeNames.components("&'a mut T")).containsExactly("T");
        assertThat(TypeNames.components("*const u8")).containsExactly("u8");
        assertThat(TypeNames.components("[T; 4]")).containsExactly("T");
        assertThat(TypeNames.components("(A, B)")).containsExactly("A", "B");
        assertThat(TypeNames.components("Iterator<Item = u8>")).containsExactly("u8");
        assertThat(TypeNames.components("<T as Iterator>::Item")).isEmpty();
        assertThat(TypeNames.components("T")).isEmpty();
    }
}
