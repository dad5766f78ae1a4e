package com.gaiarust.analysis.solver;

import com.gaiarust.hir.type.HirTypeParser;
import com.gaiarust.hir.type.HirTypes;
import com.gaiarust.hir.type.TypeVariable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("TypeUnifier 测试")
class TypeUnifierTest {

    private final Substitution substitution = new Substitution();
    private final TypeUnifier unifier = new TypeUnifier(substitution);

    @Test
    @DisplayName("引用比较忽略生命周期")
    void testReferenceIgnoresLifetime() {
        assertThat(unifier.unify(HirTypeParser.parse("&'a str"), HirTypeParser.parse("&'static str"))).isTrue();
        assertThat(unifier.unify(HirTypeParser.parse("&str"), HirTypeParser.parse("&mut str"))).isFalse();
    }

    @Test
    @DisplayName("命名类型比较名称和实参")
    void testNamed() {
        assertThat(unifier.unify(HirTypeParser.parse("Option<i32>"), HirTypeParser.parse("Option<i32>"))).isTrue();
        assertThat(unifier.unify(HirTypeParser.parse("Option<i32>"), HirTypeParser.parse("Option<u8>"))).isFalse();
        assertThat(unifier.unify(HirTypeParser.parse("Option<i32>"), HirTypeParser.parse("Result<i32>"))).isFalse();
    }

    @Test
    @DisplayName("嵌套占位符被绑定")
    void testNestedVariable() {
        assertThat(unifier.unify(HirTypeParser.parse("Vec<?T0>"), HirTypeParser.parse("Vec<bool>"))).isTrue();
        assertThat(substitution.apply(new TypeVariable(0))).isEqualTo(HirTypes.BOOL);
    }

    @Test
    @DisplayName("! 与任何类型统一")
    void testNever() {
        assertThat(unifier.unify(HirTypes.I32, HirTypes.NEVER)).isTrue();
    }

    @Test
    @DisplayName("占位符不能绑定到含自身的类型")
    void testOccurs() {
        assertThatThrownBy(() -> unifier.unify(new TypeVariable(1), HirTypeParser.parse("Vec<?T1>")))
                .isInstanceOf(TypeCheckException.class);
    }
}
