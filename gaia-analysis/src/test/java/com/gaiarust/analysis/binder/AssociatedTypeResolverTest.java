package com.gaiarust.analysis.binder;

import com.gaiarust.analysis.DiagnosticCode;
import com.gaiarust.analysis.constraint.ConstraintException;
import com.gaiarust.hir.SourceLocation;
import com.gaiarust.hir.decl.HirFunction;
import com.gaiarust.hir.decl.HirImpl;
import com.gaiarust.hir.type.HirType;
import com.gaiarust.hir.type.HirTypeParser;
import com.gaiarust.hir.type.HirTypes;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("AssociatedTypeResolver 测试")
class AssociatedTypeResolverTest {

    private AssociatedTypeResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new AssociatedTypeResolver();
    }

    @Test
    @DisplayName("绑定后可以解析")
    void testBindAndResolve() {
        resolver.bind("impl1", "Item", HirTypes.U8);

        assertThat(resolver.isBound("impl1", "Item")).isTrue();
        assertThat(resolver.resolve("impl1", "Item")).isEqualTo(HirTypes.U8);
        assertThat(resolver.isBound("impl1", "Output")).isFalse();
    }

    @Test
    @DisplayName("未绑定时报错")
    void testUnbound() {
        assertThatThrownBy(() -> resolver.resolve("impl9", "Item"))
                .isInstanceOf(ConstraintException.class)
                .satisfies(e -> {
                    ConstraintException ce = (ConstraintException) e;
                    assertThat(ce.getCode()).isEqualTo(DiagnosticCode.ASSOCIATED_TYPE_UNBOUND);
                    assertThat(ce.getError().getKey()).isEqualTo("impl9::Item");
                });
    }

    @Test
    @DisplayName("重复绑定到同一类型不报错，不同类型冲突")
    void testConflict() {
        resolver.bind("impl1", "Item", HirTypes.U8);
        resolver.bind("impl1", "Item", HirTypes.U8);

        assertThatThrownBy(() -> resolver.bind("impl1", "Item", HirTypes.I32))
                .isInstanceOf(ConstraintException.class)
                .satisfies(e -> {
                    ConstraintException ce = (ConstraintException) e;
                    assertThat(ce.getCode()).isEqualTo(DiagnosticCode.ASSOCIATED_TYPE_CONFLICT);
                    assertThat(ce.getError().getPath()).containsExactly("u8", "i32");
                });
        assertThat(resolver.resolve("impl1", "Item")).isEqualTo(HirTypes.U8);
    }

    @Test
    @DisplayName("登记 impl 块的全部绑定")
    void testRegisterImpl() {
        Map<String, HirType> types = new LinkedHashMap<String, HirType>();
        types.put("Item", HirTypes.U8);
        types.put("Output", HirTypes.STRING);
        HirImpl impl = new HirImpl(SourceLocation.UNKNOWN, "impl1", "Iterator",
                HirTypes.named("Bytes"), types, Collections.<HirFunction>emptyList());

        resolver.registerImpl(impl);

        assertThat(resolver.bindingsOf("impl1")).containsOnlyKeys("Item", "Output");
        assertThat(resolver.bindingsOf("impl2")).isEmpty();
    }

    @Test
    @DisplayName("展开类型中的投影")
    void testResolveType() {
        resolver.bind("impl1", "Item", HirTypeParser.parse("<impl2>::Elem"));
        resolver.bind("impl2", "Elem", HirTypes.U8);

        HirType resolved = resolver.resolveType(HirTypeParser.parse("Vec<<impl1>::Item>"));

        assertThat(resolved).isEqualTo(HirTypes.vecOf(HirTypes.U8));
    }

    @Test
    @DisplayName("绑定互相引用成环")
    void testCyclicBindings() {
        resolver.bind("a", "X", HirTypeParser.parse("<b>::Y"));
        resolver.bind("b", "Y", HirTypeParser.parse("Vec<<a>::X>"));

        assertThatThrownBy(() -> resolver.resolveType(HirTypeParser.parse("<a>::X")))
                .isInstanceOf(ConstraintException.class)
                .extracting(e -> ((ConstraintException) e).getCode())
                .isEqualTo(DiagnosticCode.CYCLIC_TYPE_CONSTRAINT);
    }
}
