package com.gaiarust.analysis.lifetime;

import com.gaiarust.analysis.DiagnosticCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("LifetimeContext 测试")
class LifetimeContextTest {

    private LifetimeContext ctx;

    @BeforeEach
    void setUp() {
        ctx = new LifetimeContext();
    }

    @Test
    @DisplayName("新生命周期依次编号")
    void testFreshLifetimes() {
        assertThat(ctx.freshLifetime().toDisplayString()).isEqualTo("'l0");
        assertThat(ctx.freshLifetime().toDisplayString()).isEqualTo("'l1");
    }

    @Test
    @DisplayName("重复登记返回同一个生命周期，撇号可省略")
    void testRegisterIdempotent() {
        Lifetime a = ctx.registerNamedLifetime("'a");
        assertThat(ctx.registerNamedLifetime("a")).isEqualTo(a);
        assertThat(ctx.registeredLifetimes()).containsExactly(Lifetime.STATIC, a);
    }

    @Test
    @DisplayName("'static 总是已登记")
    void testStaticAlwaysRegistered() {
        assertThat(ctx.isRegistered("static")).isTrue();
        assertThat(ctx.lookup("'static")).isSameAs(Lifetime.STATIC);
    }

    @Test
    @DisplayName("未登记的生命周期不能加入约束")
    void testUnregistered() {
        ctx.registerNamedLifetime("b");
        assertThatThrownBy(() -> ctx.addOutlivesConstraint("'c", "'b", "test"))
                .isInstanceOf(LifetimeException.class)
                .satisfies(e -> {
                    LifetimeError error = ((LifetimeException) e).getError();
                    assertThat(error.getCode()).isEqualTo(DiagnosticCode.UNREGISTERED_LIFETIME);
                    assertThat(error.getName()).isEqualTo("c");
                });
        assertThat(ctx.constraints()).isEmpty();
    }

    @Test
    @DisplayName("相同两端的约束只保留第一次的原因")
    void testDeduplicateConstraints() {
        ctx.registerNamedLifetime("a");
        ctx.registerNamedLifetime("b");
        assertThat(ctx.addOutlivesConstraint("a", "b", "first")).isTrue();
        assertThat(ctx.addOutlivesConstraint("'a", "'b", "second")).isFalse();
        assertThat(ctx.constraints()).hasSize(1);
        assertThat(ctx.constraints().get(0).getReason()).isEqualTo("first");
    }

    @Test
    @DisplayName("clear 重置计数器和登记信息")
    void testClear() {
        ctx.registerNamedLifetime("a");
        ctx.freshLifetime();
        ctx.clear();
        assertThat(ctx.isRegistered("a")).isFalse();
        assertThat(ctx.registeredLifetimes()).containsExactly(Lifetime.STATIC);
        assertThat(ctx.freshLifetime()).isEqualTo(Lifetime.inferred(0));
    }

    @Test
    @DisplayName("Lifetime 按结构比较")
    void testLifetimeIdentity() {
        assertThat(Lifetime.named("'a")).isEqualTo(Lifetime.named("a"));
        assertThat(Lifetime.named("static")).isSameAs(Lifetime.STATIC);
        assertThat(Lifetime.inferred(0)).isNotEqualTo(Lifetime.named("l0"));
    }
}
