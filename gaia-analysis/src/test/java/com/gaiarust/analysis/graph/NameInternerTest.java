package com.gaiarust.analysis.graph;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class NameInternerTest {

    @Test
    void testInternIsStable() {
        NameInterner names = new NameInterner();
        assertThat(names.intern("T")).isEqualTo(0);
        assertThat(names.intern("Vec<T>")).isEqualTo(1);
        assertThat(names.intern("T")).isEqualTo(0);
        assertThat(names.size()).isEqualTo(2);
        assertThat(names.nameOf(1)).isEqualTo("Vec<T>");
        assertThat(names.idOf("U")).isEqualTo(-1);
    }
}
