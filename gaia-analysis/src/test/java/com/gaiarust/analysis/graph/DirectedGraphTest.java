package com.gaiarust.analysis.graph;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("DirectedGraph 测试")
class DirectedGraphTest {

    @Test
    @DisplayName("无环图返回 null")
    void testAcyclic() {
        DirectedGraph g = new DirectedGraph(4);
        g.addEdge(0, 1, 0);
        g.addEdge(1, 2, 1);
        g.addEdge(0, 2, 2);
        g.addEdge(2, 3, 3);
        assertThat(g.findCycle()).isNull();
    }

    @Test
    @DisplayName("菱形汇合不是环")
    void testDiamondIsNotCycle() {
        DirectedGraph g = new DirectedGraph(4);
        g.addEdge(0, 1, 0);
        g.addEdge(0, 2, 1);
        g.addEdge(1, 3, 2);
        g.addEdge(2, 3, 3);
        assertThat(g.findCycle()).isNull();
    }

    @Test
    @DisplayName("环按顺序返回，首尾相接")
    void testCycleOrdered() {
        DirectedGraph g = new DirectedGraph(3);
        g.addEdge(0, 1, 10);
        g.addEdge(1, 2, 11);
        g.addEdge(2, 0, 12);

        List<DirectedGraph.Edge> cycle = g.findCycle();

        assertThat(cycle).hasSize(3);
        for (int i = 0; i < cycle.size(); i++) {
            DirectedGraph.Edge next = cycle.get((i + 1) % cycle.size());
            assertThat(cycle.get(i).getTo()).isEqualTo(next.getFrom());
        }
        assertThat(cycle).extracting(DirectedGraph.Edge::getLabel).containsExactlyInAnyOrder(10, 11, 12);
    }

    @Test
    @DisplayName("自环")
    void testSelfLoop() {
        DirectedGraph g = new DirectedGraph(2);
        g.addEdge(0, 1, 0);
        g.addEdge(1, 1, 1);
        List<DirectedGraph.Edge> cycle = g.findCycle();
        assertThat(cycle).hasSize(1);
        assertThat(cycle.get(0).getLabel()).isEqualTo(1);
    }

    @Test
    @DisplayName("长链不会栈溢出")
    void testDeepChain() {
        int n = 200_000;
        DirectedGraph g = new DirectedGraph(n);
        for (int i = 0; i + 1 < n; i++) {
            g.addEdge(i, i + 1, i);
        }
        assertThat(g.findCycle()).isNull();
        g.addEdge(n - 1, 0, -1);
        assertThat(g.findCycle()).hasSize(n);
    }

    @Test
    @DisplayName("findPath：最短路径和经过起点的环")
    void testFindPath() {
        DirectedGraph g = new DirectedGraph(4);
        g.addEdge(0, 1, 0);
        g.addEdge(1, 2, 1);
        g.addEdge(0, 2, 2);
        g.addEdge(2, 0, 3);

        assertThat(g.findPath(0, 2)).extracting(DirectedGraph.Edge::getLabel).containsExactly(2);
        assertThat(g.findPath(0, 0)).extracting(DirectedGraph.Edge::getLabel).containsExactly(2, 3);
        assertThat(g.findPath(0, 3)).isNull();
        assertThat(g.findPath(3, 3)).isNull();
    }
}
