package com.gaiarust.analysis.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * 以小整数 id 为节点的有向图，边带一个整数标签（调用方用它回查边的来源）。
 * <p>
 * 环检测是路径局部的 DFS：显式栈 + 在路径上的标记（回溯时清除），
 * 不使用递归，深图不会栈溢出。
 */
public final class DirectedGraph {

    /** 有向边 */
    public static final class Edge {
        private final int from;
        private final int to;
        private final int label;

        Edge(int from, int to, int label) {
            this.from = from;
            this.to = to;
            this.label = label;
        }

        public int getFrom() { return from; }
        public int getTo() { return to; }
        public int getLabel() { return label; }

        @Override
        public String toString() {
            return from + " -> " + to + " [" + label + "]";
        }
    }

    private static final byte UNVISITED = 0;
    private static final byte ON_PATH = 1;
    private static final byte DONE = 2;

    private final List<List<Edge>> adjacency = new ArrayList<List<Edge>>();

    public DirectedGraph(int nodeCount) {
        ensureNodes(nodeCount);
    }

    public void ensureNodes(int nodeCount) {
        while (adjacency.size() < nodeCount) {
            adjacency.add(new ArrayList<Edge>());
        }
    }

    public int nodeCount() {
        return adjacency.size();
    }

    public void addEdge(int from, int to, int label) {
        ensureNodes(Math.max(from, to) + 1);
        adjacency.get(from).add(new Edge(from, to, label));
    }

    public List<Edge> successors(int node) {
        return Collections.unmodifiableList(adjacency.get(node));
    }

    /**
     * 查找任意一个环（含自环）。
     *
     * @return 构成环的边序列（首边起点 == 末边终点），无环时返回 null
     */
    public List<Edge> findCycle() {
        int n = adjacency.size();
        byte[] state = new byte[n];
        int[] nextEdge = new int[n];
        Edge[] viaEdge = new Edge[n];

        for (int root = 0; root < n; root++) {
            if (state[root] != UNVISITED) continue;
            Deque<Integer> stack = new ArrayDeque<Integer>();
            stack.push(root);
            state[root] = ON_PATH;

            while (!stack.isEmpty()) {
                int node = stack.peek();
                List<Edge> edges = adjacency.get(node);
                if (nextEdge[node] < edges.size()) {
                    Edge edge = edges.get(nextEdge[node]++);
                    int target = edge.to;
                    if (state[target] == ON_PATH) {
                        return unwind(edge, viaEdge);
                    }
                    if (state[target] == UNVISITED) {
                        state[target] = ON_PATH;
                        viaEdge[target] = edge;
                        stack.push(target);
                    }
                } else {
                    // 回溯：节点离开当前路径
                    state[node] = DONE;
                    stack.pop();
                }
            }
        }
        return null;
    }

    /** 从回边沿 viaEdge 回溯到环的起点，得到按顺序排列的环 */
    private static List<Edge> unwind(Edge backEdge, Edge[] viaEdge) {
        List<Edge> cycle = new ArrayList<Edge>();
        cycle.add(backEdge);
        int cursor = backEdge.from;
        while (cursor != backEdge.to) {
            Edge e = viaEdge[cursor];
            cycle.add(e);
            cursor = e.from;
        }
        Collections.reverse(cycle);
        return cycle;
    }

    /**
     * 广度优先查找 from 到 to 的最短路径（至少一条边，因此 from == to 时返回经过 from 的环）。
     *
     * @return 边序列，不可达时返回 null
     */
    public List<Edge> findPath(int from, int to) {
        int n = adjacency.size();
        Edge[] viaEdge = new Edge[n];
        boolean[] seen = new boolean[n];
        Deque<Integer> queue = new ArrayDeque<Integer>();
        queue.add(from);

        while (!queue.isEmpty()) {
            int node = queue.poll();
            for (Edge edge : adjacency.get(node)) {
                if (edge.to == to) {
                    List<Edge> path = new ArrayList<Edge>();
                    path.add(edge);
                    int cursor = node;
                    while (cursor != from) {
                        Edge e = viaEdge[cursor];
                        path.add(e);
                        cursor = e.from;
                    }
                    Collections.reverse(path);
                    return path;
                }
                if (!seen[edge.to] && edge.to != from) {
                    seen[edge.to] = true;
                    viaEdge[edge.to] = edge;
                    queue.add(edge.to);
                }
            }
        }
        return null;
    }
}
