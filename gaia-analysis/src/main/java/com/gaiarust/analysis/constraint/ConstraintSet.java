package com.gaiarust.analysis.constraint;

import com.gaiarust.analysis.AnalysisConfig;
import com.gaiarust.analysis.graph.DirectedGraph;
import com.gaiarust.analysis.graph.NameInterner;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 约束存储：去重的约束列表（保持插入顺序）+ 按类型 / 生命周期键建立的索引。
 * <p>
 * 作用域为一个函数体；模块级的约束通过 {@link #merge(ConstraintSet)} 并入。
 * 非线程安全，每个条目独占一个实例。
 */
public final class ConstraintSet {

    private static final Logger LOG = Logger.getLogger(ConstraintSet.class.getName());

    private final int maxFixpointIterations;
    private final List<Constraint> constraints = new ArrayList<Constraint>();
    private final Set<Constraint> membership = new HashSet<Constraint>();
    private final Map<String, List<Constraint>> resolved = new LinkedHashMap<String, List<Constraint>>();

    public ConstraintSet() {
        this(new AnalysisConfig());
    }

    public ConstraintSet(AnalysisConfig config) {
        this.maxFixpointIterations = config.getMaxFixpointIterations();
    }

    /**
     * 加入约束；已存在结构相同的约束时什么也不做。
     *
     * @return 是否真正加入
     */
    public boolean addConstraint(Constraint constraint) {
        if (constraint == null) throw new IllegalArgumentException("constraint is null");
        if (!membership.add(constraint)) return false;
        constraints.add(constraint);
        index(constraint);
        return true;
    }

    /** 从头重建索引：每个约束登记在它提到的每个键下。可重复调用。 */
    public void resolve() {
        resolved.clear();
        for (Constraint c : constraints) {
            index(c);
        }
    }

    private void index(Constraint constraint) {
        for (String key : constraint.keys()) {
            List<Constraint> bucket = resolved.get(key);
            if (bucket == null) {
                bucket = new ArrayList<Constraint>();
                resolved.put(key, bucket);
            }
            bucket.add(constraint);
        }
    }

    /** 提到 key 的所有约束，没有时返回空列表 */
    public List<Constraint> getConstraints(String key) {
        List<Constraint> bucket = resolved.get(key);
        return bucket != null
                ? Collections.unmodifiableList(bucket)
                : Collections.<Constraint>emptyList();
    }

    /** 索引中出现过的所有键 */
    public Set<String> keys() {
        return Collections.unmodifiableSet(resolved.keySet());
    }

    /** type 上的所有 trait 约束名 */
    public Set<String> traitBoundsOf(String type) {
        Set<String> traits = new LinkedHashSet<String>();
        for (Constraint c : getConstraints(type)) {
            if (c.isTraitBound() && c.getSubject().equals(type)) {
                traits.add(c.getObject());
            }
        }
        return traits;
    }

    // ============ 可满足性 ============

    /**
     * 检查等式约束是否可满足。
     * <p>
     * 纯等式构成的环（A == B, B == C, C == A）只是把几个名字并入同一个等价类，是合法的；
     * 只有经过结构包含边回到自身的环（T == Vec&lt;T&gt;）才是无限类型。
     * 做法：先用等式把名字合并成等价类，再在"复合名 → 组成部分"的类间图上做路径局部 DFS。
     *
     * @throws ConstraintException CYCLIC_TYPE_CONSTRAINT
     */
    public void checkSatisfiable() {
        NameInterner names = new NameInterner();
        List<String[]> containment = new ArrayList<String[]>();
        Deque<String> pending = new ArrayDeque<String>();

        for (Constraint c : constraints) {
            if (!c.isTypeEquality()) continue;
            intern(c.getSubject(), names, pending);
            intern(c.getObject(), names, pending);
        }
        while (!pending.isEmpty()) {
            String compound = pending.poll();
            for (String component : TypeNames.components(compound)) {
                containment.add(new String[]{compound, component});
                intern(component, names, pending);
            }
        }

        UnionFind classes = new UnionFind(names.size());
        for (Constraint c : constraints) {
            if (c.isTypeEquality()) {
                classes.union(names.idOf(c.getSubject()), names.idOf(c.getObject()));
            }
        }

        DirectedGraph classGraph = new DirectedGraph(names.size());
        for (int i = 0; i < containment.size(); i++) {
            String[] pair = containment.get(i);
            classGraph.addEdge(classes.find(names.idOf(pair[0])), classes.find(names.idOf(pair[1])), i);
        }

        List<DirectedGraph.Edge> cycle = classGraph.findCycle();
        if (cycle != null) {
            List<String> path = new ArrayList<String>();
            for (DirectedGraph.Edge edge : cycle) {
                String[] pair = containment.get(edge.getLabel());
                path.add(pair[0]);
                path.add(pair[1]);
            }
            throw new ConstraintException(ConstraintError.cyclicTypeConstraint(path.get(0), path));
        }
    }

    private static void intern(String name, NameInterner names, Deque<String> pending) {
        if (names.idOf(name) >= 0) return;
        names.intern(name);
        pending.add(name);
    }

    /** name 所在的等价类（只看等式约束），至少包含 name 自身 */
    public Set<String> equivalenceClassOf(String name) {
        Set<String> result = new LinkedHashSet<String>();
        Deque<String> queue = new ArrayDeque<String>();
        result.add(name);
        queue.add(name);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (Constraint c : getConstraints(current)) {
                if (!c.isTypeEquality()) continue;
                String other = c.getSubject().equals(current) ? c.getObject() : c.getSubject();
                if (result.add(other)) queue.add(other);
            }
        }
        return result;
    }

    // ============ 传播 ============

    /**
     * 沿等式边传播 trait 约束直到不动点：A == B 且 A: Tr 时推出 B: Tr（等式对称，反向同理）。
     * 新推出的约束进入工作队列，而不是整表重扫。
     *
     * @return 新推出的约束数量
     * @throws ConstraintException 迭代次数超出上限时抛出 FIXPOINT_LIMIT_EXCEEDED
     */
    public int propagateConstraints() {
        Map<String, List<String>> equalTo = new LinkedHashMap<String, List<String>>();
        Deque<Constraint> worklist = new ArrayDeque<Constraint>();
        for (Constraint c : constraints) {
            if (c.isTypeEquality()) {
                link(equalTo, c.getSubject(), c.getObject());
                link(equalTo, c.getObject(), c.getSubject());
            } else if (c.isTraitBound()) {
                worklist.add(c);
            }
        }

        int derived = 0;
        int iterations = 0;
        while (!worklist.isEmpty()) {
            if (++iterations > maxFixpointIterations) {
                throw new ConstraintException(ConstraintError.fixpointLimitExceeded(maxFixpointIterations));
            }
            Constraint bound = worklist.poll();
            List<String> neighbours = equalTo.get(bound.getSubject());
            if (neighbours == null) continue;
            for (String other : neighbours) {
                Constraint candidate = Constraint.traitBound(other, bound.getObject());
                if (addConstraint(candidate)) {
                    worklist.add(candidate);
                    derived++;
                }
            }
        }
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("propagated " + derived + " trait bound(s) in " + iterations + " step(s)");
        }
        return derived;
    }

    private static void link(Map<String, List<String>> equalTo, String from, String to) {
        if (from.equals(to)) return;
        List<String> list = equalTo.get(from);
        if (list == null) {
            list = new ArrayList<String>();
            equalTo.put(from, list);
        }
        if (!list.contains(to)) list.add(to);
    }

    // ============ 组合 ============

    /** 并入另一个约束集（保持去重） */
    public void merge(ConstraintSet other) {
        for (Constraint c : other.constraints) {
            addConstraint(c);
        }
    }

    public List<Constraint> constraints() {
        return Collections.unmodifiableList(constraints);
    }

    public int size() {
        return constraints.size();
    }

    public boolean isEmpty() {
        return constraints.isEmpty();
    }

    @Override
    public String toString() {
        return constraints.toString();
    }

    /** 带路径压缩的并查集 */
    private static final class UnionFind {
        private final int[] parent;

        UnionFind(int size) {
            parent = new int[size];
            for (int i = 0; i < size; i++) parent[i] = i;
        }

        int find(int x) {
            int root = x;
            while (parent[root] != root) root = parent[root];
            while (parent[x] != root) {
                int next = parent[x];
                parent[x] = root;
                x = next;
            }
            return root;
        }

        void union(int a, int b) {
            int ra = find(a);
            int rb = find(b);
            if (ra != rb) parent[ra] = rb;
        }
    }
}
