package com.gaiarust.analysis.lifetime;

import com.gaiarust.analysis.AnalysisConfig;
import com.gaiarust.analysis.graph.DirectedGraph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * outlives 约束求解：在上下文的约束快照上计算传递闭包，并找出互相 outlive 的环。
 * <p>
 * 'static 隐式长于每个已登记的生命周期，这些隐式边参与闭包但不参与环检查，
 * 只有显式声明的约束能构成违规。
 */
public final class LifetimeSolver {

    private static final Logger LOG = Logger.getLogger(LifetimeSolver.class.getName());

    private final AnalysisConfig config;
    private final List<Lifetime> lifetimes = new ArrayList<Lifetime>();
    private final Map<Lifetime, Integer> ids = new HashMap<Lifetime, Integer>();
    private final List<OutlivesConstraint> constraints;
    private final DirectedGraph declared;

    private BitSet[] reach;
    private BitSet[] declaredReach;
    private List<LifetimeViolation> violations;

    public LifetimeSolver(LifetimeContext context) {
        this(context, new AnalysisConfig());
    }

    public LifetimeSolver(LifetimeContext context, AnalysisConfig config) {
        this.config = config;
        this.constraints = new ArrayList<OutlivesConstraint>(context.constraints());
        for (Lifetime lifetime : context.registeredLifetimes()) {
            idOf(lifetime);
        }
        this.declared = new DirectedGraph(lifetimes.size());
        for (int i = 0; i < constraints.size(); i++) {
            OutlivesConstraint c = constraints.get(i);
            declared.addEdge(idOf(c.getLonger()), idOf(c.getShorter()), i);
        }
    }

    private int idOf(Lifetime lifetime) {
        Integer id = ids.get(lifetime);
        if (id != null) return id;
        int next = lifetimes.size();
        ids.put(lifetime, next);
        lifetimes.add(lifetime);
        return next;
    }

    // ============ 闭包 ============

    private void ensureSolved() {
        if (reach != null) return;
        int n = lifetimes.size();
        DirectedGraph full = new DirectedGraph(n);
        for (int i = 0; i < constraints.size(); i++) {
            OutlivesConstraint c = constraints.get(i);
            full.addEdge(ids.get(c.getLonger()), ids.get(c.getShorter()), i);
        }
        if (config.isStaticOutlivesAll()) {
            int staticId = ids.get(Lifetime.STATIC);
            for (int i = 0; i < n; i++) {
                if (i != staticId) full.addEdge(staticId, i, -1);
            }
        }
        reach = closure(full);
        declaredReach = closure(declared);
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("lifetime closure over " + n + " lifetime(s), " + constraints.size() + " constraint(s)");
        }
    }

    /**
     * 工作表不动点：某节点的可达集变化时，把它的前驱重新入队。
     *
     * @throws LifetimeException FIXPOINT_LIMIT_EXCEEDED
     */
    private BitSet[] closure(DirectedGraph graph) {
        int n = graph.nodeCount();
        BitSet[] result = new BitSet[n];
        List<List<Integer>> predecessors = new ArrayList<List<Integer>>(n);
        for (int i = 0; i < n; i++) {
            result[i] = new BitSet(n);
            predecessors.add(new ArrayList<Integer>());
        }
        for (int i = 0; i < n; i++) {
            for (DirectedGraph.Edge edge : graph.successors(i)) {
                result[i].set(edge.getTo());
                predecessors.get(edge.getTo()).add(i);
            }
        }

        Deque<Integer> worklist = new ArrayDeque<Integer>();
        boolean[] queued = new boolean[n];
        for (int i = 0; i < n; i++) {
            worklist.add(i);
            queued[i] = true;
        }
        int limit = config.getMaxFixpointIterations();
        int iterations = 0;
        while (!worklist.isEmpty()) {
            if (++iterations > limit) {
                throw new LifetimeException(LifetimeError.fixpointLimitExceeded(limit));
            }
            int node = worklist.poll();
            queued[node] = false;
            for (int pred : predecessors.get(node)) {
                BitSet before = (BitSet) result[pred].clone();
                result[pred].or(result[node]);
                if (!result[pred].equals(before) && !queued[pred]) {
                    worklist.add(pred);
                    queued[pred] = true;
                }
            }
        }
        return result;
    }

    // ============ 违规 ============

    /** 每组互相 outlive 的生命周期一条违规，按生命周期登记顺序 */
    public List<LifetimeViolation> violations() {
        if (violations != null) return violations;
        ensureSolved();
        List<LifetimeViolation> found = new ArrayList<LifetimeViolation>();
        BitSet covered = new BitSet(lifetimes.size());
        for (int i = 0; i < lifetimes.size(); i++) {
            if (covered.get(i) || !declaredReach[i].get(i)) continue;
            for (int j = declaredReach[i].nextSetBit(0); j >= 0; j = declaredReach[i].nextSetBit(j + 1)) {
                if (declaredReach[j].get(i)) covered.set(j);
            }
            found.add(witness(i));
        }
        violations = Collections.unmodifiableList(found);
        return violations;
    }

    private LifetimeViolation witness(int node) {
        List<DirectedGraph.Edge> cycle = declared.findPath(node, node);
        List<Lifetime> path = new ArrayList<Lifetime>();
        List<String> reasons = new ArrayList<String>();
        path.add(lifetimes.get(node));
        for (DirectedGraph.Edge edge : cycle) {
            path.add(lifetimes.get(edge.getTo()));
            reasons.add(constraints.get(edge.getLabel()).getReason());
        }
        return new LifetimeViolation(path, reasons);
    }

    public boolean isSatisfiable() {
        return violations().isEmpty();
    }

    /**
     * @throws LifetimeException CYCLIC_LIFETIME，携带第一个环的路径
     */
    public void checkSatisfiable() {
        List<LifetimeViolation> found = violations();
        if (!found.isEmpty()) {
            throw new LifetimeException(found.get(0).toError());
        }
    }

    // ============ 查询 ============

    /** lifetime 传递地长于的所有生命周期；未知生命周期返回空集 */
    public Set<Lifetime> getOutlives(Lifetime lifetime) {
        ensureSolved();
        Integer id = ids.get(lifetime);
        if (id == null) return Collections.emptySet();
        return toLifetimes(reach[id]);
    }

    /** 按名称查询，返回显示名（'b, 'c） */
    public Set<String> getOutlives(String name) {
        return displayNames(getOutlives(Lifetime.named(name)));
    }

    /** 传递地长于 lifetime 的所有其他生命周期 */
    public Set<Lifetime> getOutlivedBy(Lifetime lifetime) {
        ensureSolved();
        Integer id = ids.get(lifetime);
        if (id == null) return Collections.emptySet();
        Set<Lifetime> result = new LinkedHashSet<Lifetime>();
        for (int i = 0; i < lifetimes.size(); i++) {
            if (i != id && reach[i].get(id)) result.add(lifetimes.get(i));
        }
        return Collections.unmodifiableSet(result);
    }

    public Set<String> getOutlivedBy(String name) {
        return displayNames(getOutlivedBy(Lifetime.named(name)));
    }

    /** longer 是否（传递地）长于 shorter；相同生命周期视为成立 */
    public boolean outlives(Lifetime longer, Lifetime shorter) {
        if (longer.equals(shorter)) return true;
        ensureSolved();
        Integer from = ids.get(longer);
        Integer to = ids.get(shorter);
        return from != null && to != null && reach[from].get(to);
    }

    public List<OutlivesConstraint> constraints() {
        return Collections.unmodifiableList(constraints);
    }

    private Set<Lifetime> toLifetimes(BitSet bits) {
        Set<Lifetime> result = new LinkedHashSet<Lifetime>();
        for (int i = bits.nextSetBit(0); i >= 0; i = bits.nextSetBit(i + 1)) {
            result.add(lifetimes.get(i));
        }
        return Collections.unmodifiableSet(result);
    }

    private static Set<String> displayNames(Set<Lifetime> lifetimes) {
        Set<String> names = new LinkedHashSet<String>();
        for (Lifetime lifetime : lifetimes) {
            names.add(lifetime.toDisplayString());
        }
        return Collections.unmodifiableSet(names);
    }
}
