package com.gaiarust.analysis.lifetime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 一个函数 / impl 作用域内的生命周期信息：新生命周期计数器、命名生命周期表、
 * 已登记集合和 outlives 约束列表。'static 总是已登记。
 * 离开作用域时 {@link #clear()}。
 */
public final class LifetimeContext {

    private int nextId;
    private final Map<String, Lifetime> named = new LinkedHashMap<String, Lifetime>();
    private final Set<Lifetime> registered = new LinkedHashSet<Lifetime>();
    private final List<OutlivesConstraint> constraints = new ArrayList<OutlivesConstraint>();
    private final Set<OutlivesConstraint> membership = new HashSet<OutlivesConstraint>();

    public LifetimeContext() {
        registered.add(Lifetime.STATIC);
    }

    /** 新的推断生命周期 'l0, 'l1 ...，自动登记 */
    public Lifetime freshLifetime() {
        Lifetime lifetime = Lifetime.inferred(nextId++);
        registered.add(lifetime);
        return lifetime;
    }

    /** 登记命名生命周期；重复登记返回同一个值。"static" 返回 'static */
    public Lifetime registerNamedLifetime(String name) {
        Lifetime lifetime = Lifetime.named(name);
        if (lifetime.isStatic()) return lifetime;
        Lifetime existing = named.get(lifetime.getName());
        if (existing != null) return existing;
        named.put(lifetime.getName(), lifetime);
        registered.add(lifetime);
        return lifetime;
    }

    /** 按名称查找已登记的生命周期，未登记返回 null */
    public Lifetime lookup(String name) {
        Lifetime lifetime = Lifetime.named(name);
        if (lifetime.isStatic()) return lifetime;
        return named.get(lifetime.getName());
    }

    public boolean isRegistered(Lifetime lifetime) {
        return registered.contains(lifetime);
    }

    public boolean isRegistered(String name) {
        return lookup(name) != null;
    }

    /**
     * 加入 longer: shorter。相同两端的约束只保留第一次的原因。
     *
     * @return 是否新加入
     * @throws LifetimeException UNREGISTERED_LIFETIME，任一端未登记
     */
    public boolean addOutlivesConstraint(Lifetime longer, Lifetime shorter, String reason) {
        requireRegistered(longer);
        requireRegistered(shorter);
        OutlivesConstraint constraint = new OutlivesConstraint(longer, shorter, reason);
        if (!membership.add(constraint)) return false;
        constraints.add(constraint);
        return true;
    }

    /** 按名称加入约束，名称可带或不带撇号 */
    public boolean addOutlivesConstraint(String longer, String shorter, String reason) {
        return addOutlivesConstraint(require(longer), require(shorter), reason);
    }

    private Lifetime require(String name) {
        Lifetime lifetime = lookup(name);
        if (lifetime == null) {
            throw new LifetimeException(LifetimeError.unregisteredLifetime(Lifetime.normalize(name)));
        }
        return lifetime;
    }

    private void requireRegistered(Lifetime lifetime) {
        if (!registered.contains(lifetime)) {
            String name = lifetime.isInferred() ? "l" + lifetime.getId() : lifetime.getName();
            throw new LifetimeException(LifetimeError.unregisteredLifetime(name));
        }
    }

    /** 已登记的生命周期，按登记顺序，'static 在首位 */
    public Set<Lifetime> registeredLifetimes() {
        return Collections.unmodifiableSet(registered);
    }

    public List<OutlivesConstraint> constraints() {
        return Collections.unmodifiableList(constraints);
    }

    /** 清空约束和登记信息，计数器归零 */
    public void clear() {
        nextId = 0;
        named.clear();
        registered.clear();
        registered.add(Lifetime.STATIC);
        constraints.clear();
        membership.clear();
    }
}
