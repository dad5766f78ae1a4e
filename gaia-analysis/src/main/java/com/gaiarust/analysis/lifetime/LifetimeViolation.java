package com.gaiarust.analysis.lifetime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 一组互相 outlive 的生命周期：环上的路径（首尾相同）以及每条边的原因。
 */
public final class LifetimeViolation {

    private final List<Lifetime> path;
    private final List<String> reasons;

    public LifetimeViolation(List<Lifetime> path, List<String> reasons) {
        this.path = Collections.unmodifiableList(new ArrayList<Lifetime>(path));
        this.reasons = Collections.unmodifiableList(new ArrayList<String>(reasons));
    }

    public List<Lifetime> getPath() {
        return path;
    }

    public List<String> getReasons() {
        return reasons;
    }

    /** 环的起点 */
    public Lifetime getLifetime() {
        return path.get(0);
    }

    public LifetimeError toError() {
        return LifetimeError.cyclicLifetime(path, reasons);
    }

    @Override
    public String toString() {
        return toError().toString();
    }
}
