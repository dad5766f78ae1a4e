package com.gaiarust.analysis.lifetime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 生命周期省略的结果：每个参数的生命周期（非引用参数为 null）、返回值的生命周期和采用的规则。
 */
public final class ElisionResult {

    /** 省略规则，按尝试顺序 */
    public enum Rule {
        /** 恰好一个引用参数，返回引用：共用同一个生命周期 */
        SINGLE_INPUT,
        /** 多个引用参数且第一个是引用，返回引用：返回值沿用第一个参数的生命周期 */
        FIRST_INPUT,
        /** 其余情况：各引用参数独立，返回值没有生命周期 */
        INDEPENDENT
    }

    private final List<Lifetime> inputLifetimes;
    private final Lifetime outputLifetime;
    private final Rule rule;
    private final boolean returnsReference;

    public ElisionResult(List<Lifetime> inputLifetimes, Lifetime outputLifetime, Rule rule, boolean returnsReference) {
        this.inputLifetimes = Collections.unmodifiableList(new ArrayList<Lifetime>(inputLifetimes));
        this.outputLifetime = outputLifetime;
        this.rule = rule;
        this.returnsReference = returnsReference;
    }

    /** 第 i 个参数的生命周期，非引用参数为 null */
    public Lifetime getInputLifetime(int index) {
        return inputLifetimes.get(index);
    }

    public List<Lifetime> getInputLifetimes() {
        return inputLifetimes;
    }

    /** 返回值的生命周期，没有时为 null */
    public Lifetime getOutputLifetime() {
        return outputLifetime;
    }

    public Rule getRule() {
        return rule;
    }

    public boolean returnsReference() {
        return returnsReference;
    }

    /** 返回引用却没有规则提供生命周期 */
    public boolean isAmbiguous() {
        return returnsReference && outputLifetime == null;
    }

    /**
     * 取返回值的生命周期。
     *
     * @throws LifetimeException AMBIGUOUS_RETURN_LIFETIME
     */
    public Lifetime requireOutputLifetime(String function) {
        if (isAmbiguous()) {
            throw new LifetimeException(LifetimeError.ambiguousReturnLifetime(function));
        }
        return outputLifetime;
    }

    @Override
    public String toString() {
        return rule + " " + inputLifetimes + " -> " + outputLifetime;
    }
}
