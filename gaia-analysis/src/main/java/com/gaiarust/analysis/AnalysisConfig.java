package com.gaiarust.analysis;

/**
 * 语义分析配置
 */
public class AnalysisConfig {
    private int maxFixpointIterations = 100_000;
    private int maxBoundsPerType = 16;
    private boolean failFast = false;
    private boolean staticOutlivesAll = true;

    public AnalysisConfig() {
    }

    /** 约束传播、传递闭包等不动点循环的迭代上限 */
    public int getMaxFixpointIterations() {
        return maxFixpointIterations;
    }

    public void setMaxFixpointIterations(int maxFixpointIterations) {
        if (maxFixpointIterations <= 0) {
            throw new IllegalArgumentException("maxFixpointIterations must be positive: " + maxFixpointIterations);
        }
        this.maxFixpointIterations = maxFixpointIterations;
    }

    /** 单个类型参数允许的 where 约束数量上限 */
    public int getMaxBoundsPerType() {
        return maxBoundsPerType;
    }

    public void setMaxBoundsPerType(int maxBoundsPerType) {
        if (maxBoundsPerType <= 0) {
            throw new IllegalArgumentException("maxBoundsPerType must be positive: " + maxBoundsPerType);
        }
        this.maxBoundsPerType = maxBoundsPerType;
    }

    /** 为 true 时第一个出错的条目终止整个模块的分析 */
    public boolean isFailFast() {
        return failFast;
    }

    public void setFailFast(boolean failFast) {
        this.failFast = failFast;
    }

    /** 'static 是否隐式长于每个已登记的生命周期 */
    public boolean isStaticOutlivesAll() {
        return staticOutlivesAll;
    }

    public void setStaticOutlivesAll(boolean staticOutlivesAll) {
        this.staticOutlivesAll = staticOutlivesAll;
    }
}
