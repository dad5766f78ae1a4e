package com.gaiarust.hir;

/**
 * HIR（High-level IR）节点接口。
 * HIR 由上游降级阶段产出，本模块只作为纯数据消费。
 */
public interface HirNode {

    SourceLocation getLocation();
}
