package com.gaiarust.hir.decl;

import com.gaiarust.hir.HirNode;
import com.gaiarust.hir.SourceLocation;
import com.gaiarust.hir.type.HirType;
import com.gaiarust.hir.type.ReferenceType;

/**
 * 函数参数。
 */
public class HirParam implements HirNode {

    private final SourceLocation location;
    private final String name;
    private final HirType type;

    public HirParam(SourceLocation location, String name, HirType type) {
        this.location = location != null ? location : SourceLocation.UNKNOWN;
        this.name = name;
        this.type = type;
    }

    public HirParam(String name, HirType type) {
        this(SourceLocation.UNKNOWN, name, type);
    }

    @Override
    public SourceLocation getLocation() {
        return location;
    }

    public String getName() {
        return name;
    }

    public HirType getType() {
        return type;
    }

    /** 顶层是否为引用类型（省略规则只看顶层引用） */
    public boolean isReference() {
        return type instanceof ReferenceType;
    }
}
