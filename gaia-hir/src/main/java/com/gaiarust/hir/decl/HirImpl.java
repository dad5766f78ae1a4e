package com.gaiarust.hir.decl;

import com.gaiarust.hir.HirNode;
import com.gaiarust.hir.SourceLocation;
import com.gaiarust.hir.type.HirType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * impl 块: impl [Trait for] SelfType { type Assoc = Concrete; fn ... }
 */
public class HirImpl implements HirNode {

    private final SourceLocation location;
    private final String implId;
    private final String traitName;
    private final HirType selfType;
    private final Map<String, HirType> assocTypeBindings;
    private final List<HirFunction> methods;

    public HirImpl(SourceLocation location, String implId, String traitName, HirType selfType,
                   Map<String, HirType> assocTypeBindings, List<HirFunction> methods) {
        this.location = location != null ? location : SourceLocation.UNKNOWN;
        this.implId = implId;
        this.traitName = traitName;
        this.selfType = selfType;
        this.assocTypeBindings = assocTypeBindings != null
                ? Collections.unmodifiableMap(new LinkedHashMap<String, HirType>(assocTypeBindings))
                : Collections.<String, HirType>emptyMap();
        this.methods = methods != null
                ? Collections.unmodifiableList(new ArrayList<HirFunction>(methods))
                : Collections.<HirFunction>emptyList();
    }

    @Override
    public SourceLocation getLocation() {
        return location;
    }

    public String getImplId() {
        return implId;
    }

    /** 固有 impl 时为 null */
    public String getTraitName() {
        return traitName;
    }

    public HirType getSelfType() {
        return selfType;
    }

    /** 显式的 type Assoc = Concrete 绑定 */
    public Map<String, HirType> getAssocTypeBindings() {
        return assocTypeBindings;
    }

    public List<HirFunction> getMethods() {
        return methods;
    }
}
