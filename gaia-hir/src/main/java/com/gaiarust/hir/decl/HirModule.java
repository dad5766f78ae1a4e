package com.gaiarust.hir.decl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 模块（编译单元）。
 */
public class HirModule {

    private final String name;
    private final List<HirFunction> functions;
    private final List<HirImpl> impls;

    public HirModule(String name, List<HirFunction> functions, List<HirImpl> impls) {
        this.name = name;
        this.functions = functions != null
                ? Collections.unmodifiableList(new ArrayList<HirFunction>(functions))
                : Collections.<HirFunction>emptyList();
        this.impls = impls != null
                ? Collections.unmodifiableList(new ArrayList<HirImpl>(impls))
                : Collections.<HirImpl>emptyList();
    }

    public String getName() {
        return name;
    }

    public List<HirFunction> getFunctions() {
        return functions;
    }

    public List<HirImpl> getImpls() {
        return impls;
    }
}
