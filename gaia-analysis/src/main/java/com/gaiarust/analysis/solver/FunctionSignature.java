package com.gaiarust.analysis.solver;

import com.gaiarust.hir.type.HirType;
import com.gaiarust.hir.type.HirTypes;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 已登记函数的签名。typeParams 非空时为泛型函数，每次调用以新占位符实例化。
 */
public final class FunctionSignature {

    private final String name;
    private final List<String> typeParams;
    private final List<HirType> paramTypes;
    private final HirType returnType;

    public FunctionSignature(String name, List<String> typeParams, List<HirType> paramTypes, HirType returnType) {
        this.name = name;
        this.typeParams = typeParams == null
                ? Collections.<String>emptyList()
                : Collections.unmodifiableList(new ArrayList<String>(typeParams));
        this.paramTypes = Collections.unmodifiableList(new ArrayList<HirType>(paramTypes));
        this.returnType = returnType != null ? returnType : HirTypes.UNIT;
    }

    public String getName() {
        return name;
    }

    public List<String> getTypeParams() {
        return typeParams;
    }

    public boolean isGeneric() {
        return !typeParams.isEmpty();
    }

    public List<HirType> getParamTypes() {
        return paramTypes;
    }

    public int arity() {
        return paramTypes.size();
    }

    public HirType getReturnType() {
        return returnType;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("fn ").append(name);
        if (isGeneric()) sb.append(typeParams.toString().replace('[', '<').replace(']', '>'));
        sb.append('(');
        for (int i = 0; i < paramTypes.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(paramTypes.get(i).toDisplayString());
        }
        return sb.append(") -> ").append(returnType.toDisplayString()).toString();
    }
}
