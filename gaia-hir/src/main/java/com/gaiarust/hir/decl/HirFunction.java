package com.gaiarust.hir.decl;

import com.gaiarust.hir.HirNode;
import com.gaiarust.hir.SourceLocation;
import com.gaiarust.hir.type.HirType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 函数声明（自由函数或 impl 方法），是分析的基本单元。
 */
public class HirFunction implements HirNode {

    private final SourceLocation location;
    private final String name;
    private final List<String> lifetimeParams;
    private final List<String> typeParams;
    private final List<HirWhereClause> whereClauses;
    private final List<HirParam> params;
    private final HirType returnType;       // null 表示 ()
    private final List<HirStmt> body;

    public HirFunction(SourceLocation location, String name,
                       List<String> lifetimeParams, List<String> typeParams,
                       List<HirWhereClause> whereClauses, List<HirParam> params,
                       HirType returnType, List<HirStmt> body) {
        this.location = location != null ? location : SourceLocation.UNKNOWN;
        this.name = name;
        this.lifetimeParams = copy(lifetimeParams);
        this.typeParams = copy(typeParams);
        this.whereClauses = copy(whereClauses);
        this.params = copy(params);
        this.returnType = returnType;
        this.body = copy(body);
    }

    private static <T> List<T> copy(List<T> list) {
        return list == null || list.isEmpty()
                ? Collections.<T>emptyList()
                : Collections.unmodifiableList(new ArrayList<T>(list));
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    @Override
    public SourceLocation getLocation() {
        return location;
    }

    public String getName() {
        return name;
    }

    public List<String> getLifetimeParams() {
        return lifetimeParams;
    }

    public List<String> getTypeParams() {
        return typeParams;
    }

    public List<HirWhereClause> getWhereClauses() {
        return whereClauses;
    }

    public List<HirParam> getParams() {
        return params;
    }

    public HirType getReturnType() {
        return returnType;
    }

    public boolean hasReturnType() {
        return returnType != null;
    }

    public List<HirStmt> getBody() {
        return body;
    }

    /** 参数类型列表（按声明顺序） */
    public List<HirType> getParamTypes() {
        List<HirType> types = new ArrayList<HirType>(params.size());
        for (HirParam p : params) {
            types.add(p.getType());
        }
        return types;
    }

    @Override
    public String toString() {
        return "fn " + name;
    }

    /**
     * HirFunction 构建器。
     */
    public static final class Builder {
        private final String name;
        private SourceLocation location = SourceLocation.UNKNOWN;
        private final List<String> lifetimeParams = new ArrayList<String>();
        private final List<String> typeParams = new ArrayList<String>();
        private final List<HirWhereClause> whereClauses = new ArrayList<HirWhereClause>();
        private final List<HirParam> params = new ArrayList<HirParam>();
        private HirType returnType;
        private final List<HirStmt> body = new ArrayList<HirStmt>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder location(SourceLocation location) {
            this.location = location;
            return this;
        }

        public Builder lifetime(String lifetime) {
            lifetimeParams.add(lifetime);
            return this;
        }

        public Builder typeParam(String typeParam) {
            typeParams.add(typeParam);
            return this;
        }

        public Builder where(HirWhereClause clause) {
            whereClauses.add(clause);
            return this;
        }

        public Builder param(String paramName, HirType type) {
            params.add(new HirParam(paramName, type));
            return this;
        }

        public Builder param(HirParam param) {
            params.add(param);
            return this;
        }

        public Builder returns(HirType type) {
            this.returnType = type;
            return this;
        }

        public Builder stmt(HirStmt stmt) {
            body.add(stmt);
            return this;
        }

        public HirFunction build() {
            return new HirFunction(location, name, lifetimeParams, typeParams,
                    whereClauses, params, returnType, body);
        }
    }
}
