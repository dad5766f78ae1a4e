package com.gaiarust.analysis;

import com.gaiarust.analysis.constraint.ConstraintSet;
import com.gaiarust.analysis.lifetime.ElisionResult;
import com.gaiarust.analysis.lifetime.OutlivesConstraint;
import com.gaiarust.analysis.solver.TypeSolution;
import com.gaiarust.hir.type.HirType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 单个条目分析成功后的结果。
 */
public final class ItemResult {
    private final String itemName;
    private final TypeSolution solution;
    private final List<HirType> statementTypes;
    private final HirType bodyType;
    private final ElisionResult elision;
    private final ConstraintSet constraints;
    private final List<OutlivesConstraint> outlives;

    public ItemResult(String itemName, TypeSolution solution, List<HirType> statementTypes, HirType bodyType,
                      ElisionResult elision, ConstraintSet constraints, List<OutlivesConstraint> outlives) {
        this.itemName = itemName;
        this.solution = solution;
        this.statementTypes = Collections.unmodifiableList(new ArrayList<HirType>(statementTypes));
        this.bodyType = bodyType;
        this.elision = elision;
        this.constraints = constraints;
        this.outlives = Collections.unmodifiableList(new ArrayList<OutlivesConstraint>(outlives));
    }

    public String getItemName() { return itemName; }
    /** 参数和 let 绑定的类型 */
    public TypeSolution getSolution() { return solution; }
    /** 函数体每条语句的类型，与语句一一对应 */
    public List<HirType> getStatementTypes() { return statementTypes; }
    /** 函数体的值类型（末尾表达式语句的类型，否则为 ()） */
    public HirType getBodyType() { return bodyType; }
    public ElisionResult getElision() { return elision; }
    public ConstraintSet getConstraints() { return constraints; }
    public List<OutlivesConstraint> getOutlives() { return outlives; }
}
