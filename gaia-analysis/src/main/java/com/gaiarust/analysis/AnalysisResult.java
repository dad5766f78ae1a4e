package com.gaiarust.analysis;

import java.util.Collections;
import java.util.List;

/**
 * 语义分析结果
 */
public final class AnalysisResult {
    private final String moduleName;
    private final List<ItemResult> items;
    private final List<SemanticDiagnostic> diagnostics;

    public AnalysisResult(String moduleName, List<ItemResult> items, List<SemanticDiagnostic> diagnostics) {
        this.moduleName = moduleName;
        this.items = Collections.unmodifiableList(items);
        this.diagnostics = Collections.unmodifiableList(diagnostics);
    }

    public String getModuleName() { return moduleName; }
    /** 分析成功的条目，按模块顺序 */
    public List<ItemResult> getItems() { return items; }
    public List<SemanticDiagnostic> getDiagnostics() { return diagnostics; }

    public boolean hasErrors() {
        for (SemanticDiagnostic d : diagnostics) {
            if (d.getSeverity() == SemanticDiagnostic.Severity.ERROR) return true;
        }
        return false;
    }

    /** 按名称查找成功的条目，不存在返回 null */
    public ItemResult getItem(String name) {
        for (ItemResult item : items) {
            if (item.getItemName().equals(name)) return item;
        }
        return null;
    }
}
