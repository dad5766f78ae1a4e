package com.gaiarust.analysis;

import com.gaiarust.hir.SourceLocation;

/**
 * 语义诊断条目
 */
public final class SemanticDiagnostic {

    public enum Severity {
        ERROR, WARNING, INFO, HINT
    }

    private final Severity severity;
    private final DiagnosticCode code;
    private final String item;
    private final String message;
    private final Object detail;
    private final SourceLocation location;

    public SemanticDiagnostic(Severity severity, DiagnosticCode code, String item, String message,
                              Object detail, SourceLocation location) {
        this.severity = severity;
        this.code = code;
        this.item = item;
        this.message = message;
        this.detail = detail;
        this.location = location != null ? location : SourceLocation.UNKNOWN;
    }

    /** 由条目分析抛出的异常生成 ERROR 诊断 */
    public static SemanticDiagnostic fromException(String item, SourceLocation location, AnalysisException e) {
        return new SemanticDiagnostic(Severity.ERROR, e.getCode(), item, e.getMessage(), e.getError(), location);
    }

    public Severity getSeverity() { return severity; }
    public DiagnosticCode getCode() { return code; }
    /** 出错条目的名称，impl 方法为 implId::method */
    public String getItem() { return item; }
    public String getMessage() { return message; }
    /** 结构化错误值（TypeError / LifetimeError / ConstraintError） */
    public Object getDetail() { return detail; }
    public SourceLocation getLocation() { return location; }

    @Override
    public String toString() {
        return severity + " " + code + " in " + item + ": " + message;
    }
}
