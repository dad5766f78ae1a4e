package com.gaiarust.analysis;

/**
 * 语义分析异常基类。
 * <p>
 * 求解器入口在第一个错误处抛出子类异常，携带结构化错误值；
 * 驱动器按条目捕获并转换为 {@link SemanticDiagnostic}。
 */
public abstract class AnalysisException extends RuntimeException {

    private final DiagnosticCode code;

    protected AnalysisException(DiagnosticCode code, String message) {
        super(message);
        this.code = code;
    }

    public DiagnosticCode getCode() {
        return code;
    }

    /** 结构化错误值（TypeError / LifetimeError / ConstraintError） */
    public abstract Object getError();
}
