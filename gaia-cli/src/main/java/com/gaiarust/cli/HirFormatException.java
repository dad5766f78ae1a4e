package com.gaiarust.cli;

/**
 * JSON HIR 结构错误（缺少字段、未知运算符、类型语法错误等）
 */
public class HirFormatException extends RuntimeException {
    private final String path;

    public HirFormatException(String message, String path) {
        super(message);
        this.path = path;
    }

    public HirFormatException(String message, String path, Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    /** 出错节点在 JSON 中的路径，如 functions[0].body[2] */
    public String getPath() {
        return path;
    }

    @Override
    public String getMessage() {
        return path != null ? super.getMessage() + " at " + path : super.getMessage();
    }
}
