package com.gaiarust.hir.type;

/**
 * 类型语法解析异常
 */
public class TypeSyntaxException extends RuntimeException {
    private final String source;
    private final int offset;

    public TypeSyntaxException(String message, String source, int offset) {
        super(message);
        this.source = source;
        this.offset = offset;
    }

    public String getSource() {
        return source;
    }

    public int getOffset() {
        return offset;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append(super.getMessage());
        if (source != null) {
            sb.append(" at offset ").append(offset);
            sb.append(" in '").append(source).append("'");
        }
        return sb.toString();
    }
}
