package com.gaiarust.analysis.solver;

import com.gaiarust.analysis.AnalysisException;

/**
 * 类型求解失败。第一个错误即终止当前求解，不保留部分推断结果。
 */
public class TypeCheckException extends AnalysisException {

    private final TypeError error;

    public TypeCheckException(TypeError error) {
        super(error.getCode(), error.toString());
        this.error = error;
    }

    @Override
    public TypeError getError() {
        return error;
    }
}
