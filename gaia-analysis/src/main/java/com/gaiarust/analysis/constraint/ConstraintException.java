package com.gaiarust.analysis.constraint;

import com.gaiarust.analysis.AnalysisException;

/**
 * 约束不可满足或超出上限时抛出。
 */
public class ConstraintException extends AnalysisException {

    private final ConstraintError error;

    public ConstraintException(ConstraintError error) {
        super(error.getCode(), error.toString());
        this.error = error;
    }

    @Override
    public ConstraintError getError() {
        return error;
    }
}
