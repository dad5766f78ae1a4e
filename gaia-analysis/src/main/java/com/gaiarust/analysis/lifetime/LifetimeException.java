package com.gaiarust.analysis.lifetime;

import com.gaiarust.analysis.AnalysisException;

/**
 * 生命周期检查失败。
 */
public class LifetimeException extends AnalysisException {

    private final LifetimeError error;

    public LifetimeException(LifetimeError error) {
        super(error.getCode(), error.toString());
        this.error = error;
    }

    @Override
    public LifetimeError getError() {
        return error;
    }
}
