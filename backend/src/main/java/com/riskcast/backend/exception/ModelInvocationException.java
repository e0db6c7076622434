package com.riskcast.backend.exception;

import lombok.Getter;

@Getter
public class ModelInvocationException extends RiskEngineException {

    private final String modelId;

    public ModelInvocationException(String modelId, String message) {
        super(ErrorCode.MODEL_INVOCATION, Stage.MODEL, message);
        this.modelId = modelId;
    }

    public ModelInvocationException(String modelId, String message, Throwable cause) {
        super(ErrorCode.MODEL_INVOCATION, Stage.MODEL, message, cause);
        this.modelId = modelId;
    }

    @Override
    public boolean countsAsModelFailure() {
        return true;
    }
}
