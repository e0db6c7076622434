package com.riskcast.backend.exception;

public class ResourceExhaustedException extends RiskEngineException {
    public ResourceExhaustedException(String message) {
        super(ErrorCode.RESOURCE_EXHAUSTED, Stage.ADMISSION, message);
    }

    public ResourceExhaustedException(String message, Throwable cause) {
        super(ErrorCode.RESOURCE_EXHAUSTED, Stage.ADMISSION, message, cause);
    }

    public ResourceExhaustedException(Stage stage, String message, Throwable cause) {
        super(ErrorCode.RESOURCE_EXHAUSTED, stage, message, cause);
    }
}
