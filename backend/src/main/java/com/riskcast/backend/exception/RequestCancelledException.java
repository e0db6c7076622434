package com.riskcast.backend.exception;

public class RequestCancelledException extends RiskEngineException {
    public RequestCancelledException(Stage stage, String message) {
        super(ErrorCode.CANCELLED, stage, message);
    }
}
