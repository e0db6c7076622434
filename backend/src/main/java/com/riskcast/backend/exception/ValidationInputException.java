package com.riskcast.backend.exception;

public class ValidationInputException extends RiskEngineException {
    public ValidationInputException(String message) {
        super(ErrorCode.VALIDATION_INPUT, Stage.VALIDATION, message);
    }
}
