package com.riskcast.backend.exception;

public class EngineTimeoutException extends RiskEngineException {

    public EngineTimeoutException(Stage stage, String message) {
        super(ErrorCode.TIMEOUT, stage, message);
    }

    @Override
    public boolean countsAsModelFailure() {
        return getStage() == Stage.ROUTER || getStage() == Stage.MODEL;
    }
}
