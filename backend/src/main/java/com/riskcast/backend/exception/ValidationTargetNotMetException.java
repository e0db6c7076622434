package com.riskcast.backend.exception;

import lombok.Getter;

import java.util.List;

@Getter
public class ValidationTargetNotMetException extends RiskEngineException {

    private final List<String> failedTargets;

    public ValidationTargetNotMetException(String message, List<String> failedTargets) {
        super(ErrorCode.VALIDATION_TARGET_NOT_MET, Stage.HARNESS, message);
        this.failedTargets = List.copyOf(failedTargets);
    }
}
