package com.riskcast.backend.service.validation;

import com.riskcast.backend.config.ValidationProperties;

public record ValidationTarget(double minAccuracy, double maxMae, double maxCalibrationError) {

    public static ValidationTarget from(ValidationProperties.Target target) {
        return new ValidationTarget(target.getMinAccuracy(), target.getMaxMae(), target.getMaxCalibrationError());
    }
}
