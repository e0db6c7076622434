package com.riskcast.backend.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.riskcast.backend.exception.ValidationInputException;

import java.util.Locale;

/**
 * Model preference accepted at the API boundary. Legacy names of the original model families are
 * accepted as aliases.
 */
public enum ModelType {
    AUTO("auto"),
    MODEL_A("model_a"),
    MODEL_B("model_b"),
    ENSEMBLE("ensemble");

    private final String wireName;

    ModelType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static ModelType fromWire(String value) {
        if (value == null || value.isBlank()) {
            return AUTO;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "auto" -> AUTO;
            case "model_a", "xgboost", "short" -> MODEL_A;
            case "model_b", "lstm", "long" -> MODEL_B;
            case "ensemble" -> ENSEMBLE;
            default -> throw new ValidationInputException("Invalid model type: " + value);
        };
    }
}
