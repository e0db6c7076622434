package com.riskcast.backend.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ModelUsed {
    SHORT("short"),
    LONG("long"),
    ENSEMBLE("ensemble"),
    SHORT_FALLBACK("short_fallback"),
    LONG_FALLBACK("long_fallback");

    private final String wireName;

    ModelUsed(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static ModelUsed fromWire(String value) {
        for (ModelUsed candidate : values()) {
            if (candidate.wireName.equals(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown model route: " + value);
    }
}
