package com.riskcast.backend.service.router;

public enum ModelSlot {
    SHORT("short"),
    LONG("long");

    private final String label;

    ModelSlot(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public ModelSlot other() {
        return this == SHORT ? LONG : SHORT;
    }
}
