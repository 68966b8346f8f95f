package com.example.gdprpdp.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Effect {
    PERMIT("Permit"),
    DENY("Deny");

    private final String label;

    Effect(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static Effect fromString(String v) {
        for (Effect e : values()) {
            if (e.label.equalsIgnoreCase(v) || e.name().equalsIgnoreCase(v)) {
                return e;
            }
        }
        throw new IllegalArgumentException("Unknown Effect: " + v);
    }
}
