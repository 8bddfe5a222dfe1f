package com.mugpunters.backend.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.mugpunters.backend.exception.InvalidInputException;

public enum RiskLevel {
    CONSERVATIVE("conservative"),
    MODERATE("moderate"),
    AGGRESSIVE("aggressive");

    private final String value;

    RiskLevel(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static RiskLevel fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (RiskLevel level : values()) {
            if (level.value.equalsIgnoreCase(value.trim()) || level.name().equalsIgnoreCase(value.trim())) {
                return level;
            }
        }
        throw new InvalidInputException("Unknown risk level: " + value);
    }
}
