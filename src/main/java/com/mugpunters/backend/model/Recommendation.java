package com.mugpunters.backend.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.mugpunters.backend.exception.InvalidInputException;

public enum Recommendation {
    STRONG_BUY("strong_buy"),
    BUY("buy"),
    HOLD("hold"),
    SELL("sell"),
    STRONG_SELL("strong_sell");

    private final String value;

    Recommendation(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isBuyClass() {
        return this == STRONG_BUY || this == BUY;
    }

    public boolean isSellClass() {
        return this == SELL || this == STRONG_SELL;
    }

    @JsonCreator
    public static Recommendation fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (Recommendation recommendation : values()) {
            if (recommendation.value.equalsIgnoreCase(value.trim())
                    || recommendation.name().equalsIgnoreCase(value.trim())) {
                return recommendation;
            }
        }
        throw new InvalidInputException("Unknown recommendation: " + value);
    }
}
