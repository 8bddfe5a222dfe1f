package com.mugpunters.backend.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Qualitative bucket for a report's price performance since the analysis.
 */
public enum PerformanceCategory {
    EXCELLENT("excellent"),  // > 10%
    GOOD("good"),            // 5% to 10%
    NEUTRAL("neutral"),      // between -5% and 5%
    POOR("poor"),            // -10% to -5%
    TERRIBLE("terrible");    // < -10%

    private final String value;

    PerformanceCategory(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
