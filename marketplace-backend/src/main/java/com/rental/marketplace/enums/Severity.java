package com.rental.marketplace.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Report severity; each level carries the base priority it contributes.
 */
public enum Severity {

    LOW("low", 3),
    MEDIUM("medium", 5),
    HIGH("high", 7),
    CRITICAL("critical", 9);

    private final String value;
    private final int basePriority;

    Severity(String value, int basePriority) {
        this.value = value;
        this.basePriority = basePriority;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public int getBasePriority() {
        return basePriority;
    }

    /**
     * Severity of an automated report: high from 0.8, medium from 0.6, low below.
     */
    public static Severity fromScore(double overallScore) {
        if (overallScore >= 0.8) {
            return HIGH;
        }
        if (overallScore >= 0.6) {
            return MEDIUM;
        }
        return LOW;
    }

    @JsonCreator
    public static Severity fromValue(String value) {
        for (Severity severity : values()) {
            if (severity.value.equalsIgnoreCase(value)) {
                return severity;
            }
        }
        throw new IllegalArgumentException("Unknown severity: " + value);
    }
}
