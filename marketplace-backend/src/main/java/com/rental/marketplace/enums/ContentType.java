package com.rental.marketplace.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of user-submitted content a spam report can point at.
 */
public enum ContentType {

    PROPERTY("property"),
    BOOKING("booking"),
    MESSAGE("message"),
    USER("user"),
    REVIEW("review");

    private final String value;

    ContentType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Types a user may file a report against. Messages and reviews have no backing store here.
     */
    public boolean isReportable() {
        return this == PROPERTY || this == BOOKING || this == USER;
    }

    /**
     * Types whose posting frequency is tracked by the frequency signal.
     */
    public boolean isFrequencyTracked() {
        return this == PROPERTY || this == BOOKING;
    }

    @JsonCreator
    public static ContentType fromValue(String value) {
        for (ContentType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown content type: " + value);
    }
}
