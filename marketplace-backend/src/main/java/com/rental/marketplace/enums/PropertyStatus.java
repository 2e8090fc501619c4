package com.rental.marketplace.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PropertyStatus {

    ACTIVE("active"),
    PENDING_REVIEW("pending_review"),
    REMOVED("removed");

    private final String value;

    PropertyStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
