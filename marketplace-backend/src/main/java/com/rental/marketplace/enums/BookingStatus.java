package com.rental.marketplace.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum BookingStatus {

    PENDING("pending"),
    PENDING_REVIEW("pending_review"),
    CONFIRMED("confirmed"),
    CANCELLED("cancelled"),
    COMPLETED("completed"),
    IN_PROGRESS("in_progress");

    private final String value;

    BookingStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
