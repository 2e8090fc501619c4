package com.rental.marketplace.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum UserStatus {

    ACTIVE("active"),
    SUSPENDED("suspended"),
    BANNED("banned");

    private final String value;

    UserStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
