package com.rental.marketplace.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Enforcement action recorded on a report.
 */
public enum ActionTaken {

    NONE("none"),
    WARNING("warning"),
    CONTENT_REMOVED("content_removed"),
    USER_SUSPENDED("user_suspended"),
    USER_BANNED("user_banned"),
    SHADOWBAN("shadowban");

    private final String value;

    ActionTaken(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ActionTaken fromValue(String value) {
        for (ActionTaken action : values()) {
            if (action.value.equalsIgnoreCase(value)) {
                return action;
            }
        }
        throw new IllegalArgumentException("Unknown action: " + value);
    }
}
