package com.rental.marketplace.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Automatic moderation decision recommended for a detection score.
 */
public enum SpamAction {

    AUTO_REJECT("auto_reject"),
    ACCOUNT_SUSPEND("account_suspend"),
    SHADOWBAN("shadowban"),
    MANUAL_REVIEW("manual_review"),
    AUTO_APPROVE("auto_approve");

    private final String value;

    SpamAction(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /** Whether the content must not be persisted. */
    public boolean refusesContent() {
        return this == AUTO_REJECT || this == ACCOUNT_SUSPEND;
    }

    public boolean filesReport() {
        return this != AUTO_APPROVE;
    }
}
