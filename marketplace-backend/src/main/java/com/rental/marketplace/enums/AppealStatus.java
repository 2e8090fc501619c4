package com.rental.marketplace.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Status of the single appeal a report may carry: pending until an admin approves or denies it.
 */
public enum AppealStatus {

    PENDING("pending"),
    APPROVED("approved"),
    DENIED("denied");

    private final String value;

    AppealStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean canTransitionTo(AppealStatus target) {
        return this == PENDING && (target == APPROVED || target == DENIED);
    }

    /**
     * Maps the review request vocabulary ({@code approved} / {@code rejected}) onto the stored status.
     */
    public static AppealStatus fromDecision(String decision) {
        if ("approved".equalsIgnoreCase(decision)) {
            return APPROVED;
        }
        if ("rejected".equalsIgnoreCase(decision) || "denied".equalsIgnoreCase(decision)) {
            return DENIED;
        }
        throw new IllegalArgumentException("Unknown appeal decision: " + decision);
    }
}
