package com.rental.marketplace.enums;

/**
 * The four signal families the detector combines, in the order their reasons are reported.
 */
public enum SignalCategory {

    KEYWORD("Contains suspicious keywords"),
    PATTERN("Matches spam patterns"),
    USER("Suspicious user behavior"),
    FREQUENCY("High posting frequency");

    private final String reason;

    SignalCategory(String reason) {
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
