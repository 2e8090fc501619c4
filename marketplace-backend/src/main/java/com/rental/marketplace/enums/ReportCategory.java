package com.rental.marketplace.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Category picked by the reporter. The default severity is what a user report starts with.
 */
public enum ReportCategory {

    SPAM("spam", Severity.MEDIUM),
    INAPPROPRIATE("inappropriate", Severity.HIGH),
    FAKE_LISTING("fake_listing", Severity.HIGH),
    DUPLICATE("duplicate", Severity.LOW),
    MISLEADING("misleading", Severity.MEDIUM),
    OTHER("other", Severity.LOW);

    private final String value;
    private final Severity defaultSeverity;

    ReportCategory(String value, Severity defaultSeverity) {
        this.value = value;
        this.defaultSeverity = defaultSeverity;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public Severity getDefaultSeverity() {
        return defaultSeverity;
    }

    @JsonCreator
    public static ReportCategory fromValue(String value) {
        for (ReportCategory category : values()) {
            if (category.value.equalsIgnoreCase(value)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown report category: " + value);
    }
}
