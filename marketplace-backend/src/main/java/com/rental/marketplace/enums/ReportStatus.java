package com.rental.marketplace.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Set;

/**
 * Base status of a spam report.
 *
 * <pre>
 * pending ──► under_review ──► confirmed | false_positive | dismissed
 *    └──────────────────────► confirmed | false_positive | dismissed
 * confirmed ──► resolved
 * </pre>
 *
 * resolved, dismissed and false_positive are terminal. An approved appeal is the only way
 * back out of one, and it does not go through {@link #canTransitionTo(ReportStatus)}.
 */
public enum ReportStatus {

    PENDING("pending"),
    UNDER_REVIEW("under_review"),
    CONFIRMED("confirmed"),
    FALSE_POSITIVE("false_positive"),
    RESOLVED("resolved"),
    DISMISSED("dismissed");

    /** Statuses counted as "open" by the duplicate guard and the per-user listing. */
    public static final Set<ReportStatus> OPEN = EnumSet.of(PENDING, UNDER_REVIEW);

    /** Statuses a reviewer may choose. */
    public static final Set<ReportStatus> REVIEW_OUTCOMES = EnumSet.of(CONFIRMED, FALSE_POSITIVE, DISMISSED);

    /** Statuses from which the reported user may appeal. */
    public static final Set<ReportStatus> APPEALABLE = EnumSet.of(CONFIRMED, RESOLVED);

    private final String value;

    ReportStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Entering one of these stamps resolvedAt.
     */
    public boolean isTerminal() {
        return this == RESOLVED || this == DISMISSED || this == FALSE_POSITIVE;
    }

    public boolean canTransitionTo(ReportStatus target) {
        switch (this) {
            case PENDING:
                return target == UNDER_REVIEW || REVIEW_OUTCOMES.contains(target);
            case UNDER_REVIEW:
                return REVIEW_OUTCOMES.contains(target);
            case CONFIRMED:
                return target == RESOLVED;
            default:
                return false;
        }
    }

    @JsonCreator
    public static ReportStatus fromValue(String value) {
        for (ReportStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown report status: " + value);
    }
}
