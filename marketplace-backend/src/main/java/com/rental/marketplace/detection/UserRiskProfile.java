package com.rental.marketplace.detection;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

/**
 * Derived view of a user's trustworthiness; computed per detection run, never stored.
 */
@Getter
@ToString
@AllArgsConstructor
public class UserRiskProfile {

    private final Duration accountAge;
    private final int missingProfileFields;
    private final int trackedProfileFields;
    private final long confirmedReports;

    public double missingShare() {
        return trackedProfileFields == 0 ? 0.0 : (double) missingProfileFields / trackedProfileFields;
    }
}
