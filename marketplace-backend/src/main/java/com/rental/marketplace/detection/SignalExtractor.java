package com.rental.marketplace.detection;

import com.rental.marketplace.enums.SignalCategory;

/**
 * One family of spam evidence. Implementations only read; each returns a score in [0,1].
 * The detection service picks up every extractor bean and runs them side by side.
 */
public interface SignalExtractor {

    SignalCategory category();

    double score(DetectionSubject subject);

    static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
