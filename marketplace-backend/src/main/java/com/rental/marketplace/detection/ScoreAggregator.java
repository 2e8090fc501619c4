package com.rental.marketplace.detection;

import com.rental.marketplace.config.SpamDetectionProperties;
import com.rental.marketplace.entity.DetectionResult;
import com.rental.marketplace.entity.SignalScores;
import com.rental.marketplace.enums.RiskLevel;
import com.rental.marketplace.enums.SignalCategory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Folds the four sub-scores into one weighted overall score, its confidence, risk tier and reasons.
 */
@Component
public class ScoreAggregator {

    private static final double WEIGHT_TOLERANCE = 1e-9;
    private static final double REASON_THRESHOLD = 0.3;

    private final SpamDetectionProperties.Weights weights;
    private final double spamThreshold;

    public ScoreAggregator(SpamDetectionProperties properties) {
        this.weights = properties.getWeights();
        this.spamThreshold = properties.getSpamThreshold();
        if (Math.abs(weights.sum() - 1.0) > WEIGHT_TOLERANCE) {
            throw new IllegalStateException("spam.detection.weights must sum to 1.0 but sum to " + weights.sum());
        }
    }

    public DetectionResult aggregate(Map<SignalCategory, Double> subScores) {
        SignalScores scores = SignalScores.from(subScores);

        double overall = 0.0;
        List<String> reasons = new ArrayList<>();
        for (SignalCategory category : SignalCategory.values()) {
            double value = scores.get(category);
            overall += weights.of(category) * value;
            if (value > REASON_THRESHOLD) {
                reasons.add(category.getReason());
            }
        }
        overall = SignalExtractor.clamp(overall);

        int confidence = (int) Math.round(overall * 100);
        return new DetectionResult(overall >= spamThreshold, confidence, overall, riskLevel(overall), scores, reasons);
    }

    public static RiskLevel riskLevel(double overall) {
        if (overall >= 0.8) return RiskLevel.HIGH;
        if (overall >= 0.6) return RiskLevel.MEDIUM;
        if (overall >= 0.3) return RiskLevel.LOW;
        return RiskLevel.MINIMAL;
    }
}
