package com.rental.marketplace.detection;

import com.rental.marketplace.config.SpamDetectionProperties;
import com.rental.marketplace.entity.DetectionResult;
import com.rental.marketplace.enums.RiskLevel;
import com.rental.marketplace.enums.SignalCategory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ScoreAggregatorTest {

    private ScoreAggregator aggregator;

    @BeforeEach
    void setUp() {
        aggregator = new ScoreAggregator(new SpamDetectionProperties());
    }

    private static Map<SignalCategory, Double> scores(double keyword, double pattern, double user, double frequency) {
        Map<SignalCategory, Double> map = new EnumMap<>(SignalCategory.class);
        map.put(SignalCategory.KEYWORD, keyword);
        map.put(SignalCategory.PATTERN, pattern);
        map.put(SignalCategory.USER, user);
        map.put(SignalCategory.FREQUENCY, frequency);
        return map;
    }

    @Test
    void testDefaultWeightsSumToOne() {
        assertEquals(1.0, new SpamDetectionProperties().getWeights().sum(), 1e-9);
    }

    @Test
    void testWeightsNotSummingToOneAreRejected() {
        SpamDetectionProperties properties = new SpamDetectionProperties();
        properties.getWeights().setKeyword(0.5);

        assertThrows(IllegalStateException.class, () -> new ScoreAggregator(properties));
    }

    @Test
    void testAllSignalsMaxed() {
        DetectionResult result = aggregator.aggregate(scores(1, 1, 1, 1));

        assertEquals(1.0, result.getOverallScore(), 1e-9);
        assertEquals(100, result.getConfidence());
        assertEquals(RiskLevel.HIGH, result.getRiskLevel());
        assertTrue(result.isSpam());
        assertEquals(List.of("Contains suspicious keywords", "Matches spam patterns",
                "Suspicious user behavior", "High posting frequency"), result.getReasons());
    }

    @Test
    void testWeightedCombinationAndReasons() {
        // 0.18 + 0.10 + 0.05 + 0.10
        DetectionResult result = aggregator.aggregate(scores(0.6, 0.4, 0.2, 0.5));

        assertEquals(0.43, result.getOverallScore(), 1e-9);
        assertEquals(43, result.getConfidence());
        assertEquals(RiskLevel.LOW, result.getRiskLevel());
        assertFalse(result.isSpam());
        assertEquals(List.of("Contains suspicious keywords", "Matches spam patterns", "High posting frequency"),
                result.getReasons());
    }

    @Test
    void testSpamThreshold() {
        assertTrue(aggregator.aggregate(scores(1, 1, 1, 0.5)).isSpam());

        DetectionResult medium = aggregator.aggregate(scores(1, 1, 0.4, 0));
        assertFalse(medium.isSpam());
        assertEquals(65, medium.getConfidence());
        assertEquals(RiskLevel.MEDIUM, medium.getRiskLevel());
    }

    @Test
    void testMissingSignalsCountAsZero() {
        DetectionResult result = aggregator.aggregate(Map.of(SignalCategory.KEYWORD, 1.0));

        assertEquals(0.3, result.getOverallScore(), 1e-9);
        assertEquals(0.0, result.getScores().get(SignalCategory.FREQUENCY));
    }

    @Test
    void testRaisingASignalNeverLowersTheScore() {
        double previous = -1;
        for (double value = 0; value <= 1.0; value += 0.1) {
            double overall = aggregator.aggregate(scores(0.2, value, 0.3, 0.1)).getOverallScore();
            assertTrue(overall >= previous);
            assertTrue(overall >= 0 && overall <= 1);
            previous = overall;
        }
    }

    @Test
    void testRiskTiers() {
        assertEquals(RiskLevel.HIGH, ScoreAggregator.riskLevel(0.8));
        assertEquals(RiskLevel.MEDIUM, ScoreAggregator.riskLevel(0.79));
        assertEquals(RiskLevel.MEDIUM, ScoreAggregator.riskLevel(0.6));
        assertEquals(RiskLevel.LOW, ScoreAggregator.riskLevel(0.3));
        assertEquals(RiskLevel.MINIMAL, ScoreAggregator.riskLevel(0.29));
    }
}
