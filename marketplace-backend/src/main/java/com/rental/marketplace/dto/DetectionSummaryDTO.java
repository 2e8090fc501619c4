package com.rental.marketplace.dto;

import com.rental.marketplace.entity.DetectionResult;
import com.rental.marketplace.entity.SignalScores;
import com.rental.marketplace.enums.RiskLevel;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Human-readable digest of a detection result, shown next to the raw result on manual checks.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DetectionSummaryDTO implements Serializable {

    private String summary;
    private RiskLevel riskLevel;
    private List<String> topReasons;
    // sub-scores as whole percentages: keywords, patterns, user, frequency
    private Map<String, Integer> scoreBreakdown;

    public static DetectionSummaryDTO from(DetectionResult result) {
        String verdict = result.isSpam() ? "SPAM DETECTED" : "CLEAN";
        List<String> reasons = result.getReasons();

        SignalScores scores = result.getScores();
        Map<String, Integer> breakdown = new LinkedHashMap<>();
        breakdown.put("keywords", percent(scores.getKeywordScore()));
        breakdown.put("patterns", percent(scores.getPatternScore()));
        breakdown.put("user", percent(scores.getUserScore()));
        breakdown.put("frequency", percent(scores.getFrequencyScore()));

        return new DetectionSummaryDTO(
                verdict + " - " + result.getConfidence() + "% confidence",
                result.getRiskLevel(),
                reasons.subList(0, Math.min(3, reasons.size())),
                breakdown);
    }

    private static int percent(Double score) {
        return score == null ? 0 : (int) Math.round(score * 100);
    }
}
