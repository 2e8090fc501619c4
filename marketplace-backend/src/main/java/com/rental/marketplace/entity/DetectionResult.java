package com.rental.marketplace.entity;

import com.rental.marketplace.enums.RiskLevel;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one detection run. Immutable once built; a new run produces a new value.
 */
@Embeddable
@Getter
@EqualsAndHashCode
@ToString
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class DetectionResult {

    @Column(name = "is_spam")
    private Boolean spam;

    // 0-100
    @Column(name = "confidence")
    private Integer confidence;

    @Column(name = "overall_score")
    private Double overallScore;

    @Enumerated(EnumType.STRING)
    @Column(name = "risk_level", length = 10)
    private RiskLevel riskLevel;

    @Embedded
    private SignalScores scores;

    @Convert(converter = StringListConverter.class)
    @Column(name = "detection_reasons", length = 1000)
    private List<String> reasons;

    public DetectionResult(boolean spam, int confidence, double overallScore, RiskLevel riskLevel,
                           SignalScores scores, List<String> reasons) {
        this.spam = spam;
        this.confidence = confidence;
        this.overallScore = overallScore;
        this.riskLevel = riskLevel;
        this.scores = scores;
        this.reasons = new ArrayList<>(reasons);
    }

    /**
     * Result used whenever detection could not run at all.
     */
    public static DetectionResult clean() {
        return new DetectionResult(false, 0, 0.0, RiskLevel.MINIMAL, SignalScores.zero(), List.of());
    }

    public boolean isSpam() {
        return Boolean.TRUE.equals(spam);
    }

    public int getConfidence() {
        return confidence == null ? 0 : confidence;
    }

    public double getOverallScore() {
        return overallScore == null ? 0.0 : overallScore;
    }

    public SignalScores getScores() {
        return scores == null ? SignalScores.zero() : scores;
    }

    public List<String> getReasons() {
        return reasons == null ? List.of() : List.copyOf(reasons);
    }
}
