package com.rental.marketplace.entity;

import com.rental.marketplace.enums.SignalCategory;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.Map;

/**
 * The four sub-scores of one detection run, each in [0,1].
 */
@Embeddable
@Getter
@EqualsAndHashCode
@ToString
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class SignalScores {

    @Column(name = "keyword_score")
    private Double keywordScore;

    @Column(name = "pattern_score")
    private Double patternScore;

    @Column(name = "user_score")
    private Double userScore;

    @Column(name = "frequency_score")
    private Double frequencyScore;

    private SignalScores(double keywordScore, double patternScore, double userScore, double frequencyScore) {
        this.keywordScore = keywordScore;
        this.patternScore = patternScore;
        this.userScore = userScore;
        this.frequencyScore = frequencyScore;
    }

    public static SignalScores of(double keyword, double pattern, double user, double frequency) {
        return new SignalScores(keyword, pattern, user, frequency);
    }

    public static SignalScores zero() {
        return new SignalScores(0, 0, 0, 0);
    }

    /**
     * Missing categories count as 0.
     */
    public static SignalScores from(Map<SignalCategory, Double> scores) {
        return new SignalScores(
                scores.getOrDefault(SignalCategory.KEYWORD, 0.0),
                scores.getOrDefault(SignalCategory.PATTERN, 0.0),
                scores.getOrDefault(SignalCategory.USER, 0.0),
                scores.getOrDefault(SignalCategory.FREQUENCY, 0.0));
    }

    public double get(SignalCategory category) {
        Double value;
        switch (category) {
            case KEYWORD:
                value = keywordScore;
                break;
            case PATTERN:
                value = patternScore;
                break;
            case USER:
                value = userScore;
                break;
            default:
                value = frequencyScore;
        }
        return value == null ? 0.0 : value;
    }
}
