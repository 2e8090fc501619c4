package com.rental.marketplace.dto;

import com.rental.marketplace.entity.SignalScores;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SignalScoresDTO implements Serializable {
    private Double keywordScore;
    private Double patternScore;
    private Double userScore;
    private Double frequencyScore;

    public static SignalScoresDTO from(SignalScores scores) {
        return new SignalScoresDTO(scores.getKeywordScore(), scores.getPatternScore(),
                scores.getUserScore(), scores.getFrequencyScore());
    }
}
