package com.rental.marketplace.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.rental.marketplace.entity.DetectionResult;
import com.rental.marketplace.enums.RiskLevel;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DetectionResultDTO implements Serializable {

    @JsonProperty("isSpam")
    private boolean spam;

    private Integer confidence;

    private Double overallScore;

    private RiskLevel riskLevel;

    private SignalScoresDTO scores;

    private List<String> reasons;

    public static DetectionResultDTO from(DetectionResult result) {
        if (result == null) {
            return null;
        }
        return new DetectionResultDTO(result.isSpam(), result.getConfidence(), result.getOverallScore(),
                result.getRiskLevel(), SignalScoresDTO.from(result.getScores()), result.getReasons());
    }
}
