package com.rental.marketplace.detection;

import com.rental.marketplace.entity.DetectionResult;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * A detection result together with the id of the detection report it produced, if any.
 */
@Getter
@ToString
@AllArgsConstructor
public class DetectionOutcome {

    private final DetectionResult result;
    private final Long reportId;

    public boolean isRecorded() {
        return reportId != null;
    }
}
