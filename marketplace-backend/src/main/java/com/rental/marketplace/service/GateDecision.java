package com.rental.marketplace.service;

import com.rental.marketplace.entity.DetectionResult;
import com.rental.marketplace.enums.ContentType;
import com.rental.marketplace.enums.SpamAction;
import com.rental.marketplace.exception.ContentRejectedException;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Verdict of the submission gate on a draft, handed back to the gate once the content is saved.
 */
@Getter
@ToString
@AllArgsConstructor
public class GateDecision {

    private final Long authorId;
    private final ContentType contentType;
    private final SpamAction action;
    // null when detection was skipped
    private final DetectionResult detectionResult;
    // report filed for this submission, if any
    private final Long reportId;

    public static GateDecision bypass(Long authorId, ContentType contentType) {
        return new GateDecision(authorId, contentType, SpamAction.AUTO_APPROVE, null, null);
    }

    public boolean isAllowed() {
        return !action.refusesContent();
    }

    /**
     * For consumers that turn a refusal into an error response.
     */
    public void requireAllowed() {
        if (!isAllowed()) {
            int confidence = detectionResult == null ? 0 : detectionResult.getConfidence();
            throw new ContentRejectedException("Content rejected due to spam detection", confidence);
        }
    }
}
