package com.rental.marketplace.entity;

import com.rental.marketplace.enums.AppealStatus;
import com.rental.marketplace.exception.ConflictException;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.http.HttpStatus;

import java.time.LocalDateTime;

/**
 * The one appeal a reported user may lodge against a report.
 */
@Embeddable
@Getter
@NoArgsConstructor
public class ReportAppeal {

    /**
     * appeal_submitted: true once the reported user has appealed
     * Maps to BOOLEAN NOT NULL.
     */
    @Column(name = "appeal_submitted", nullable = false)
    private boolean submitted;

    /**
     * appeal_submitted_at: when the appeal came in
     * Maps to DATETIME.
     */
    @Column(name = "appeal_submitted_at")
    private LocalDateTime submittedAt;

    /**
     * appeal_reason: the reported user's explanation
     * Maps to VARCHAR(1000).
     */
    @Column(name = "appeal_reason", length = 1000)
    private String reason;

    /**
     * appeal_status: null until submitted, then pending, approved or denied
     * Maps to VARCHAR(10).
     */
    @Enumerated(EnumType.STRING)
    @Column(name = "appeal_status", length = 10)
    private AppealStatus status;

    /**
     * appeal_reviewed_by: admin who decided the appeal
     * Maps to BIGINT.
     */
    @Column(name = "appeal_reviewed_by")
    private Long reviewedBy;

    /**
     * appeal_reviewed_at: time of the decision
     * Maps to DATETIME.
     */
    @Column(name = "appeal_reviewed_at")
    private LocalDateTime reviewedAt;

    /**
     * appeal_review_notes: notes sent back to the user
     * Maps to VARCHAR(1000).
     */
    @Column(name = "appeal_review_notes", length = 1000)
    private String reviewNotes;

    void submit(String reason, LocalDateTime now) {
        if (submitted) {
            throw new ConflictException("Appeal already submitted");
        }
        this.submitted = true;
        this.submittedAt = now;
        this.reason = reason;
        this.status = AppealStatus.PENDING;
    }

    void review(Long reviewerId, AppealStatus decision, String notes, LocalDateTime now) {
        if (!submitted) {
            throw new ConflictException("No appeal has been submitted for this report");
        }
        if (!status.canTransitionTo(decision)) {
            throw new ConflictException("Appeal has already been " + status.getValue(), HttpStatus.CONFLICT);
        }
        this.status = decision;
        this.reviewedBy = reviewerId;
        this.reviewedAt = now;
        this.reviewNotes = notes;
    }
}
