package com.rental.marketplace.entity;

import com.rental.marketplace.enums.*;
import com.rental.marketplace.exception.ConflictException;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * SpamReport Entity: one report against a piece of content or a user, filed by the detector,
 * a user or an admin. Reports are never deleted; they only move through {@link ReportStatus}.
 */
@Data
@NoArgsConstructor
@Entity
@Table(name = "spam_report", indexes = {
        @Index(name = "idx_report_content", columnList = "content_type, content_id"),
        @Index(name = "idx_report_reported_user", columnList = "reported_user_id, status"),
        @Index(name = "idx_report_status_priority", columnList = "status, priority")
})
public class SpamReport {

    public static final Duration STALE_AFTER = Duration.ofDays(7);

    /**
     * report_id: report identifier (Primary Key)
     * Maps to BIGINT, auto-increment.
     */
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "report_id")
    private Long reportId;

    /**
     * content_type: kind of the reported item
     * Maps to VARCHAR(20) NOT NULL.
     */
    @Enumerated(EnumType.STRING)
    @Column(name = "content_type", nullable = false, length = 20)
    private ContentType contentType;

    /**
     * content_id: reported item; null only for automated reports on content refused before it was saved
     * Maps to BIGINT.
     */
    @Column(name = "content_id")
    private Long contentId;

    /**
     * reporter_id: user or admin who filed the report; null means the system filed it
     * Maps to BIGINT.
     */
    @Column(name = "reporter_id")
    private Long reporterId;

    /**
     * reported_user_id: author of the reported content, or the reported user
     * Maps to BIGINT NOT NULL.
     */
    @Column(name = "reported_user_id", nullable = false)
    private Long reportedUserId;

    /**
     * report_type: automated, user_reported or admin_flagged
     * Maps to VARCHAR(20) NOT NULL.
     */
    @Enumerated(EnumType.STRING)
    @Column(name = "report_type", nullable = false, length = 20)
    private ReportType reportType;

    /**
     * category: what the report alleges, see {@link ReportCategory}
     * Maps to VARCHAR(20) NOT NULL.
     */
    @Enumerated(EnumType.STRING)
    @Column(name = "category", nullable = false, length = 20)
    private ReportCategory category;

    /**
     * severity: drives the base priority
     * Maps to VARCHAR(10) NOT NULL.
     */
    @Enumerated(EnumType.STRING)
    @Column(name = "severity", nullable = false, length = 10)
    private Severity severity = Severity.MEDIUM;

    /**
     * priority: 1-10, always derived from severity, type and detection confidence
     * Maps to INT NOT NULL.
     */
    @Setter(AccessLevel.NONE)
    @Column(name = "priority", nullable = false)
    private Integer priority = Severity.MEDIUM.getBasePriority();

    /**
     * status: position in the review workflow, changed only through {@link #transitionTo}
     * Maps to VARCHAR(20) NOT NULL.
     */
    @Setter(AccessLevel.NONE)
    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private ReportStatus status = ReportStatus.PENDING;

    @Embedded
    private DetectionResult detectionResult;

    @Embedded
    private UserReportDetails userReportDetails;

    /**
     * action_taken: enforcement that actually succeeded for this report
     * Maps to VARCHAR(20) NOT NULL.
     */
    @Enumerated(EnumType.STRING)
    @Column(name = "action_taken", nullable = false, length = 20)
    private ActionTaken actionTaken = ActionTaken.NONE;

    /**
     * reviewed_by: admin who last reviewed the report
     * Maps to BIGINT.
     */
    @Column(name = "reviewed_by")
    private Long reviewedBy;

    /**
     * reviewed_at: time of the last review
     * Maps to DATETIME.
     */
    @Column(name = "reviewed_at")
    private LocalDateTime reviewedAt;

    /**
     * review_notes: free-text notes from the reviewer
     * Maps to VARCHAR(1000).
     */
    @Column(name = "review_notes", length = 1000)
    private String reviewNotes;

    @Setter(AccessLevel.NONE)
    @Embedded
    private ReportAppeal appeal = new ReportAppeal();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "spam_report_related", joinColumns = @JoinColumn(name = "report_id"))
    @Column(name = "related_report_id")
    private List<Long> relatedReports = new ArrayList<>();

    /**
     * reported_at: filing time; stale and statistics windows key off it
     * Maps to DATETIME NOT NULL.
     */
    @Column(name = "reported_at", nullable = false)
    private LocalDateTime reportedAt;

    /**
     * resolved_at: first time the report reached a resolving status
     * Maps to DATETIME.
     */
    @Setter(AccessLevel.NONE)
    @Column(name = "resolved_at")
    private LocalDateTime resolvedAt;

    public void setSeverity(Severity severity) {
        this.severity = severity;
        recomputePriority();
    }

    public void setReportType(ReportType reportType) {
        this.reportType = reportType;
        recomputePriority();
    }

    public void setDetectionResult(DetectionResult detectionResult) {
        this.detectionResult = detectionResult;
        recomputePriority();
    }

    public ReportAppeal getAppeal() {
        if (appeal == null) {
            appeal = new ReportAppeal();
        }
        return appeal;
    }

    @PrePersist
    @PreUpdate
    void recomputePriority() {
        this.priority = derivePriority(severity, reportType, detectionResult);
    }

    /**
     * Base priority of the severity, nudged by the detector's confidence for automated reports,
     * clamped to [1,10].
     */
    public static int derivePriority(Severity severity, ReportType reportType, DetectionResult detectionResult) {
        int value = (severity == null ? Severity.MEDIUM : severity).getBasePriority();
        if (reportType == ReportType.AUTOMATED && detectionResult != null) {
            double confidence = detectionResult.getConfidence() / 100.0;
            if (confidence > 0.9) {
                value += 2;
            } else if (confidence > 0.7) {
                value += 1;
            } else if (confidence < 0.5) {
                value -= 1;
            }
        }
        return Math.max(1, Math.min(10, value));
    }

    /**
     * Moves the report along the status machine. The first entry into a terminal status
     * stamps resolvedAt; later ones leave it alone.
     */
    public void transitionTo(ReportStatus target, LocalDateTime now) {
        if (!status.canTransitionTo(target)) {
            throw ConflictException.illegalTransition(status.getValue(), target.getValue());
        }
        this.status = target;
        if (target.isTerminal() && resolvedAt == null) {
            this.resolvedAt = now;
        }
    }

    public void markReviewed(Long reviewerId, String notes, LocalDateTime now) {
        this.reviewedBy = reviewerId;
        this.reviewedAt = now;
        if (notes != null) {
            this.reviewNotes = notes;
        }
    }

    public void submitAppeal(String reason, LocalDateTime now) {
        if (!ReportStatus.APPEALABLE.contains(status)) {
            throw new ConflictException("Only confirmed or resolved reports can be appealed");
        }
        getAppeal().submit(reason, now);
    }

    /**
     * An approved appeal reverses the outcome: the report becomes a false positive and
     * resolvedAt is re-stamped.
     */
    public void reviewAppeal(Long reviewerId, AppealStatus decision, String notes, LocalDateTime now) {
        getAppeal().review(reviewerId, decision, notes, now);
        if (decision == AppealStatus.APPROVED) {
            this.status = ReportStatus.FALSE_POSITIVE;
            this.resolvedAt = now;
        }
    }

    public void addRelatedReport(Long otherReportId) {
        if (otherReportId != null && !otherReportId.equals(reportId) && !relatedReports.contains(otherReportId)) {
            relatedReports.add(otherReportId);
        }
    }

    public boolean isUrgent() {
        boolean highPriority = (priority != null && priority >= 8) || severity == Severity.CRITICAL;
        return highPriority && status == ReportStatus.PENDING;
    }

    public boolean isStale(LocalDateTime now) {
        return status == ReportStatus.PENDING && reportedAt != null
                && reportedAt.plus(STALE_AFTER).isBefore(now);
    }
}
