package com.rental.marketplace.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.rental.marketplace.entity.SpamReport;
import com.rental.marketplace.entity.UserReportDetails;
import com.rental.marketplace.enums.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * API view of a report, including the derived urgent/stale flags.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SpamReportDTO implements Serializable {

    private Long reportId;
    private ContentType contentType;
    private Long contentId;
    private Long reporterId;
    private Long reportedUserId;
    private ReportType reportType;
    private ReportCategory category;
    private Severity severity;
    private Integer priority;
    private ReportStatus status;
    private DetectionResultDTO detectionResult;

    // user report details
    private String reason;
    private String description;
    private List<String> evidence;

    private ActionTaken actionTaken;
    private Long reviewedBy;
    private LocalDateTime reviewedAt;
    private String reviewNotes;
    private AppealDTO appeal;
    private List<Long> relatedReports;
    private LocalDateTime reportedAt;
    private LocalDateTime resolvedAt;

    private boolean urgent;
    private boolean stale;

    public static SpamReportDTO from(SpamReport report, LocalDateTime now) {
        SpamReportDTO dto = new SpamReportDTO();
        dto.setReportId(report.getReportId());
        dto.setContentType(report.getContentType());
        dto.setContentId(report.getContentId());
        dto.setReporterId(report.getReporterId());
        dto.setReportedUserId(report.getReportedUserId());
        dto.setReportType(report.getReportType());
        dto.setCategory(report.getCategory());
        dto.setSeverity(report.getSeverity());
        dto.setPriority(report.getPriority());
        dto.setStatus(report.getStatus());
        dto.setDetectionResult(DetectionResultDTO.from(report.getDetectionResult()));

        UserReportDetails details = report.getUserReportDetails();
        if (details != null) {
            dto.setReason(details.getReason());
            dto.setDescription(details.getDescription());
            dto.setEvidence(new ArrayList<>(details.getEvidence()));
        }

        dto.setActionTaken(report.getActionTaken());
        dto.setReviewedBy(report.getReviewedBy());
        dto.setReviewedAt(report.getReviewedAt());
        dto.setReviewNotes(report.getReviewNotes());
        dto.setAppeal(AppealDTO.from(report.getAppeal()));
        dto.setRelatedReports(new ArrayList<>(report.getRelatedReports()));
        dto.setReportedAt(report.getReportedAt());
        dto.setResolvedAt(report.getResolvedAt());
        dto.setUrgent(report.isUrgent());
        dto.setStale(report.isStale(now));
        return dto;
    }
}
