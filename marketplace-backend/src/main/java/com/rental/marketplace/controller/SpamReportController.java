package com.rental.marketplace.controller;

import com.rental.marketplace.dto.*;
import com.rental.marketplace.filter.AuthenticatedActor;
import com.rental.marketplace.service.SpamReportService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Report lifecycle endpoints. The caller is resolved by the actor filter.
 */
@RestController
@RequestMapping("/api/spam")
public class SpamReportController {

    private final SpamReportService spamReportService;

    public SpamReportController(SpamReportService spamReportService) {
        this.spamReportService = spamReportService;
    }

    /**
     * POST /api/spam/report: any user reports a listing, booking or user.
     */
    @PostMapping("/report")
    public ResponseEntity<CommonResponse<SpamReportDTO>> submitReport(
            @RequestAttribute(AuthenticatedActor.REQUEST_ATTRIBUTE) AuthenticatedActor actor,
            @Valid @RequestBody SubmitReportRequest request) {
        SpamReportDTO report = spamReportService.submitReport(actor, request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(CommonResponse.created("Spam report submitted successfully", report));
    }

    /**
     * GET /api/spam/reports?page=1&limit=10&status=pending&minConfidence=70&sortBy=priority&sortOrder=desc
     */
    @GetMapping("/reports")
    public ResponseEntity<CommonResponse<PageDTO<SpamReportDTO>>> listReports(
            @RequestAttribute(AuthenticatedActor.REQUEST_ATTRIBUTE) AuthenticatedActor actor,
            @Valid @ModelAttribute ReportQuery query) {
        actor.requireAdmin();
        return ResponseEntity.ok(CommonResponse.success(spamReportService.listReports(query)));
    }

    @GetMapping("/reports/urgent")
    public ResponseEntity<CommonResponse<List<SpamReportDTO>>> getUrgentReports(
            @RequestAttribute(AuthenticatedActor.REQUEST_ATTRIBUTE) AuthenticatedActor actor) {
        actor.requireAdmin();
        return ResponseEntity.ok(CommonResponse.success(spamReportService.getUrgentReports()));
    }

    @GetMapping("/reports/user/{userId}")
    public ResponseEntity<CommonResponse<List<SpamReportDTO>>> getUserReports(
            @RequestAttribute(AuthenticatedActor.REQUEST_ATTRIBUTE) AuthenticatedActor actor,
            @PathVariable Long userId) {
        return ResponseEntity.ok(CommonResponse.success(spamReportService.getUserReports(actor, userId)));
    }

    @PutMapping("/reports/bulk-review")
    public ResponseEntity<CommonResponse<BulkReviewResultDTO>> bulkReview(
            @RequestAttribute(AuthenticatedActor.REQUEST_ATTRIBUTE) AuthenticatedActor actor,
            @Valid @RequestBody BulkReviewRequest request) {
        actor.requireAdmin();
        BulkReviewResultDTO result = spamReportService.bulkReview(actor.getUserId(), request);
        return ResponseEntity.ok(CommonResponse.success("Bulk review completed", result));
    }

    @PutMapping("/reports/{reportId}/review")
    public ResponseEntity<CommonResponse<SpamReportDTO>> reviewReport(
            @RequestAttribute(AuthenticatedActor.REQUEST_ATTRIBUTE) AuthenticatedActor actor,
            @PathVariable Long reportId,
            @Valid @RequestBody ReviewReportRequest request) {
        actor.requireAdmin();
        SpamReportDTO report = spamReportService.reviewReport(actor.getUserId(), reportId, request);
        return ResponseEntity.ok(CommonResponse.success("Spam report reviewed successfully", report));
    }

    @PutMapping("/reports/{reportId}/claim")
    public ResponseEntity<CommonResponse<SpamReportDTO>> claimReport(
            @RequestAttribute(AuthenticatedActor.REQUEST_ATTRIBUTE) AuthenticatedActor actor,
            @PathVariable Long reportId,
            @Valid @RequestBody(required = false) ReportNotesRequest request) {
        actor.requireAdmin();
        String notes = request == null ? null : request.getNotes();
        return ResponseEntity.ok(CommonResponse.success("Report moved to review",
                spamReportService.claimReport(actor.getUserId(), reportId, notes)));
    }

    @PutMapping("/reports/{reportId}/resolve")
    public ResponseEntity<CommonResponse<SpamReportDTO>> resolveReport(
            @RequestAttribute(AuthenticatedActor.REQUEST_ATTRIBUTE) AuthenticatedActor actor,
            @PathVariable Long reportId,
            @Valid @RequestBody(required = false) ReportNotesRequest request) {
        actor.requireAdmin();
        String notes = request == null ? null : request.getNotes();
        return ResponseEntity.ok(CommonResponse.success("Report resolved",
                spamReportService.resolveReport(actor.getUserId(), reportId, notes)));
    }

    @PostMapping("/reports/{reportId}/appeal")
    public ResponseEntity<CommonResponse<SpamReportDTO>> submitAppeal(
            @RequestAttribute(AuthenticatedActor.REQUEST_ATTRIBUTE) AuthenticatedActor actor,
            @PathVariable Long reportId,
            @Valid @RequestBody AppealRequest request) {
        SpamReportDTO report = spamReportService.submitAppeal(actor, reportId, request);
        return ResponseEntity.ok(CommonResponse.success("Appeal submitted successfully", report));
    }

    @PutMapping("/reports/{reportId}/appeal/review")
    public ResponseEntity<CommonResponse<SpamReportDTO>> reviewAppeal(
            @RequestAttribute(AuthenticatedActor.REQUEST_ATTRIBUTE) AuthenticatedActor actor,
            @PathVariable Long reportId,
            @Valid @RequestBody AppealReviewRequest request) {
        actor.requireAdmin();
        SpamReportDTO report = spamReportService.reviewAppeal(actor.getUserId(), reportId, request);
        return ResponseEntity.ok(CommonResponse.success("Appeal reviewed successfully", report));
    }
}
