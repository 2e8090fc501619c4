package com.rental.marketplace.service;

import com.rental.marketplace.dto.*;
import com.rental.marketplace.filter.AuthenticatedActor;

import java.util.List;

public interface SpamReportService {

    SpamReportDTO submitReport(AuthenticatedActor reporter, SubmitReportRequest request);

    PageDTO<SpamReportDTO> listReports(ReportQuery query);

    List<SpamReportDTO> getUrgentReports();

    /**
     * Open (pending or under review) reports against the user. Admins may look at anyone,
     * users only at themselves.
     */
    List<SpamReportDTO> getUserReports(AuthenticatedActor actor, Long userId);

    SpamReportDTO reviewReport(Long reviewerId, Long reportId, ReviewReportRequest request);

    BulkReviewResultDTO bulkReview(Long reviewerId, BulkReviewRequest request);

    SpamReportDTO claimReport(Long reviewerId, Long reportId, String notes);

    SpamReportDTO resolveReport(Long reviewerId, Long reportId, String notes);

    SpamReportDTO submitAppeal(AuthenticatedActor actor, Long reportId, AppealRequest request);

    SpamReportDTO reviewAppeal(Long reviewerId, Long reportId, AppealReviewRequest request);

    long countStaleReports();
}
