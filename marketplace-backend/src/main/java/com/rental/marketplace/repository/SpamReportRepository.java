package com.rental.marketplace.repository;

import com.rental.marketplace.entity.SpamReport;
import com.rental.marketplace.enums.*;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

@Repository
public interface SpamReportRepository extends JpaRepository<SpamReport, Long> {

    /**
     * Duplicate guard: does this reporter already have an open report on the content?
     */
    boolean existsByContentTypeAndContentIdAndReporterIdAndStatusIn(
            ContentType contentType, Long contentId, Long reporterId, Collection<ReportStatus> statuses);

    List<SpamReport> findByContentTypeAndContentId(ContentType contentType, Long contentId);

    List<SpamReport> findByReportedUserIdAndStatusInOrderByReportedAtDesc(Long reportedUserId,
                                                                          Collection<ReportStatus> statuses);

    // confirmed reports against the user (user risk, repeat offender)
    long countByReportedUserIdAndStatus(Long reportedUserId, ReportStatus status);

    long countByReportedUserIdAndStatusAndReportedAtGreaterThanEqual(Long reportedUserId, ReportStatus status,
                                                                     LocalDateTime since);

    // last five reports against the user, used by the adaptive rate limit
    List<SpamReport> findTop5ByReportedUserIdAndReportedAtGreaterThanEqualOrderByReportedAtDesc(
            Long reportedUserId, LocalDateTime since);

    long countByStatus(ReportStatus status);

    long countByStatusAndReportedAtBefore(ReportStatus status, LocalDateTime before);

    /**
     * Admin listing. Every filter is optional; confidence bounds apply to the embedded detection result,
     * so user reports drop out as soon as either bound is given.
     */
    @Query("SELECT r FROM SpamReport r WHERE " +
           "(:status IS NULL OR r.status = :status) AND " +
           "(:severity IS NULL OR r.severity = :severity) AND " +
           "(:contentType IS NULL OR r.contentType = :contentType) AND " +
           "(:reportType IS NULL OR r.reportType = :reportType) AND " +
           "(:minConfidence IS NULL OR r.detectionResult.confidence >= :minConfidence) AND " +
           "(:maxConfidence IS NULL OR r.detectionResult.confidence <= :maxConfidence)")
    Page<SpamReport> search(@Param("status") ReportStatus status,
                            @Param("severity") Severity severity,
                            @Param("contentType") ContentType contentType,
                            @Param("reportType") ReportType reportType,
                            @Param("minConfidence") Integer minConfidence,
                            @Param("maxConfidence") Integer maxConfidence,
                            Pageable pageable);

    /**
     * Pending reports that are high priority or critical, most important first.
     */
    @Query("SELECT r FROM SpamReport r WHERE r.status = com.rental.marketplace.enums.ReportStatus.PENDING " +
           "AND (r.priority >= 8 OR r.severity = com.rental.marketplace.enums.Severity.CRITICAL) " +
           "ORDER BY r.priority DESC, r.reportedAt DESC")
    List<SpamReport> findUrgent(Pageable pageable);

    // ----------------- statistics -----------------

    long countByReportedAtGreaterThanEqual(LocalDateTime since);

    // [status, count]
    @Query("SELECT r.status, COUNT(r) FROM SpamReport r WHERE r.reportedAt >= :since GROUP BY r.status")
    List<Object[]> countByStatusSince(@Param("since") LocalDateTime since);

    // [reportType, count]
    @Query("SELECT r.reportType, COUNT(r) FROM SpamReport r WHERE r.reportedAt >= :since GROUP BY r.reportType")
    List<Object[]> countByReportTypeSince(@Param("since") LocalDateTime since);

    @Query("SELECT AVG(r.detectionResult.confidence) FROM SpamReport r " +
           "WHERE r.reportedAt >= :since AND r.detectionResult.confidence IS NOT NULL")
    Double averageConfidenceSince(@Param("since") LocalDateTime since);

    // [reportedUserId, reportCount], most reported first
    @Query("SELECT r.reportedUserId, COUNT(r) FROM SpamReport r WHERE r.reportedAt >= :since " +
           "GROUP BY r.reportedUserId ORDER BY COUNT(r) DESC")
    List<Object[]> findTopReportedUsers(@Param("since") LocalDateTime since, Pageable pageable);
}
