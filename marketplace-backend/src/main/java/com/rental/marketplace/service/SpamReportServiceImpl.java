package com.rental.marketplace.service;

import com.rental.marketplace.config.ModerationPolicyProperties;
import com.rental.marketplace.dto.*;
import com.rental.marketplace.entity.SpamReport;
import com.rental.marketplace.entity.UserReportDetails;
import com.rental.marketplace.enums.*;
import com.rental.marketplace.exception.AuthorizationException;
import com.rental.marketplace.exception.ConflictException;
import com.rental.marketplace.exception.NotFoundException;
import com.rental.marketplace.exception.ValidationException;
import com.rental.marketplace.filter.AuthenticatedActor;
import com.rental.marketplace.repository.SpamReportRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

@Service
@Transactional(readOnly = true)
public class SpamReportServiceImpl implements SpamReportService {

    private static final Logger log = LoggerFactory.getLogger(SpamReportServiceImpl.class);

    private final SpamReportRepository spamReportRepository;
    private final ContentLocator contentLocator;
    private final EnforcementExecutor enforcementExecutor;
    private final NotificationService notificationService;
    private final ModerationPolicyProperties properties;
    private final TransactionTemplate requiresNew;
    private final Clock clock;

    public SpamReportServiceImpl(SpamReportRepository spamReportRepository,
                                 ContentLocator contentLocator,
                                 EnforcementExecutor enforcementExecutor,
                                 NotificationService notificationService,
                                 ModerationPolicyProperties properties,
                                 PlatformTransactionManager transactionManager,
                                 Clock clock) {
        this.spamReportRepository = spamReportRepository;
        this.contentLocator = contentLocator;
        this.enforcementExecutor = enforcementExecutor;
        this.notificationService = notificationService;
        this.properties = properties;
        this.requiresNew = new TransactionTemplate(transactionManager);
        this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.clock = clock;
    }

    /**
     * The duplicate guard is a check-then-insert; two concurrent submissions from the same reporter
     * can both pass it.
     */
    @Override
    @Transactional
    public SpamReportDTO submitReport(AuthenticatedActor reporter, SubmitReportRequest request) {
        ContentType contentType = ContentType.fromValue(request.getContentType());
        if (!contentType.isReportable()) {
            throw ValidationException.of("contentType", "Invalid content type");
        }

        Long reportedUserId = contentLocator.findResponsibleUser(contentType, request.getContentId())
                .orElseThrow(() -> new NotFoundException("Content not found"));

        if (spamReportRepository.existsByContentTypeAndContentIdAndReporterIdAndStatusIn(
                contentType, request.getContentId(), reporter.getUserId(), ReportStatus.OPEN)) {
            throw new ConflictException("You have already reported this content");
        }

        ReportCategory category = ReportCategory.fromValue(request.getCategory());
        LocalDateTime now = LocalDateTime.now(clock);

        SpamReport report = new SpamReport();
        report.setContentType(contentType);
        report.setContentId(request.getContentId());
        report.setReporterId(reporter.getUserId());
        report.setReportedUserId(reportedUserId);
        report.setReportType(reporter.isAdmin() ? ReportType.ADMIN_FLAGGED : ReportType.USER_REPORTED);
        report.setCategory(category);
        report.setSeverity(category.getDefaultSeverity());
        report.setUserReportDetails(new UserReportDetails(request.getReason(), request.getDescription(),
                request.getEvidence() == null ? new ArrayList<>() : new ArrayList<>(request.getEvidence())));
        report.setReportedAt(now);
        spamReportRepository.findByContentTypeAndContentId(contentType, request.getContentId())
                .forEach(existing -> report.addRelatedReport(existing.getReportId()));

        SpamReport saved = spamReportRepository.save(report);
        log.info("Report {} filed by user {} against {} {} ({})", saved.getReportId(), reporter.getUserId(),
                contentType.getValue(), request.getContentId(), category.getValue());
        return SpamReportDTO.from(saved, now);
    }

    @Override
    public PageDTO<SpamReportDTO> listReports(ReportQuery query) {
        if (query.getMinConfidence() != null && query.getMaxConfidence() != null
                && query.getMinConfidence() > query.getMaxConfidence()) {
            throw ValidationException.of("minConfidence", "minConfidence cannot exceed maxConfidence");
        }

        Sort.Direction direction = "asc".equalsIgnoreCase(query.getSortOrder()) ? Sort.Direction.ASC : Sort.Direction.DESC;
        String sortBy = query.getSortBy() == null ? "reportedAt" : query.getSortBy();
        PageRequest pageable = PageRequest.of(query.getPage() - 1, query.getLimit(),
                Sort.by(direction, sortBy).and(Sort.by(Sort.Direction.DESC, "reportId")));

        Page<SpamReport> page = spamReportRepository.search(
                query.getStatus() == null ? null : ReportStatus.fromValue(query.getStatus()),
                query.getSeverity() == null ? null : Severity.fromValue(query.getSeverity()),
                query.getContentType() == null ? null : ContentType.fromValue(query.getContentType()),
                query.getReportType() == null ? null : ReportType.fromValue(query.getReportType()),
                query.getMinConfidence(),
                query.getMaxConfidence(),
                pageable);

        LocalDateTime now = LocalDateTime.now(clock);
        return PageDTO.of(page, report -> SpamReportDTO.from(report, now));
    }

    @Override
    public List<SpamReportDTO> getUrgentReports() {
        LocalDateTime now = LocalDateTime.now(clock);
        return spamReportRepository.findUrgent(PageRequest.of(0, properties.getUrgentLimit())).stream()
                .map(report -> SpamReportDTO.from(report, now))
                .collect(Collectors.toList());
    }

    @Override
    public List<SpamReportDTO> getUserReports(AuthenticatedActor actor, Long userId) {
        if (!actor.isAdmin() && !actor.getUserId().equals(userId)) {
            throw new AuthorizationException("You can only view reports against your own account");
        }
        LocalDateTime now = LocalDateTime.now(clock);
        return spamReportRepository.findByReportedUserIdAndStatusInOrderByReportedAtDesc(userId, ReportStatus.OPEN)
                .stream()
                .map(report -> SpamReportDTO.from(report, now))
                .collect(Collectors.toList());
    }

    @Override
    @Transactional
    public SpamReportDTO reviewReport(Long reviewerId, Long reportId, ReviewReportRequest request) {
        SpamReport report = applyReview(reviewerId, findReport(reportId), ReportStatus.fromValue(request.getStatus()),
                request.getNotes(), request.getAction());
        return SpamReportDTO.from(report, LocalDateTime.now(clock));
    }

    /**
     * Each report is reviewed in its own transaction, so one failure does not undo the others.
     */
    @Override
    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    public BulkReviewResultDTO bulkReview(Long reviewerId, BulkReviewRequest request) {
        ReportStatus target = ReportStatus.fromValue(request.getStatus());
        int successful = 0;
        int failed = 0;

        for (Long reportId : request.getReportIds()) {
            try {
                requiresNew.executeWithoutResult(status ->
                        applyReview(reviewerId, findReport(reportId), target, request.getNotes(), request.getAction()));
                successful++;
            } catch (RuntimeException e) {
                failed++;
                log.warn("Bulk review of report {} failed: {}", reportId, e.getMessage());
            }
        }

        log.info("Bulk review by {} to {}: {} successful, {} failed",
                reviewerId, target.getValue(), successful, failed);
        return new BulkReviewResultDTO(successful, failed);
    }

    private SpamReport applyReview(Long reviewerId, SpamReport report, ReportStatus target, String notes, String actionValue) {
        if (!ReportStatus.REVIEW_OUTCOMES.contains(target)) {
            throw ValidationException.of("status", "Invalid status");
        }
        LocalDateTime now = LocalDateTime.now(clock);
        report.transitionTo(target, now);
        report.markReviewed(reviewerId, notes, now);

        ActionTaken action = actionValue == null ? ActionTaken.NONE : ActionTaken.fromValue(actionValue);
        if (action != ActionTaken.NONE && enforcementExecutor.apply(report, action)) {
            report.setActionTaken(action);
        }

        SpamReport saved = spamReportRepository.save(report);
        log.info("Report {} reviewed by {}: {} (action {})",
                saved.getReportId(), reviewerId, target.getValue(), saved.getActionTaken().getValue());
        return saved;
    }

    @Override
    @Transactional
    public SpamReportDTO claimReport(Long reviewerId, Long reportId, String notes) {
        return moveTo(reviewerId, reportId, ReportStatus.UNDER_REVIEW, notes);
    }

    @Override
    @Transactional
    public SpamReportDTO resolveReport(Long reviewerId, Long reportId, String notes) {
        return moveTo(reviewerId, reportId, ReportStatus.RESOLVED, notes);
    }

    private SpamReportDTO moveTo(Long reviewerId, Long reportId, ReportStatus target, String notes) {
        SpamReport report = findReport(reportId);
        LocalDateTime now = LocalDateTime.now(clock);
        report.transitionTo(target, now);
        report.markReviewed(reviewerId, notes, now);
        SpamReport saved = spamReportRepository.save(report);
        log.info("Report {} moved to {} by {}", reportId, target.getValue(), reviewerId);
        return SpamReportDTO.from(saved, now);
    }

    @Override
    @Transactional
    public SpamReportDTO submitAppeal(AuthenticatedActor actor, Long reportId, AppealRequest request) {
        SpamReport report = findReport(reportId);
        if (!report.getReportedUserId().equals(actor.getUserId())) {
            throw new AuthorizationException("Only the reported user can appeal this report");
        }

        LocalDateTime now = LocalDateTime.now(clock);
        report.submitAppeal(request.getReason(), now);
        SpamReport saved = spamReportRepository.save(report);
        log.info("Appeal submitted on report {} by user {}", reportId, actor.getUserId());
        return SpamReportDTO.from(saved, now);
    }

    @Override
    @Transactional
    public SpamReportDTO reviewAppeal(Long reviewerId, Long reportId, AppealReviewRequest request) {
        SpamReport report = findReport(reportId);
        AppealStatus decision = AppealStatus.fromDecision(request.getStatus());

        LocalDateTime now = LocalDateTime.now(clock);
        report.reviewAppeal(reviewerId, decision, request.getNotes(), now);
        SpamReport saved = spamReportRepository.save(report);
        log.info("Appeal on report {} {} by {}", reportId, decision.getValue(), reviewerId);

        notificationService.sendAppealDecision(saved.getReportedUserId(), saved);
        return SpamReportDTO.from(saved, now);
    }

    @Override
    public long countStaleReports() {
        LocalDateTime cutoff = LocalDateTime.now(clock).minus(SpamReport.STALE_AFTER);
        return spamReportRepository.countByStatusAndReportedAtBefore(ReportStatus.PENDING, cutoff);
    }

    private SpamReport findReport(Long reportId) {
        return spamReportRepository.findById(reportId)
                .orElseThrow(() -> new NotFoundException("Spam report not found"));
    }
}
