package com.rental.marketplace.service;

import com.rental.marketplace.config.ModerationPolicyProperties;
import com.rental.marketplace.detection.DetectionOutcome;
import com.rental.marketplace.detection.DetectionSubject;
import com.rental.marketplace.entity.ContentItem;
import com.rental.marketplace.entity.DetectionResult;
import com.rental.marketplace.entity.SpamReport;
import com.rental.marketplace.entity.User;
import com.rental.marketplace.enums.*;
import com.rental.marketplace.exception.AuthorizationException;
import com.rental.marketplace.exception.RateLimitExceededException;
import com.rental.marketplace.filter.AuthenticatedActor;
import com.rental.marketplace.repository.SpamReportRepository;
import com.rental.marketplace.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;

/**
 * Pre-submission contract for flows that create listings or bookings.
 * <ol>
 *   <li>{@link #screen} before saving: account status guard, adaptive rate limit, detection and
 *       the policy's action. Refused content must not be saved.</li>
 *   <li>{@link #completeSubmission} after saving: review flag, shadowban, report linkage.</li>
 * </ol>
 * Admin authors skip both. Only the account guard and the rate limit refuse on their own;
 * any other failure inside the gate is logged and the content goes through unchecked.
 */
@Component
public class ContentSubmissionGate {

    private static final Logger log = LoggerFactory.getLogger(ContentSubmissionGate.class);

    private final SpamDetectionService spamDetectionService;
    private final ModerationActionPolicy policy;
    private final EnforcementExecutor enforcementExecutor;
    private final ContentLocator contentLocator;
    private final RateTracker rateTracker;
    private final SpamReportRepository spamReportRepository;
    private final UserRepository userRepository;
    private final ModerationPolicyProperties.SubmissionLimits limits;
    private final TransactionTemplate requiresNew;
    private final Clock clock;

    public ContentSubmissionGate(SpamDetectionService spamDetectionService,
                                 ModerationActionPolicy policy,
                                 EnforcementExecutor enforcementExecutor,
                                 ContentLocator contentLocator,
                                 RateTracker rateTracker,
                                 SpamReportRepository spamReportRepository,
                                 UserRepository userRepository,
                                 ModerationPolicyProperties properties,
                                 PlatformTransactionManager transactionManager,
                                 Clock clock) {
        this.spamDetectionService = spamDetectionService;
        this.policy = policy;
        this.enforcementExecutor = enforcementExecutor;
        this.contentLocator = contentLocator;
        this.rateTracker = rateTracker;
        this.spamReportRepository = spamReportRepository;
        this.userRepository = userRepository;
        this.limits = properties.getSubmission();
        this.requiresNew = new TransactionTemplate(transactionManager);
        this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.clock = clock;
    }

    public GateDecision screen(AuthenticatedActor author, ContentType contentType, Map<String, String> fields) {
        if (author.isAdmin()) {
            return GateDecision.bypass(author.getUserId(), contentType);
        }

        try {
            checkAccountStatus(author.getUserId());
        } catch (AuthorizationException | RateLimitExceededException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Account status check failed for user {}, skipping", author.getUserId(), e);
        }

        try {
            enforceRateLimit(author.getUserId(), contentType);
        } catch (RateLimitExceededException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Rate limit check failed for user {}, skipping", author.getUserId(), e);
        }

        try {
            return assess(author.getUserId(), contentType, fields);
        } catch (RuntimeException e) {
            log.error("Submission screening failed for user {} ({}), letting content through",
                    author.getUserId(), contentType.getValue(), e);
            return GateDecision.bypass(author.getUserId(), contentType);
        }
    }

    private GateDecision assess(Long authorId, ContentType contentType, Map<String, String> fields) {
        DetectionSubject subject = DetectionSubject.draft(contentType, authorId, fields);
        DetectionOutcome outcome = spamDetectionService.detectAndRecord(subject);
        DetectionResult result = outcome.getResult();

        SpamAction action = policy.recommendedAction(result.getOverallScore(), policy.historyOf(authorId));

        Long reportId = null;
        if (action.filesReport()) {
            SpamReport report = outcome.isRecorded()
                    ? spamReportRepository.findById(outcome.getReportId()).orElseGet(() -> newReport(subject, result))
                    : newReport(subject, result);
            report = spamReportRepository.save(report);
            reportId = report.getReportId();

            if (action == SpamAction.ACCOUNT_SUSPEND && enforcementExecutor.apply(report, ActionTaken.USER_SUSPENDED)) {
                report.setActionTaken(ActionTaken.USER_SUSPENDED);
                spamReportRepository.save(report);
            }
        }

        log.info("Submission gate: user={}, type={}, score={}, action={}, report={}",
                authorId, contentType.getValue(), result.getConfidence(), action.getValue(), reportId);
        return new GateDecision(authorId, contentType, action, result, reportId);
    }

    /**
     * Applies what the decision asks for once the content exists. No-op for refused or clean content.
     * Runs in its own transaction and never throws.
     */
    public void completeSubmission(GateDecision decision, ContentItem created) {
        if (!decision.isAllowed() || decision.getAction() == SpamAction.AUTO_APPROVE) {
            return;
        }

        try {
            requiresNew.executeWithoutResult(status -> applyAfterSave(decision, created));
        } catch (RuntimeException e) {
            log.error("Post-submission actions failed for {} {} by user {}",
                    decision.getContentType().getValue(), created.getContentId(), decision.getAuthorId(), e);
        }
    }

    private void applyAfterSave(GateDecision decision, ContentItem created) {
        SpamReport report = decision.getReportId() == null ? null
                : spamReportRepository.findById(decision.getReportId()).orElse(null);

        if (decision.getAction() == SpamAction.MANUAL_REVIEW) {
            contentLocator.flagForReview(created);
        } else if (decision.getAction() == SpamAction.SHADOWBAN && report != null
                && enforcementExecutor.apply(report, ActionTaken.SHADOWBAN)) {
            report.setActionTaken(ActionTaken.SHADOWBAN);
        }

        if (report != null) {
            report.setContentId(created.getContentId());
            spamReportRepository.save(report);
        }
    }

    private void checkAccountStatus(Long userId) {
        User user = userRepository.findById(userId).orElse(null);
        LocalDateTime now = LocalDateTime.now(clock);
        if (user != null) {
            if (user.getStatus() == UserStatus.BANNED) {
                throw new AuthorizationException("Account has been banned due to spam violations");
            }
            if (user.isSuspendedAt(now)) {
                throw new AuthorizationException("Account is suspended until "
                        + user.getSuspendedUntil().format(DateTimeFormatter.ISO_LOCAL_DATE));
            }
        }

        long recentViolations = spamReportRepository.countByReportedUserIdAndStatusAndReportedAtGreaterThanEqual(
                userId, ReportStatus.CONFIRMED, now.minusHours(limits.getViolationWindowHours()));
        if (recentViolations >= limits.getMaxRecentViolations()) {
            throw new RateLimitExceededException("Too many spam violations. Please contact support.",
                    limits.getRetryAfterSeconds());
        }
    }

    private void enforceRateLimit(Long userId, ContentType contentType) {
        int limit = hourlyLimitFor(userId);
        int count = rateTracker.recordAndCount(userId + "-" + contentType.getValue(), Duration.ofHours(1));
        if (count > limit) {
            log.warn("Rate limit hit: user={}, type={}, count={}, limit={}", userId, contentType.getValue(), count, limit);
            throw new RateLimitExceededException("Rate limit exceeded. Please try again later.",
                    limits.getRetryAfterSeconds());
        }
    }

    /**
     * Hourly allowance from the average overall score of the user's most recent reports.
     * Reports without a detection result count as 0.
     */
    int hourlyLimitFor(Long userId) {
        LocalDateTime since = LocalDateTime.now(clock).minusDays(limits.getRiskWindowDays());
        List<SpamReport> recent = spamReportRepository
                .findTop5ByReportedUserIdAndReportedAtGreaterThanEqualOrderByReportedAtDesc(userId, since);
        double average = recent.stream()
                .limit(limits.getRiskSampleSize())
                .mapToDouble(r -> r.getDetectionResult() == null ? 0.0 : r.getDetectionResult().getOverallScore())
                .average()
                .orElse(0.0);

        if (average > limits.getStrictRiskScore()) {
            return limits.getStrictHourlyLimit();
        }
        if (average > limits.getElevatedRiskScore()) {
            return limits.getElevatedHourlyLimit();
        }
        return limits.getBaseHourlyLimit();
    }

    private SpamReport newReport(DetectionSubject subject, DetectionResult result) {
        SpamReport report = new SpamReport();
        report.setContentType(subject.getContentType());
        report.setReportedUserId(subject.getUserId());
        report.setReportType(ReportType.AUTOMATED);
        report.setCategory(ReportCategory.SPAM);
        report.setSeverity(Severity.fromScore(result.getOverallScore()));
        report.setDetectionResult(result);
        report.setReportedAt(LocalDateTime.now(clock));
        return report;
    }
}
