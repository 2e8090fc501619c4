package com.rental.marketplace.service;

import com.rental.marketplace.config.SpamDetectionProperties;
import com.rental.marketplace.detection.DetectionOutcome;
import com.rental.marketplace.detection.DetectionSubject;
import com.rental.marketplace.detection.ScoreAggregator;
import com.rental.marketplace.detection.SignalExtractor;
import com.rental.marketplace.entity.DetectionResult;
import com.rental.marketplace.entity.SpamReport;
import com.rental.marketplace.enums.*;
import com.rental.marketplace.exception.DetectionException;
import com.rental.marketplace.repository.SpamReportRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Runs every registered {@link SignalExtractor} concurrently, folds the sub-scores into a
 * {@link DetectionResult} and files a detection report for suspicious content.
 * <p>
 * Detection never fails its caller: an extractor that does not finish normally scores 0, and
 * anything else going wrong yields a clean zero-confidence result.
 */
@Service
public class SpamDetectionService {

    private static final Logger log = LoggerFactory.getLogger(SpamDetectionService.class);

    private final List<SignalExtractor> extractors;
    private final ScoreAggregator aggregator;
    private final SpamReportRepository spamReportRepository;
    private final ExecutorService executor;
    private final SpamDetectionProperties properties;
    private final TransactionTemplate requiresNew;
    private final Clock clock;

    public SpamDetectionService(List<SignalExtractor> extractors,
                                ScoreAggregator aggregator,
                                SpamReportRepository spamReportRepository,
                                @Qualifier("detectionExecutor") ExecutorService executor,
                                SpamDetectionProperties properties,
                                PlatformTransactionManager transactionManager,
                                Clock clock) {
        this.extractors = extractors;
        this.aggregator = aggregator;
        this.spamReportRepository = spamReportRepository;
        this.executor = executor;
        this.properties = properties;
        this.requiresNew = new TransactionTemplate(transactionManager);
        this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.clock = clock;
    }

    public DetectionResult detectSpam(Map<String, String> content, ContentType contentType, Long userId) {
        return detectAndRecord(DetectionSubject.draft(contentType, userId, content)).getResult();
    }

    public DetectionResult detectSpam(DetectionSubject subject) {
        return detectAndRecord(subject).getResult();
    }

    /**
     * Scores the subject and, when it is spam or confidence is high enough, persists an automated
     * pending report. The outcome carries that report's id.
     */
    public DetectionOutcome detectAndRecord(DetectionSubject subject) {
        DetectionResult result;
        try {
            result = aggregator.aggregate(runExtractors(subject));
        } catch (RuntimeException e) {
            log.error("Spam detection failed for {} by user {}, treating as clean",
                    subject.getContentType(), subject.getUserId(), e);
            return new DetectionOutcome(DetectionResult.clean(), null);
        }

        if (result.getConfidence() > properties.getLogConfidenceThreshold()) {
            log.info("Spam detection: user={}, type={}, score={}, confidence={}, reasons={}",
                    subject.getUserId(), subject.getContentType(),
                    String.format("%.3f", result.getOverallScore()), result.getConfidence(), result.getReasons());
        }

        Long reportId = null;
        if (result.isSpam() || result.getConfidence() > properties.getReportConfidenceThreshold()) {
            reportId = recordDetection(subject, result);
        }
        return new DetectionOutcome(result, reportId);
    }

    private Map<SignalCategory, Double> runExtractors(DetectionSubject subject) {
        Map<SignalCategory, CompletableFuture<Double>> futures = new EnumMap<>(SignalCategory.class);
        for (SignalExtractor extractor : extractors) {
            CompletableFuture<Double> future;
            try {
                future = CompletableFuture
                        .supplyAsync(() -> extractor.score(subject), executor)
                        .orTimeout(properties.getExtractorTimeoutMs(), TimeUnit.MILLISECONDS)
                        .exceptionally(ex -> degrade(extractor.category(), ex));
            } catch (RejectedExecutionException e) {
                future = CompletableFuture.completedFuture(degrade(extractor.category(), e));
            }
            futures.put(extractor.category(), future);
        }

        CompletableFuture.allOf(futures.values().toArray(new CompletableFuture[0])).join();

        Map<SignalCategory, Double> scores = new EnumMap<>(SignalCategory.class);
        futures.forEach((category, future) -> scores.put(category, sanitize(category, future.join())));
        return scores;
    }

    private double degrade(SignalCategory category, Throwable ex) {
        Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
        log.warn("Signal degraded to 0", DetectionException.signalFailed(category, cause));
        return 0.0;
    }

    private static double sanitize(SignalCategory category, Double value) {
        if (value == null || !Double.isFinite(value)) {
            log.warn("{} signal returned {}, using 0", category, value);
            return 0.0;
        }
        return SignalExtractor.clamp(value);
    }

    private Long recordDetection(DetectionSubject subject, DetectionResult result) {
        if (subject.getUserId() == null) {
            log.warn("Detection report skipped for anonymous {} content", subject.getContentType());
            return null;
        }
        try {
            return requiresNew.execute(status -> {
                SpamReport report = new SpamReport();
                report.setContentType(subject.getContentType());
                report.setContentId(subject.getContentId());
                report.setReportedUserId(subject.getUserId());
                report.setReportType(ReportType.AUTOMATED);
                report.setCategory(ReportCategory.SPAM);
                report.setSeverity(Severity.fromScore(result.getOverallScore()));
                report.setDetectionResult(result);
                report.setReportedAt(LocalDateTime.now(clock));
                if (subject.getContentId() != null) {
                    spamReportRepository.findByContentTypeAndContentId(subject.getContentType(), subject.getContentId())
                            .forEach(existing -> report.addRelatedReport(existing.getReportId()));
                }
                return spamReportRepository.save(report).getReportId();
            });
        } catch (RuntimeException e) {
            log.error("Failed to record spam detection for user {}", subject.getUserId(), e);
            return null;
        }
    }
}
