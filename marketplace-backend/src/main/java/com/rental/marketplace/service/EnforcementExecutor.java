package com.rental.marketplace.service;

import com.rental.marketplace.config.ModerationPolicyProperties;
import com.rental.marketplace.entity.SpamReport;
import com.rental.marketplace.entity.User;
import com.rental.marketplace.enums.ActionTaken;
import com.rental.marketplace.enums.UserStatus;
import com.rental.marketplace.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Applies a moderation action to the reported user or their content. Each application runs in
 * its own transaction, and a failure is logged and reported as "not applied" rather than thrown,
 * so the review that triggered it still commits.
 */
@Component
public class EnforcementExecutor {

    private static final Logger log = LoggerFactory.getLogger(EnforcementExecutor.class);

    private final UserRepository userRepository;
    private final ContentLocator contentLocator;
    private final NotificationService notificationService;
    private final ModerationPolicyProperties properties;
    private final TransactionTemplate requiresNew;
    private final Clock clock;

    public EnforcementExecutor(UserRepository userRepository,
                               ContentLocator contentLocator,
                               NotificationService notificationService,
                               ModerationPolicyProperties properties,
                               PlatformTransactionManager transactionManager,
                               Clock clock) {
        this.userRepository = userRepository;
        this.contentLocator = contentLocator;
        this.notificationService = notificationService;
        this.properties = properties;
        this.requiresNew = new TransactionTemplate(transactionManager);
        this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.clock = clock;
    }

    /**
     * @return true when the action was applied and should be recorded on the report
     */
    public boolean apply(SpamReport report, ActionTaken action) {
        if (action == null || action == ActionTaken.NONE) {
            return false;
        }
        try {
            Boolean applied = requiresNew.execute(status -> doApply(report, action));
            return Boolean.TRUE.equals(applied);
        } catch (RuntimeException e) {
            log.error("Failed to apply {} for report {} (user {})",
                    action.getValue(), report.getReportId(), report.getReportedUserId(), e);
            return false;
        }
    }

    private boolean doApply(SpamReport report, ActionTaken action) {
        Optional<User> found = userRepository.findById(report.getReportedUserId());
        if (found.isEmpty()) {
            log.warn("Skipping {} for report {}: user {} not found",
                    action.getValue(), report.getReportId(), report.getReportedUserId());
            return false;
        }
        User user = found.get();

        switch (action) {
            case WARNING:
                notificationService.sendWarning(user, report);
                break;
            case CONTENT_REMOVED:
                if (!contentLocator.remove(report.getContentType(), report.getContentId())) {
                    log.warn("No {} {} to remove for report {}",
                            report.getContentType().getValue(), report.getContentId(), report.getReportId());
                }
                break;
            case USER_SUSPENDED:
                user.setStatus(UserStatus.SUSPENDED);
                user.setSuspendedUntil(LocalDateTime.now(clock).plusDays(properties.getSuspensionDays()));
                userRepository.save(user);
                break;
            case USER_BANNED:
                user.setStatus(UserStatus.BANNED);
                userRepository.save(user);
                break;
            case SHADOWBAN:
                user.setShadowBanned(true);
                userRepository.save(user);
                break;
            default:
                return false;
        }

        log.info("Applied {} to user {} for report {}", action.getValue(), user.getUserId(), report.getReportId());
        return true;
    }
}
