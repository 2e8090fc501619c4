package com.rental.marketplace.service;

import com.rental.marketplace.config.ModerationPolicyProperties;
import com.rental.marketplace.enums.ReportStatus;
import com.rental.marketplace.enums.SpamAction;
import com.rental.marketplace.repository.SpamReportRepository;
import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.stereotype.Component;

/**
 * Maps a detection score to the automatic moderation action. Thresholds are checked from the
 * strictest down and the first match wins.
 */
@Component
public class ModerationActionPolicy {

    private final ModerationPolicyProperties properties;
    private final SpamReportRepository spamReportRepository;

    public ModerationActionPolicy(ModerationPolicyProperties properties, SpamReportRepository spamReportRepository) {
        this.properties = properties;
        this.spamReportRepository = spamReportRepository;
    }

    public SpamAction recommendedAction(double score, UserHistory history) {
        if (score >= properties.getAutoRejectThreshold()) {
            return SpamAction.AUTO_REJECT;
        }
        if (score >= properties.getRestrictThreshold() && history != null && history.isRepeatOffender()) {
            return SpamAction.ACCOUNT_SUSPEND;
        }
        if (score >= properties.getRestrictThreshold()) {
            return SpamAction.SHADOWBAN;
        }
        if (score >= properties.getManualReviewThreshold()) {
            return SpamAction.MANUAL_REVIEW;
        }
        return SpamAction.AUTO_APPROVE;
    }

    public UserHistory historyOf(Long userId) {
        long confirmed = spamReportRepository.countByReportedUserIdAndStatus(userId, ReportStatus.CONFIRMED);
        return new UserHistory(confirmed, confirmed >= properties.getRepeatOffenderReports());
    }

    @Getter
    @AllArgsConstructor
    public static class UserHistory {
        private final long confirmedReports;
        private final boolean repeatOffender;

        public static UserHistory clean() {
            return new UserHistory(0, false);
        }
    }
}
