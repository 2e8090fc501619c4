package com.rental.marketplace.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Action thresholds, enforcement durations and submission limits ({@code spam.moderation.*}).
 */
@Data
@ConfigurationProperties(prefix = "spam.moderation")
public class ModerationPolicyProperties {

    private double autoRejectThreshold = 0.9;

    /** Repeat offenders at or above this score are suspended, others shadow-banned. */
    private double restrictThreshold = 0.8;

    private double manualReviewThreshold = 0.6;

    /** Confirmed reports that make a user a repeat offender. */
    private int repeatOffenderReports = 3;

    private int suspensionDays = 7;

    private int urgentLimit = 20;

    private int topReportedUsers = 10;

    private SubmissionLimits submission = new SubmissionLimits();

    @Data
    public static class SubmissionLimits {
        // confirmed reports in the window that block further posting
        private int maxRecentViolations = 3;
        private int violationWindowHours = 24;

        private int baseHourlyLimit = 10;
        private int elevatedHourlyLimit = 5;
        private int strictHourlyLimit = 2;
        private double elevatedRiskScore = 0.5;
        private double strictRiskScore = 0.7;
        private int riskSampleSize = 5;
        private int riskWindowDays = 7;
        private long retryAfterSeconds = 3600;
    }
}
