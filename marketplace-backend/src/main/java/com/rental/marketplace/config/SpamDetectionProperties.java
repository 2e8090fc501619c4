package com.rental.marketplace.config;

import com.rental.marketplace.enums.SignalCategory;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Rule tables and thresholds of the spam detector ({@code spam.detection.*}).
 * The defaults below are the production rule set; application.yml only overrides what differs.
 */
@Data
@ConfigurationProperties(prefix = "spam.detection")
public class SpamDetectionProperties {

    /** Overall score from which content counts as spam. */
    private double spamThreshold = 0.7;

    /** A detection report is filed when confidence is above this, even if not spam. */
    private int reportConfidenceThreshold = 50;

    /** Detections above this confidence get an info log line. */
    private int logConfidenceThreshold = 30;

    /** Per-extractor budget; a slower extractor scores 0. */
    private long extractorTimeoutMs = 2000;

    /** Free-text fields the keyword signal scans. */
    private List<String> scannedFields = new ArrayList<>(List.of("title", "description", "message", "name", "comments"));

    private Weights weights = new Weights();

    private Keywords keywords = new Keywords();

    private List<PatternRule> patterns = new ArrayList<>(List.of(
            new PatternRule("excessive-exclamation", "!{3,}", 0.2),
            new PatternRule("phone-number", "(\\+?\\d{1,3}[-.\\s]?)?\\(?\\d{3}\\)?[-.\\s]?\\d{3}[-.\\s]?\\d{4}", 0.15),
            new PatternRule("email-address", "[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}", 0.15),
            new PatternRule("long-digit-run", "\\d{10,}", 0.1),
            new PatternRule("currency", "[$€£¥₹]{2,}|\\$\\d+k|\\$\\d+,\\d+", 0.1),
            new PatternRule("url-shortener", "(?i)\\b(bit\\.ly|tinyurl|t\\.co|goo\\.gl)\\b", 0.3),
            new PatternRule("shouting", "[A-Z]{5,}", 0.15),
            new PatternRule("non-ascii-run", "[^\\x00-\\x7F]{3,}", 0.1)));

    private Heuristics heuristics = new Heuristics();

    private UserRisk userRisk = new UserRisk();

    private Frequency frequency = new Frequency();

    private Executor executor = new Executor();

    @Data
    public static class Weights {
        private double keyword = 0.30;
        private double pattern = 0.25;
        private double user = 0.25;
        private double frequency = 0.20;

        public double of(SignalCategory category) {
            switch (category) {
                case KEYWORD:
                    return keyword;
                case PATTERN:
                    return pattern;
                case USER:
                    return user;
                default:
                    return frequency;
            }
        }

        public double sum() {
            return keyword + pattern + user + frequency;
        }
    }

    @Data
    public static class Keywords {
        private double highPenalty = 0.30;
        private double mediumPenalty = 0.15;
        private double lowPenalty = 0.05;

        private List<String> high = new ArrayList<>(List.of(
                "urgent", "limited time", "act now", "exclusive deal", "guaranteed",
                "no questions asked", "risk free", "cash only", "wire transfer",
                "western union", "moneygram", "advance fee", "lottery", "winner",
                "congratulations", "selected", "claim now", "verify account", "suspend",
                "urgent action required", "click here now"));

        private List<String> medium = new ArrayList<>(List.of(
                "free money", "easy money", "work from home", "make money fast", "no experience",
                "earn extra", "part time", "full time income", "financial freedom",
                "debt consolidation", "credit repair", "lowest price", "compare rates",
                "refinance", "pre-approved", "amazing deal", "incredible offer", "must see"));

        private List<String> low = new ArrayList<>(List.of(
                "discount", "sale", "offer", "promotion", "deal", "cheap", "affordable", "budget",
                "save money", "best price", "special price", "reduced price", "clearance", "bargain"));
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PatternRule {
        private String name;
        private String regex;
        private double weight;
    }

    @Data
    public static class Heuristics {
        // share of all-caps words (length > 2)
        private double capsRatio = 0.3;
        private double capsPenalty = 0.2;
        // more than this many [!?]{2,} runs
        private int punctuationRuns = 2;
        private double punctuationPenalty = 0.15;
        // a word longer than repeatedWordMinLength seen more than repeatedWordLimit times
        private int repeatedWordMinLength = 3;
        private int repeatedWordLimit = 3;
        private double repeatedWordPenalty = 0.25;
        private double suspiciousUrlPenalty = 0.4;
        private List<String> shortenerHosts = new ArrayList<>(List.of("bit.ly", "tinyurl.com", "t.co", "goo.gl"));
    }

    @Data
    public static class UserRisk {
        private double newAccountPenalty = 0.30;
        private double youngAccountPenalty = 0.15;
        private int youngAccountDays = 7;
        // scaled by the share of missing profile fields
        private double incompleteProfileWeight = 0.20;
        private double confirmedReportPenalty = 0.20;
        private double confirmedReportCap = 0.50;
    }

    @Data
    public static class Frequency {
        private int hourlyHigh = 5;
        private double hourlyHighPenalty = 0.40;
        private int hourlyMedium = 3;
        private double hourlyMediumPenalty = 0.20;
        private int dailyHigh = 20;
        private double dailyHighPenalty = 0.30;
        private int dailyMedium = 10;
        private double dailyMediumPenalty = 0.15;
    }

    @Data
    public static class Executor {
        private int corePoolSize = 4;
        private int maxPoolSize = 16;
        private int queueCapacity = 500;
    }
}
