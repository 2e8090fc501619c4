package com.rental.marketplace.detection.signals;

import com.rental.marketplace.config.SpamDetectionProperties;
import com.rental.marketplace.detection.DetectionSubject;
import com.rental.marketplace.detection.SignalExtractor;
import com.rental.marketplace.detection.UserRiskProfile;
import com.rental.marketplace.entity.User;
import com.rental.marketplace.enums.ReportStatus;
import com.rental.marketplace.enums.SignalCategory;
import com.rental.marketplace.repository.SpamReportRepository;
import com.rental.marketplace.repository.UserRepository;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.stream.Stream;

/**
 * Risk carried by the author: young account, sparse profile, confirmed spam history.
 * Unknown users score 0.
 */
@Component
public class UserRiskSignalExtractor implements SignalExtractor {

    private final UserRepository userRepository;
    private final SpamReportRepository spamReportRepository;
    private final SpamDetectionProperties.UserRisk config;
    private final Clock clock;

    public UserRiskSignalExtractor(UserRepository userRepository, SpamReportRepository spamReportRepository,
                                   SpamDetectionProperties properties, Clock clock) {
        this.userRepository = userRepository;
        this.spamReportRepository = spamReportRepository;
        this.config = properties.getUserRisk();
        this.clock = clock;
    }

    @Override
    public SignalCategory category() {
        return SignalCategory.USER;
    }

    @Override
    public double score(DetectionSubject subject) {
        if (subject.getUserId() == null) {
            return 0.0;
        }
        return userRepository.findById(subject.getUserId())
                .map(this::profile)
                .map(this::score)
                .orElse(0.0);
    }

    UserRiskProfile profile(User user) {
        LocalDateTime createdAt = user.getCreatedAt() == null ? LocalDateTime.now(clock) : user.getCreatedAt();
        Duration age = Duration.between(createdAt, LocalDateTime.now(clock));

        long missing = Stream.of(user.getName(), user.getEmail(), user.getPhone(), user.getAvatar())
                .filter(value -> value == null || value.isBlank())
                .count();
        long confirmed = spamReportRepository.countByReportedUserIdAndStatus(user.getUserId(), ReportStatus.CONFIRMED);

        return new UserRiskProfile(age, (int) missing, 4, confirmed);
    }

    double score(UserRiskProfile profile) {
        double score = 0.0;

        if (profile.getAccountAge().compareTo(Duration.ofDays(1)) < 0) {
            score += config.getNewAccountPenalty();
        } else if (profile.getAccountAge().compareTo(Duration.ofDays(config.getYoungAccountDays())) < 0) {
            score += config.getYoungAccountPenalty();
        }

        score += profile.missingShare() * config.getIncompleteProfileWeight();
        score += Math.min(profile.getConfirmedReports() * config.getConfirmedReportPenalty(),
                config.getConfirmedReportCap());

        return SignalExtractor.clamp(score);
    }
}
