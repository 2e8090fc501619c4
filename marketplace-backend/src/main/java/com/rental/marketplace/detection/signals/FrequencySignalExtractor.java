package com.rental.marketplace.detection.signals;

import com.rental.marketplace.config.SpamDetectionProperties;
import com.rental.marketplace.detection.DetectionSubject;
import com.rental.marketplace.detection.SignalExtractor;
import com.rental.marketplace.enums.ContentType;
import com.rental.marketplace.enums.SignalCategory;
import com.rental.marketplace.repository.BookingRepository;
import com.rental.marketplace.repository.PropertyRepository;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Posting bursts: how much content of the same type the author created in the last hour and day.
 * Only listings and bookings are tracked.
 */
@Component
public class FrequencySignalExtractor implements SignalExtractor {

    private final PropertyRepository propertyRepository;
    private final BookingRepository bookingRepository;
    private final SpamDetectionProperties.Frequency config;
    private final Clock clock;

    public FrequencySignalExtractor(PropertyRepository propertyRepository, BookingRepository bookingRepository,
                                    SpamDetectionProperties properties, Clock clock) {
        this.propertyRepository = propertyRepository;
        this.bookingRepository = bookingRepository;
        this.config = properties.getFrequency();
        this.clock = clock;
    }

    @Override
    public SignalCategory category() {
        return SignalCategory.FREQUENCY;
    }

    @Override
    public double score(DetectionSubject subject) {
        ContentType type = subject.getContentType();
        if (subject.getUserId() == null || type == null || !type.isFrequencyTracked()) {
            return 0.0;
        }

        LocalDateTime now = LocalDateTime.now(clock);
        long hourly = count(type, subject.getUserId(), now.minusHours(1));
        long daily = count(type, subject.getUserId(), now.minusHours(24));

        double score = 0.0;
        if (hourly > config.getHourlyHigh()) {
            score += config.getHourlyHighPenalty();
        } else if (hourly > config.getHourlyMedium()) {
            score += config.getHourlyMediumPenalty();
        }
        if (daily > config.getDailyHigh()) {
            score += config.getDailyHighPenalty();
        } else if (daily > config.getDailyMedium()) {
            score += config.getDailyMediumPenalty();
        }
        return SignalExtractor.clamp(score);
    }

    private long count(ContentType type, Long userId, LocalDateTime since) {
        if (type == ContentType.PROPERTY) {
            return propertyRepository.countByOwnerIdAndCreatedAtGreaterThanEqual(userId, since);
        }
        return bookingRepository.countByUserIdAndCreatedAtGreaterThanEqual(userId, since);
    }
}
