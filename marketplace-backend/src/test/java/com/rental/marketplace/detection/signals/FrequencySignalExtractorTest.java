package com.rental.marketplace.detection.signals;

import com.rental.marketplace.config.SpamDetectionProperties;
import com.rental.marketplace.detection.DetectionSubject;
import com.rental.marketplace.enums.ContentType;
import com.rental.marketplace.repository.BookingRepository;
import com.rental.marketplace.repository.PropertyRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class FrequencySignalExtractorTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-03-10T12:00:00Z"), ZoneOffset.UTC);
    private static final LocalDateTime NOW = LocalDateTime.now(CLOCK);

    @Mock
    private PropertyRepository propertyRepository;

    @Mock
    private BookingRepository bookingRepository;

    private FrequencySignalExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new FrequencySignalExtractor(propertyRepository, bookingRepository,
                new SpamDetectionProperties(), CLOCK);
    }

    private double score(ContentType type) {
        return extractor.score(DetectionSubject.draft(type, 5L, Map.of()));
    }

    @Test
    void testPropertyBurst() {
        when(propertyRepository.countByOwnerIdAndCreatedAtGreaterThanEqual(5L, NOW.minusHours(1))).thenReturn(6L);
        when(propertyRepository.countByOwnerIdAndCreatedAtGreaterThanEqual(5L, NOW.minusHours(24))).thenReturn(21L);

        assertEquals(0.7, score(ContentType.PROPERTY), 1e-9);
        verifyNoInteractions(bookingRepository);
    }

    @Test
    void testModerateBookingActivity() {
        when(bookingRepository.countByUserIdAndCreatedAtGreaterThanEqual(5L, NOW.minusHours(1))).thenReturn(4L);
        when(bookingRepository.countByUserIdAndCreatedAtGreaterThanEqual(5L, NOW.minusHours(24))).thenReturn(11L);

        assertEquals(0.35, score(ContentType.BOOKING), 1e-9);
    }

    @Test
    void testThresholdsAreExclusive() {
        when(propertyRepository.countByOwnerIdAndCreatedAtGreaterThanEqual(5L, NOW.minusHours(1))).thenReturn(3L);
        when(propertyRepository.countByOwnerIdAndCreatedAtGreaterThanEqual(5L, NOW.minusHours(24))).thenReturn(10L);

        assertEquals(0.0, score(ContentType.PROPERTY));
    }

    @Test
    void testUntrackedTypesScoreZero() {
        assertEquals(0.0, score(ContentType.MESSAGE));
        assertEquals(0.0, score(ContentType.USER));
        verifyNoInteractions(propertyRepository, bookingRepository);
    }
}
