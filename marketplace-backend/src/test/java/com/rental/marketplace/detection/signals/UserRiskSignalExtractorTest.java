package com.rental.marketplace.detection.signals;

import com.rental.marketplace.config.SpamDetectionProperties;
import com.rental.marketplace.detection.DetectionSubject;
import com.rental.marketplace.entity.User;
import com.rental.marketplace.enums.ContentType;
import com.rental.marketplace.enums.ReportStatus;
import com.rental.marketplace.repository.SpamReportRepository;
import com.rental.marketplace.repository.UserRepository;
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
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class UserRiskSignalExtractorTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-03-10T12:00:00Z"), ZoneOffset.UTC);
    private static final LocalDateTime NOW = LocalDateTime.now(CLOCK);

    @Mock
    private UserRepository userRepository;

    @Mock
    private SpamReportRepository spamReportRepository;

    private UserRiskSignalExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new UserRiskSignalExtractor(userRepository, spamReportRepository,
                new SpamDetectionProperties(), CLOCK);
    }

    private User user(LocalDateTime createdAt, String name, String email, String phone, String avatar) {
        User user = new User();
        user.setUserId(7L);
        user.setCreatedAt(createdAt);
        user.setName(name);
        user.setEmail(email);
        user.setPhone(phone);
        user.setAvatar(avatar);
        return user;
    }

    private double score() {
        return extractor.score(DetectionSubject.draft(ContentType.PROPERTY, 7L, Map.of("title", "x")));
    }

    @Test
    void testBrandNewEmptyRepeatOffenderScoresOne() {
        when(userRepository.findById(7L)).thenReturn(Optional.of(user(NOW.minusHours(2), null, null, null, null)));
        when(spamReportRepository.countByReportedUserIdAndStatus(7L, ReportStatus.CONFIRMED)).thenReturn(3L);

        // 0.3 + 0.2 + min(0.6, 0.5)
        assertEquals(1.0, score(), 1e-9);
    }

    @Test
    void testYoungAccountWithHalfProfile() {
        when(userRepository.findById(7L)).thenReturn(Optional.of(
                user(NOW.minusDays(3), "Ana", "ana@example.com", null, "")));
        when(spamReportRepository.countByReportedUserIdAndStatus(7L, ReportStatus.CONFIRMED)).thenReturn(0L);

        // 0.15 + 2/4 * 0.2
        assertEquals(0.25, score(), 1e-9);
    }

    @Test
    void testEstablishedCompleteAccountWithOneConfirmedReport() {
        when(userRepository.findById(7L)).thenReturn(Optional.of(
                user(NOW.minusDays(30), "Ana", "ana@example.com", "555", "a.png")));
        when(spamReportRepository.countByReportedUserIdAndStatus(7L, ReportStatus.CONFIRMED)).thenReturn(1L);

        assertEquals(0.2, score(), 1e-9);
    }

    @Test
    void testUnknownUserScoresZero() {
        when(userRepository.findById(7L)).thenReturn(Optional.empty());

        assertEquals(0.0, score());
        verifyNoInteractions(spamReportRepository);
    }
}
