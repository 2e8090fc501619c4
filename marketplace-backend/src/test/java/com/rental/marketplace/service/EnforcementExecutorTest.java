package com.rental.marketplace.service;

import com.rental.marketplace.config.ModerationPolicyProperties;
import com.rental.marketplace.entity.SpamReport;
import com.rental.marketplace.entity.User;
import com.rental.marketplace.enums.ActionTaken;
import com.rental.marketplace.enums.ContentType;
import com.rental.marketplace.enums.UserStatus;
import com.rental.marketplace.repository.UserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class EnforcementExecutorTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-03-10T12:00:00Z"), ZoneOffset.UTC);
    private static final LocalDateTime NOW = LocalDateTime.now(CLOCK);

    @Mock
    private UserRepository userRepository;

    @Mock
    private ContentLocator contentLocator;

    @Mock
    private NotificationService notificationService;

    @Mock
    private PlatformTransactionManager transactionManager;

    private EnforcementExecutor executor;
    private SpamReport report;
    private User user;

    @BeforeEach
    void setUp() {
        executor = new EnforcementExecutor(userRepository, contentLocator, notificationService,
                new ModerationPolicyProperties(), transactionManager, CLOCK);

        report = new SpamReport();
        report.setReportId(5L);
        report.setContentType(ContentType.PROPERTY);
        report.setContentId(10L);
        report.setReportedUserId(7L);

        user = new User();
        user.setUserId(7L);
        user.setCreatedAt(NOW.minusDays(100));
    }

    @Test
    void testSuspensionLastsSevenDays() {
        when(userRepository.findById(7L)).thenReturn(Optional.of(user));

        assertTrue(executor.apply(report, ActionTaken.USER_SUSPENDED));

        assertEquals(UserStatus.SUSPENDED, user.getStatus());
        assertEquals(NOW.plusDays(7), user.getSuspendedUntil());
        verify(userRepository).save(user);
        verify(transactionManager).commit(any());
    }

    @Test
    void testBan() {
        when(userRepository.findById(7L)).thenReturn(Optional.of(user));

        assertTrue(executor.apply(report, ActionTaken.USER_BANNED));

        assertEquals(UserStatus.BANNED, user.getStatus());
        assertNull(user.getSuspendedUntil());
    }

    @Test
    void testShadowbanKeepsUserActive() {
        when(userRepository.findById(7L)).thenReturn(Optional.of(user));

        assertTrue(executor.apply(report, ActionTaken.SHADOWBAN));

        assertTrue(user.isShadowBanned());
        assertEquals(UserStatus.ACTIVE, user.getStatus());
    }

    @Test
    void testWarningNotifiesUser() {
        when(userRepository.findById(7L)).thenReturn(Optional.of(user));

        assertTrue(executor.apply(report, ActionTaken.WARNING));

        verify(notificationService).sendWarning(user, report);
        verify(userRepository, never()).save(any());
    }

    @Test
    void testContentRemoval() {
        when(userRepository.findById(7L)).thenReturn(Optional.of(user));
        when(contentLocator.remove(ContentType.PROPERTY, 10L)).thenReturn(true);

        assertTrue(executor.apply(report, ActionTaken.CONTENT_REMOVED));
        verify(contentLocator).remove(ContentType.PROPERTY, 10L);
    }

    @Test
    void testMissingUserIsNotEnforced() {
        when(userRepository.findById(7L)).thenReturn(Optional.empty());

        assertFalse(executor.apply(report, ActionTaken.USER_BANNED));
        verify(userRepository, never()).save(any());
    }

    @Test
    void testFailureIsAbsorbed() {
        when(userRepository.findById(7L)).thenThrow(new RuntimeException("db down"));

        assertFalse(executor.apply(report, ActionTaken.USER_SUSPENDED));
        verify(transactionManager).rollback(any());
    }

    @Test
    void testNoneDoesNothing() {
        assertFalse(executor.apply(report, ActionTaken.NONE));
        verifyNoInteractions(userRepository, contentLocator, notificationService, transactionManager);
    }
}
