package com.rental.marketplace.service;

import com.rental.marketplace.config.ModerationPolicyProperties;
import com.rental.marketplace.dto.SpamStatisticsDTO;
import com.rental.marketplace.dto.TopReportedUserDTO;
import com.rental.marketplace.entity.User;
import com.rental.marketplace.enums.ReportStatus;
import com.rental.marketplace.enums.ReportType;
import com.rental.marketplace.exception.ValidationException;
import com.rental.marketplace.repository.SpamReportRepository;
import com.rental.marketplace.repository.UserRepository;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@Transactional(readOnly = true)
public class SpamStatisticsServiceImpl implements SpamStatisticsService {

    private static final String DEFAULT_PERIOD = "7d";
    private static final Map<String, Integer> PERIOD_DAYS = Map.of("1d", 1, "7d", 7, "30d", 30, "90d", 90);

    private final SpamReportRepository spamReportRepository;
    private final UserRepository userRepository;
    private final ModerationPolicyProperties properties;
    private final Clock clock;

    public SpamStatisticsServiceImpl(SpamReportRepository spamReportRepository,
                                     UserRepository userRepository,
                                     ModerationPolicyProperties properties,
                                     Clock clock) {
        this.spamReportRepository = spamReportRepository;
        this.userRepository = userRepository;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public SpamStatisticsDTO getStatistics(String period) {
        String resolved = period == null || period.isBlank() ? DEFAULT_PERIOD : period;
        Integer days = PERIOD_DAYS.get(resolved);
        if (days == null) {
            throw ValidationException.of("period", "Period must be one of 1d, 7d, 30d, 90d");
        }
        LocalDateTime since = LocalDateTime.now(clock).minusDays(days);

        // 1. totals and breakdowns
        long total = spamReportRepository.countByReportedAtGreaterThanEqual(since);

        Map<String, Long> byStatus = new LinkedHashMap<>();
        for (Object[] row : spamReportRepository.countByStatusSince(since)) {
            byStatus.put(((ReportStatus) row[0]).getValue(), ((Number) row[1]).longValue());
        }

        Map<String, Long> byType = new LinkedHashMap<>();
        for (Object[] row : spamReportRepository.countByReportTypeSince(since)) {
            byType.put(((ReportType) row[0]).getValue(), ((Number) row[1]).longValue());
        }

        Double average = spamReportRepository.averageConfidenceSince(since);

        // 2. most reported users, dropping ids with no user record
        List<Object[]> rows = spamReportRepository.findTopReportedUsers(since,
                PageRequest.of(0, properties.getTopReportedUsers()));
        List<Long> ids = rows.stream().map(row -> (Long) row[0]).collect(Collectors.toList());
        Map<Long, User> users = userRepository.findAllById(ids).stream()
                .collect(Collectors.toMap(User::getUserId, Function.identity()));

        List<TopReportedUserDTO> topUsers = new ArrayList<>();
        for (Object[] row : rows) {
            User user = users.get((Long) row[0]);
            if (user != null) {
                topUsers.add(new TopReportedUserDTO(user.getUserId(), user.getName(), user.getEmail(),
                        ((Number) row[1]).longValue()));
            }
        }

        return new SpamStatisticsDTO(resolved, total, byStatus, byType, average == null ? 0.0 : average, topUsers);
    }
}
