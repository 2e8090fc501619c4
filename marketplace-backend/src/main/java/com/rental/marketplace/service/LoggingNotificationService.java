package com.rental.marketplace.service;

import com.rental.marketplace.entity.SpamReport;
import com.rental.marketplace.entity.User;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Records notifications in the application log until a delivery provider is wired in.
 */
@Service
public class LoggingNotificationService implements NotificationService {

    private static final Logger log = LoggerFactory.getLogger(LoggingNotificationService.class);

    @Override
    public void sendWarning(User user, SpamReport report) {
        log.info("Warning issued to user {} ({}) for report {} [{}]",
                user.getUserId(), user.getEmail(), report.getReportId(), report.getCategory().getValue());
    }

    @Override
    public void sendAppealDecision(Long userId, SpamReport report) {
        log.info("Appeal decision '{}' sent to user {} for report {}",
                report.getAppeal().getStatus().getValue(), userId, report.getReportId());
    }
}
