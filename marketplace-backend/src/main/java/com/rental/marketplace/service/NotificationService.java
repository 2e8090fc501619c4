package com.rental.marketplace.service;

import com.rental.marketplace.entity.SpamReport;
import com.rental.marketplace.entity.User;

/**
 * Outbound messages to users about moderation outcomes. Delivery (email, SMS, push) lives
 * behind this interface.
 */
public interface NotificationService {

    void sendWarning(User user, SpamReport report);

    void sendAppealDecision(Long userId, SpamReport report);
}
