package com.rental.marketplace.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Daily sweep that surfaces the backlog of pending reports nobody has looked at for a week.
 */
@Component
public class StaleReportMonitor {

    private static final Logger log = LoggerFactory.getLogger(StaleReportMonitor.class);

    private final SpamReportService spamReportService;

    public StaleReportMonitor(SpamReportService spamReportService) {
        this.spamReportService = spamReportService;
    }

    @Scheduled(cron = "${spam.moderation.stale-sweep-cron:0 0 4 * * *}")
    public void sweep() {
        long stale = spamReportService.countStaleReports();
        if (stale > 0) {
            log.warn("{} spam reports have been pending for more than 7 days", stale);
        } else {
            log.info("Stale report sweep: no stale reports");
        }
    }
}
