package com.rental.marketplace.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local request log. Keeps at most the last {@value #MAX_ENTRIES_PER_KEY} timestamps per key;
 * a multi-instance deployment needs a shared implementation.
 */
@Component
public class InMemoryRateTracker implements RateTracker {

    private static final Logger log = LoggerFactory.getLogger(InMemoryRateTracker.class);

    static final int MAX_ENTRIES_PER_KEY = 100;
    private static final Duration RETENTION = Duration.ofHours(1);

    private final Map<String, Deque<Instant>> requests = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryRateTracker(Clock clock) {
        this.clock = clock;
    }

    /**
     * Deques are only touched inside {@code compute} calls, so a purge can never drop a deque
     * that a concurrent request is recording into.
     */
    @Override
    public int recordAndCount(String key, Duration window) {
        Instant now = clock.instant();
        Instant since = now.minus(window);
        int[] count = new int[1];
        requests.compute(key, (k, timestamps) -> {
            Deque<Instant> deque = timestamps == null ? new ArrayDeque<>() : timestamps;
            deque.addLast(now);
            while (deque.size() > MAX_ENTRIES_PER_KEY) {
                deque.removeFirst();
            }
            for (Instant timestamp : deque) {
                if (!timestamp.isBefore(since)) {
                    count[0]++;
                }
            }
            return deque;
        });
        return count[0];
    }

    @Scheduled(fixedRate = 3600000)
    public void purgeExpired() {
        Instant cutoff = clock.instant().minus(RETENTION);
        int before = requests.size();
        for (String key : requests.keySet()) {
            requests.computeIfPresent(key, (k, timestamps) -> {
                timestamps.removeIf(timestamp -> timestamp.isBefore(cutoff));
                return timestamps.isEmpty() ? null : timestamps;
            });
        }
        if (before != requests.size()) {
            log.info("Rate tracker purge: {} keys removed, {} remaining", before - requests.size(), requests.size());
        }
    }

    int trackedKeys() {
        return requests.size();
    }
}
