package com.rental.marketplace.service;

import java.time.Duration;

/**
 * Counts recent requests per key for the adaptive submission limit.
 */
public interface RateTracker {

    /**
     * Records a request under the key now and returns how many requests the key has within the
     * trailing window, this one included.
     */
    int recordAndCount(String key, Duration window);
}
