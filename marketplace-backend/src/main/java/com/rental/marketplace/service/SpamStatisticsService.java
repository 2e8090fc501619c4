package com.rental.marketplace.service;

import com.rental.marketplace.dto.SpamStatisticsDTO;

public interface SpamStatisticsService {

    /**
     * @param period one of 1d, 7d, 30d, 90d; null means 7d
     */
    SpamStatisticsDTO getStatistics(String period);
}
