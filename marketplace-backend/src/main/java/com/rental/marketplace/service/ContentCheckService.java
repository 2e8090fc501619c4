package com.rental.marketplace.service;

import com.rental.marketplace.dto.ContentCheckDTO;
import com.rental.marketplace.dto.ContentCheckRequest;

public interface ContentCheckService {

    /**
     * Runs detection on stored content on demand, for moderators.
     */
    ContentCheckDTO checkContent(ContentCheckRequest request);
}
