package com.rental.marketplace.entity;

import com.rental.marketplace.enums.ContentType;

import java.util.Map;

/**
 * Read view of user-submitted content, shared by persisted listings/bookings and by drafts
 * that are screened before they are saved.
 */
public interface ContentItem {

    ContentType getContentType();

    /**
     * Null while the content has not been persisted yet.
     */
    Long getContentId();

    Long getAuthorId();

    /**
     * Free-text fields by name, in a stable order. Absent fields are simply missing.
     */
    Map<String, String> textFields();
}
