package com.rental.marketplace.entity;

import com.rental.marketplace.enums.ContentType;
import com.rental.marketplace.enums.PropertyStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Property Entity: a rental listing. Only the columns moderation touches are mapped here;
 * pricing, media and availability belong to the listing service.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "property")
public class Property implements ContentItem {

    /**
     * property_id: listing identifier (Primary Key)
     * Maps to BIGINT, auto-increment.
     */
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "property_id")
    private Long propertyId;

    /**
     * title: listing headline, scanned by detection
     * Maps to VARCHAR(200) NOT NULL.
     */
    @Column(name = "title", nullable = false, length = 200)
    private String title;

    /**
     * description: listing body, scanned by detection
     * Maps to VARCHAR(5000).
     */
    @Column(name = "description", length = 5000)
    private String description;

    /**
     * owner_id: the host who posted the listing
     * Maps to BIGINT NOT NULL.
     */
    @Column(name = "owner_id", nullable = false)
    private Long ownerId;

    /**
     * status: ACTIVE, PENDING_REVIEW or REMOVED
     * Maps to VARCHAR(20) NOT NULL.
     */
    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private PropertyStatus status = PropertyStatus.ACTIVE;

    /**
     * requires_review: set when the submission gate routes the listing to a moderator
     * Maps to BOOLEAN NOT NULL.
     */
    @Column(name = "requires_review", nullable = false)
    private boolean requiresReview;

    /**
     * created_at: posting time, used for frequency counts
     * Maps to DATETIME NOT NULL.
     */
    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Override
    public ContentType getContentType() {
        return ContentType.PROPERTY;
    }

    @Override
    public Long getContentId() {
        return propertyId;
    }

    @Override
    public Long getAuthorId() {
        return ownerId;
    }

    @Override
    public Map<String, String> textFields() {
        Map<String, String> fields = new LinkedHashMap<>();
        if (title != null) fields.put("title", title);
        if (description != null) fields.put("description", description);
        return fields;
    }
}
