package com.rental.marketplace.entity;

import com.rental.marketplace.enums.BookingStatus;
import com.rental.marketplace.enums.ContentType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Booking Entity: a guest's booking request, reduced to its free-text parts and status.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "booking")
public class Booking implements ContentItem {

    /**
     * booking_id: booking identifier (Primary Key)
     * Maps to BIGINT, auto-increment.
     */
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "booking_id")
    private Long bookingId;

    /**
     * property_id: the listing being booked
     * Maps to BIGINT NOT NULL.
     */
    @Column(name = "property_id", nullable = false)
    private Long propertyId;

    /**
     * user_id: guest who made the booking
     * Maps to BIGINT NOT NULL.
     */
    @Column(name = "user_id", nullable = false)
    private Long userId;

    /**
     * name: guest name as typed on the form
     * Maps to VARCHAR(100).
     */
    @Column(name = "name", length = 100)
    private String name;

    /**
     * message: free text sent to the host, scanned by detection
     * Maps to VARCHAR(2000).
     */
    @Column(name = "message", length = 2000)
    private String message;

    /**
     * status: booking workflow state; PENDING_REVIEW while a moderator holds it
     * Maps to VARCHAR(20) NOT NULL.
     */
    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private BookingStatus status = BookingStatus.PENDING;

    /**
     * created_at: request time, used for frequency counts
     * Maps to DATETIME NOT NULL.
     */
    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Override
    public ContentType getContentType() {
        return ContentType.BOOKING;
    }

    @Override
    public Long getContentId() {
        return bookingId;
    }

    @Override
    public Long getAuthorId() {
        return userId;
    }

    @Override
    public Map<String, String> textFields() {
        Map<String, String> fields = new LinkedHashMap<>();
        if (name != null) fields.put("name", name);
        if (message != null) fields.put("message", message);
        return fields;
    }
}
