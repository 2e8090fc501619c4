package com.rental.marketplace.service;

import com.rental.marketplace.entity.Booking;
import com.rental.marketplace.entity.ContentItem;
import com.rental.marketplace.entity.Property;
import com.rental.marketplace.enums.BookingStatus;
import com.rental.marketplace.enums.ContentType;
import com.rental.marketplace.enums.PropertyStatus;
import com.rental.marketplace.repository.BookingRepository;
import com.rental.marketplace.repository.PropertyRepository;
import com.rental.marketplace.repository.UserRepository;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Single access point to the content stores moderation reads from and writes to.
 */
@Component
public class ContentLocator {

    private final PropertyRepository propertyRepository;
    private final BookingRepository bookingRepository;
    private final UserRepository userRepository;

    public ContentLocator(PropertyRepository propertyRepository, BookingRepository bookingRepository,
                          UserRepository userRepository) {
        this.propertyRepository = propertyRepository;
        this.bookingRepository = bookingRepository;
        this.userRepository = userRepository;
    }

    public Optional<ContentItem> find(ContentType type, Long id) {
        if (id == null) {
            return Optional.empty();
        }
        switch (type) {
            case PROPERTY:
                return propertyRepository.findById(id).map(ContentItem.class::cast);
            case BOOKING:
                return bookingRepository.findById(id).map(ContentItem.class::cast);
            default:
                return Optional.empty();
        }
    }

    /**
     * The user a report on this content is filed against: the listing owner, the guest of a
     * booking, or the user themself.
     */
    public Optional<Long> findResponsibleUser(ContentType type, Long id) {
        if (type == ContentType.USER) {
            return id == null ? Optional.empty() : userRepository.findById(id).map(user -> user.getUserId());
        }
        return find(type, id).map(ContentItem::getAuthorId);
    }

    /**
     * Takes the content down: listings are marked removed, bookings cancelled.
     *
     * @return false if there was nothing to remove
     */
    public boolean remove(ContentType type, Long id) {
        if (id == null) {
            return false;
        }
        if (type == ContentType.PROPERTY) {
            Optional<Property> property = propertyRepository.findById(id);
            property.ifPresent(p -> {
                p.setStatus(PropertyStatus.REMOVED);
                propertyRepository.save(p);
            });
            return property.isPresent();
        }
        if (type == ContentType.BOOKING) {
            Optional<Booking> booking = bookingRepository.findById(id);
            booking.ifPresent(b -> {
                b.setStatus(BookingStatus.CANCELLED);
                bookingRepository.save(b);
            });
            return booking.isPresent();
        }
        return false;
    }

    public void flagForReview(ContentItem item) {
        if (item instanceof Property) {
            Property property = (Property) item;
            property.setRequiresReview(true);
            property.setStatus(PropertyStatus.PENDING_REVIEW);
            propertyRepository.save(property);
        } else if (item instanceof Booking) {
            Booking booking = (Booking) item;
            booking.setStatus(BookingStatus.PENDING_REVIEW);
            bookingRepository.save(booking);
        }
    }
}
