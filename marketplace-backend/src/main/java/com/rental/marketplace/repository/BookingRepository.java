package com.rental.marketplace.repository;

import com.rental.marketplace.entity.Booking;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;

@Repository
public interface BookingRepository extends JpaRepository<Booking, Long> {

    // bookings made by the guest since the given time (frequency signal)
    long countByUserIdAndCreatedAtGreaterThanEqual(Long userId, LocalDateTime since);
}
