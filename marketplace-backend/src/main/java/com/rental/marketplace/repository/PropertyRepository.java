package com.rental.marketplace.repository;

import com.rental.marketplace.entity.Property;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;

@Repository
public interface PropertyRepository extends JpaRepository<Property, Long> {

    // listings posted by the owner since the given time (frequency signal)
    long countByOwnerIdAndCreatedAtGreaterThanEqual(Long ownerId, LocalDateTime since);
}
