package com.rental.marketplace.entity;

import com.rental.marketplace.enums.UserRole;
import com.rental.marketplace.enums.UserStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * User Entity: the fields of the platform user that spam scoring reads and enforcement writes.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "users")
public class User {

    /**
     * user_id: unique user identifier (Primary Key)
     * Maps to BIGINT, auto-increment.
     */
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "user_id")
    private Long userId;

    /**
     * name: display name
     * Maps to VARCHAR(50).
     */
    @Column(name = "name", length = 50)
    private String name;

    /**
     * email: contact address; a missing one counts toward profile risk
     * Maps to VARCHAR(120).
     */
    @Column(name = "email", length = 120)
    private String email;

    /**
     * phone: contact number; a missing one counts toward profile risk
     * Maps to VARCHAR(20).
     */
    @Column(name = "phone", length = 20)
    private String phone;

    /**
     * avatar: profile image URL
     * Maps to VARCHAR(255).
     */
    @Column(name = "avatar")
    private String avatar;

    /**
     * role: USER or ADMIN
     * Maps to VARCHAR(10) NOT NULL.
     */
    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, length = 10)
    private UserRole role = UserRole.USER;

    /**
     * status: ACTIVE, SUSPENDED or BANNED
     * Maps to VARCHAR(10) NOT NULL.
     */
    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 10)
    private UserStatus status = UserStatus.ACTIVE;

    /**
     * suspended_until: end of a temporary suspension; null for bans and active users
     * Maps to DATETIME.
     */
    @Column(name = "suspended_until")
    private LocalDateTime suspendedUntil;

    /**
     * shadow_banned: the user stays active but their content is deprioritized
     * Maps to BOOLEAN NOT NULL.
     */
    @Column(name = "shadow_banned", nullable = false)
    private boolean shadowBanned;

    /**
     * created_at: registration time, drives the account-age risk
     * Maps to DATETIME NOT NULL.
     */
    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    public boolean isSuspendedAt(LocalDateTime now) {
        return status == UserStatus.SUSPENDED && suspendedUntil != null && suspendedUntil.isAfter(now);
    }
}
