package com.rental.marketplace.filter;

import com.rental.marketplace.enums.UserRole;
import com.rental.marketplace.exception.AuthorizationException;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * The caller as established by the upstream auth layer.
 */
@Data
@AllArgsConstructor
public class AuthenticatedActor {

    public static final String REQUEST_ATTRIBUTE = "authenticatedActor";

    private Long userId;
    private UserRole role;

    public boolean isAdmin() {
        return role == UserRole.ADMIN;
    }

    public void requireAdmin() {
        if (!isAdmin()) {
            throw new AuthorizationException("Admin access required");
        }
    }

    public static AuthenticatedActor user(Long userId) {
        return new AuthenticatedActor(userId, UserRole.USER);
    }

    public static AuthenticatedActor admin(Long userId) {
        return new AuthenticatedActor(userId, UserRole.ADMIN);
    }
}
