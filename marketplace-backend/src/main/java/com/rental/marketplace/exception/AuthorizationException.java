package com.rental.marketplace.exception;

/**
 * The authenticated actor has the wrong role or does not own the resource.
 */
public class AuthorizationException extends RuntimeException {

    public AuthorizationException(String message) {
        super(message);
    }
}
