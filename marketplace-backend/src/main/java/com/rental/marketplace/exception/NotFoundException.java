package com.rental.marketplace.exception;

/**
 * A report, content item or user referenced by the request does not exist.
 */
public class NotFoundException extends RuntimeException {

    public NotFoundException(String message) {
        super(message);
    }
}
