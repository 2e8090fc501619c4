package com.rental.marketplace.exception;

import org.springframework.http.HttpStatus;

/**
 * The request clashes with the current state of a report: a duplicate report, a second appeal,
 * or a status change the state machine does not allow.
 */
public class ConflictException extends RuntimeException {

    private final HttpStatus status;

    public ConflictException(String message) {
        this(message, HttpStatus.BAD_REQUEST);
    }

    public ConflictException(String message, HttpStatus status) {
        super(message);
        this.status = status;
    }

    public static ConflictException illegalTransition(Object from, Object to) {
        return new ConflictException("Cannot move report from " + from + " to " + to, HttpStatus.CONFLICT);
    }

    public HttpStatus getStatus() {
        return status;
    }
}
