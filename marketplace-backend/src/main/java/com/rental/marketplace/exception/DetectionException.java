package com.rental.marketplace.exception;

import com.rental.marketplace.enums.SignalCategory;

/**
 * Internal scoring failure. Never leaves the detection service: it is logged and the
 * affected signal (or the whole run) degrades to a clean result.
 */
public class DetectionException extends RuntimeException {

    public DetectionException(String message, Throwable cause) {
        super(message, cause);
    }

    public static DetectionException signalFailed(SignalCategory category, Throwable cause) {
        return new DetectionException(category + " signal failed: " + cause.getMessage(), cause);
    }
}
