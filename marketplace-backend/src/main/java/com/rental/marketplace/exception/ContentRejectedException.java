package com.rental.marketplace.exception;

/**
 * Thrown by content-mutation flows when the submission gate refuses the content.
 */
public class ContentRejectedException extends RuntimeException {

    private final int spamScore;

    public ContentRejectedException(String message, int spamScore) {
        super(message);
        this.spamScore = spamScore;
    }

    public int getSpamScore() {
        return spamScore;
    }
}
