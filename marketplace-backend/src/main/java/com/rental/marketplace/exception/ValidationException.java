package com.rental.marketplace.exception;

import com.rental.marketplace.dto.FieldErrorDTO;

import java.util.List;

/**
 * Malformed input detected outside bean validation. Carries every field error found.
 */
public class ValidationException extends RuntimeException {

    private final List<FieldErrorDTO> errors;

    public ValidationException(String message, List<FieldErrorDTO> errors) {
        super(message);
        this.errors = List.copyOf(errors);
    }

    public static ValidationException of(String field, String message) {
        return new ValidationException(message, List.of(new FieldErrorDTO(field, message)));
    }

    public List<FieldErrorDTO> getErrors() {
        return errors;
    }
}
