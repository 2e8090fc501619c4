package com.rental.marketplace.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Envelope for every API response: {@code {success, code, message, data?, errors?, timestamp}}.
 *
 * @param <T> payload type
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CommonResponse<T> implements Serializable {

    private Boolean success;

    // HTTP status mirrored into the body: 200, 201, 400, 401, 403, 404, 409, 429, 500
    private Integer code;

    private String message;

    private T data;

    // field-level validation errors, all of them
    private List<FieldErrorDTO> errors;

    // epoch millis
    private Long timestamp;

    public static <T> CommonResponse<T> success(T data) {
        return success("Request successful", data);
    }

    public static <T> CommonResponse<T> success(String message, T data) {
        return new CommonResponse<>(true, 200, message, data, null, Instant.now().toEpochMilli());
    }

    public static <T> CommonResponse<T> created(String message, T data) {
        return new CommonResponse<>(true, 201, message, data, null, Instant.now().toEpochMilli());
    }

    public static <T> CommonResponse<T> error(Integer code, String message) {
        return new CommonResponse<>(false, code, message, null, null, Instant.now().toEpochMilli());
    }

    public static <T> CommonResponse<T> validationFailed(List<FieldErrorDTO> errors) {
        return new CommonResponse<>(false, 400, "Validation failed", null, errors, Instant.now().toEpochMilli());
    }
}
