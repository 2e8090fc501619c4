package com.rental.marketplace.exception;

import com.rental.marketplace.dto.CommonResponse;
import com.rental.marketplace.dto.FieldErrorDTO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Maps exceptions to the common response envelope.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    // covers MethodArgumentNotValidException (request bodies) and @ModelAttribute query binding
    @ExceptionHandler(BindException.class)
    public ResponseEntity<CommonResponse<Void>> handleBindException(BindException ex) {
        List<FieldErrorDTO> errors = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> new FieldErrorDTO(error.getField(), error.getDefaultMessage()))
                .collect(Collectors.toList());
        log.debug("Validation failed: {}", errors);
        return ResponseEntity.badRequest().body(CommonResponse.validationFailed(errors));
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<CommonResponse<Void>> handleValidationException(ValidationException ex) {
        CommonResponse<Void> body = CommonResponse.validationFailed(ex.getErrors());
        body.setMessage(ex.getMessage());
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class, IllegalArgumentException.class})
    public ResponseEntity<CommonResponse<Void>> handleMalformedRequest(Exception ex) {
        log.debug("Malformed request: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(CommonResponse.error(400, "Malformed request"));
    }

    @ExceptionHandler(ContentRejectedException.class)
    public ResponseEntity<CommonResponse<Integer>> handleContentRejected(ContentRejectedException ex) {
        CommonResponse<Integer> body = CommonResponse.error(400, ex.getMessage());
        body.setData(ex.getSpamScore());
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<CommonResponse<Void>> handleNotFound(NotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(CommonResponse.error(404, ex.getMessage()));
    }

    @ExceptionHandler(AuthorizationException.class)
    public ResponseEntity<CommonResponse<Void>> handleForbidden(AuthorizationException ex) {
        log.warn("Access denied: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(CommonResponse.error(403, ex.getMessage()));
    }

    @ExceptionHandler(ConflictException.class)
    public ResponseEntity<CommonResponse<Void>> handleConflict(ConflictException ex) {
        HttpStatus status = ex.getStatus();
        return ResponseEntity.status(status).body(CommonResponse.error(status.value(), ex.getMessage()));
    }

    @ExceptionHandler(RateLimitExceededException.class)
    public ResponseEntity<CommonResponse<Long>> handleRateLimit(RateLimitExceededException ex) {
        CommonResponse<Long> body = CommonResponse.error(429, ex.getMessage());
        body.setData(ex.getRetryAfterSeconds());
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(ex.getRetryAfterSeconds()))
                .body(body);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<CommonResponse<Void>> handleUnexpected(Exception ex) {
        log.error("Unexpected error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(CommonResponse.error(500, "Internal server error"));
    }
}
