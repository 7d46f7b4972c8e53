package com.heronix.callgate.controller.api;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import com.heronix.callgate.exception.ProtocolError;
import com.heronix.callgate.exception.ProtocolException;
import com.heronix.callgate.model.dto.ErrorResponse;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;

/**
 * Maps protocol failures to HTTP responses carrying the failure code.
 *
 * Caller errors become 400 (403 when the caller lacks the required role), state errors
 * 409 and collaborator errors 502.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    private static final Set<ProtocolError> ROLE_ERRORS = EnumSet.of(
            ProtocolError.NOT_SECURITY_ADMIN,
            ProtocolError.NOT_PENDING_ADMIN,
            ProtocolError.NOT_ROUTER,
            ProtocolError.NOT_PROTOCOL_ADMIN,
            ProtocolError.NOT_SELF);

    @ExceptionHandler(ProtocolException.class)
    public ResponseEntity<ErrorResponse> handleProtocolException(ProtocolException ex, HttpServletRequest request) {
        HttpStatus status = statusFor(ex.getError());

        if (status.is5xxServerError()) {
            log.error("API: {} on {}: {}", ex.getCode(), request.getRequestURI(), ex.getMessage(), ex);
        } else {
            log.warn("API: {} on {}: {}", ex.getCode(), request.getRequestURI(), ex.getMessage());
        }

        return build(status, ex.getCode(), ex.getMessage(), request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationErrors(
            MethodArgumentNotValidException ex, HttpServletRequest request) {

        String message = ex.getBindingResult().getAllErrors().stream()
                .map(error -> error instanceof FieldError fieldError
                        ? fieldError.getField() + ": " + error.getDefaultMessage()
                        : error.getDefaultMessage())
                .collect(Collectors.joining("; "));

        log.warn("API: Validation failed on {}: {}", request.getRequestURI(), message);
        return build(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", message, request);
    }

    /**
     * Malformed addresses, selectors and status names.
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex, HttpServletRequest request) {
        log.warn("API: Bad request on {}: {}", request.getRequestURI(), ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", ex.getMessage(), request);
    }

    static HttpStatus statusFor(ProtocolError error) {
        return switch (error.getCategory()) {
            case CALLER -> ROLE_ERRORS.contains(error) ? HttpStatus.FORBIDDEN : HttpStatus.BAD_REQUEST;
            case STATE -> HttpStatus.CONFLICT;
            case COLLABORATOR -> HttpStatus.BAD_GATEWAY;
        };
    }

    private ResponseEntity<ErrorResponse> build(HttpStatus status, String code, String message,
                                                HttpServletRequest request) {
        ErrorResponse body = ErrorResponse.builder()
                .timestamp(Instant.now())
                .status(status.value())
                .code(code)
                .message(message)
                .path(request.getRequestURI())
                .build();
        return ResponseEntity.status(status).body(body);
    }
}
