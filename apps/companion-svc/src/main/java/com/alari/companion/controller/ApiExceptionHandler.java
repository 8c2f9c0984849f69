package com.alari.companion.controller;

import com.alari.companion.controller.dto.ErrorResponseDto;
import com.alari.companion.inference.UpstreamProtocolException;
import com.alari.companion.inference.UpstreamTimeoutException;
import com.alari.companion.inference.UpstreamUnavailableException;
import com.alari.companion.security.AuthException;
import com.alari.companion.security.RequestContextHolder;
import com.alari.companion.security.ResourceNotFoundException;
import jakarta.validation.ConstraintViolationException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.validation.FieldError;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponseDto> handleIllegalArgument(IllegalArgumentException ex) {
        return build(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", ex.getMessage(), Map.of());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponseDto> handleInvalidBody(MethodArgumentNotValidException ex) {
        Map<String, Object> fields = new LinkedHashMap<>();
        for (FieldError error : ex.getBindingResult().getFieldErrors()) {
            fields.putIfAbsent(error.getField(), error.getDefaultMessage());
        }
        return build(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "Request validation failed", Map.of("fields", fields));
    }

    @ExceptionHandler({ConstraintViolationException.class, HandlerMethodValidationException.class})
    public ResponseEntity<ErrorResponseDto> handleValidation(Exception ex) {
        return build(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "Request validation failed", Map.of("reason", String.valueOf(ex.getMessage())));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponseDto> handleUnreadable(Exception ex) {
        return build(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", "Malformed request", Map.of("reason", String.valueOf(ex.getMessage())));
    }

    @ExceptionHandler(AuthException.class)
    public ResponseEntity<ErrorResponseDto> handleAuth(AuthException ex) {
        log.warn("Auth failure code={} msg={}", ex.getReason(), ex.getMessage());
        ErrorResponseDto body = body(ex.getReason().name(), ex.getMessage(), Map.of());
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .header(HttpHeaders.WWW_AUTHENTICATE, "Bearer")
                .body(body);
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponseDto> handleNotFound(ResourceNotFoundException ex) {
        return build(HttpStatus.NOT_FOUND, "NOT_FOUND", ex.getMessage(), Map.of());
    }

    // --- Upstream (inference service) mapping ---
    @ExceptionHandler(UpstreamTimeoutException.class)
    public ResponseEntity<ErrorResponseDto> handleUpstreamTimeout(UpstreamTimeoutException ex) {
        return build(HttpStatus.GATEWAY_TIMEOUT, "UPSTREAM_TIMEOUT", ex.getMessage(), Map.of());
    }

    @ExceptionHandler(UpstreamUnavailableException.class)
    public ResponseEntity<ErrorResponseDto> handleUpstreamUnavailable(UpstreamUnavailableException ex) {
        return build(HttpStatus.SERVICE_UNAVAILABLE, "UPSTREAM_UNAVAILABLE", ex.getMessage(), Map.of());
    }

    @ExceptionHandler(UpstreamProtocolException.class)
    public ResponseEntity<ErrorResponseDto> handleUpstreamProtocol(UpstreamProtocolException ex) {
        return build(HttpStatus.SERVICE_UNAVAILABLE, "UPSTREAM_PROTOCOL_ERROR", ex.getMessage(), Map.of());
    }

    @ExceptionHandler({CannotGetJdbcConnectionException.class, DataAccessResourceFailureException.class,
            CannotCreateTransactionException.class})
    public ResponseEntity<ErrorResponseDto> handleDatabaseDown(Exception ex) {
        log.error("Database unavailable: {}", ex.getMessage());
        return build(HttpStatus.SERVICE_UNAVAILABLE, "DB_UNAVAILABLE", "Database temporarily unavailable", Map.of());
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponseDto> handleStorage(DataAccessException ex) {
        log.error("Storage failure", ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "STORAGE_ERROR", "Storage operation failed", Map.of());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponseDto> handleGeneral(Exception ex) {
        if (ex instanceof ErrorResponse errorResponse) {
            // framework-level rejections (405, 406, 415, unknown path) keep their own status
            HttpStatusCode status = errorResponse.getStatusCode();
            return build(status, "REQUEST_REJECTED", ex.getMessage(), Map.of());
        }
        log.error("Unhandled error", ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Unexpected error", Map.of());
    }

    private ResponseEntity<ErrorResponseDto> build(HttpStatusCode status, String code, String message, Map<String, Object> details) {
        return ResponseEntity.status(status).body(body(code, message, details));
    }

    private ErrorResponseDto body(String code, String message, Map<String, Object> details) {
        String traceId = RequestContextHolder.get().map(RequestContextHolder.RequestContext::traceId).orElse(null);
        return new ErrorResponseDto(code, message, details, traceId);
    }
}
