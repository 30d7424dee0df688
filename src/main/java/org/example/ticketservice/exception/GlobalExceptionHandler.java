package org.example.ticketservice.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Global exception handler for the ticket API.
 *
 * <p>Business exceptions carry their error code into the response body.
 * Client mistakes map to 4xx; a change that was stored but whose event could
 * not be published maps to 500 with code {@code EVENT_PUBLISH_FAILED}.</p>
 */
@Slf4j
@RestControllerAdvice
@Order(Ordered.HIGHEST_PRECEDENCE)
public class GlobalExceptionHandler {

    // ==================== SPRING MVC EXCEPTIONS ====================

    /**
     * Handles HttpMessageNotReadableException - missing or malformed request body.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleHttpMessageNotReadable(
            HttpMessageNotReadableException ex, WebRequest request) {

        log.error("❌ HTTP MESSAGE NOT READABLE - {}", ex.getMessage());

        String message = ex.getMessage() != null && ex.getMessage().contains("Required request body is missing")
                ? "Request body is required."
                : "Invalid request body. Please provide valid JSON.";

        return respond(HttpStatus.BAD_REQUEST, "Bad Request", null, message, request);
    }

    /**
     * Handles MethodArgumentNotValidException - thrown when @Valid validation fails.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleMethodArgumentNotValid(
            MethodArgumentNotValidException ex, WebRequest request) {

        log.error("❌ VALIDATION FAILED - {}", ex.getMessage());

        Map<String, String> fieldErrors = new LinkedHashMap<>();
        ex.getBindingResult().getAllErrors().forEach(error -> {
            String fieldName = error instanceof FieldError
                    ? ((FieldError) error).getField()
                    : error.getObjectName();
            fieldErrors.putIfAbsent(fieldName, error.getDefaultMessage());
        });

        String message = "Validation failed: " + fieldErrors.entrySet().stream()
                .map(e -> e.getKey() + " - " + e.getValue())
                .collect(Collectors.joining("; "));

        return respond(HttpStatus.BAD_REQUEST, "Validation Error", "INVALID_DATA", message, request);
    }

    /**
     * Handles MethodArgumentTypeMismatchException - thrown when path or query conversion fails.
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleMethodArgumentTypeMismatch(
            MethodArgumentTypeMismatchException ex, WebRequest request) {

        log.error("❌ TYPE MISMATCH - {}", ex.getMessage());

        String message = String.format("Parameter '%s' should be of type '%s' but received '%s'",
                ex.getName(),
                ex.getRequiredType() != null ? ex.getRequiredType().getSimpleName() : "unknown",
                ex.getValue());

        return respond(HttpStatus.BAD_REQUEST, "Type Mismatch", null, message, request);
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleHttpMediaTypeNotSupported(
            HttpMediaTypeNotSupportedException ex, WebRequest request) {

        log.error("❌ UNSUPPORTED MEDIA TYPE - {}", ex.getMessage());

        String message = String.format("Content type '%s' is not supported. Supported types: %s",
                ex.getContentType(), ex.getSupportedMediaTypes());

        return respond(HttpStatus.UNSUPPORTED_MEDIA_TYPE, "Unsupported Media Type", null, message, request);
    }

    /**
     * Handles HttpRequestMethodNotSupportedException. Tickets cannot be replaced
     * or deleted over HTTP, so PUT and DELETE land here.
     */
    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleHttpRequestMethodNotSupported(
            HttpRequestMethodNotSupportedException ex, WebRequest request) {

        log.error("❌ METHOD NOT ALLOWED - {}", ex.getMessage());

        String message = String.format("HTTP method '%s' is not supported for this endpoint. Supported methods: %s",
                ex.getMethod(), ex.getSupportedHttpMethods());

        return respond(HttpStatus.METHOD_NOT_ALLOWED, "Method Not Allowed", null, message, request);
    }

    // ==================== BUSINESS EXCEPTIONS ====================

    @ExceptionHandler(TicketNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleTicketNotFound(
            TicketNotFoundException ex, WebRequest request) {

        log.warn("⚠️ TICKET NOT FOUND - {}", ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, "Ticket Not Found", ex.getErrorCode(), ex.getMessage(), request);
    }

    @ExceptionHandler(PermissionDeniedException.class)
    public ResponseEntity<ErrorResponse> handlePermissionDenied(
            PermissionDeniedException ex, WebRequest request) {

        log.warn("⚠️ PERMISSION DENIED - {}", ex.getMessage());
        return respond(HttpStatus.FORBIDDEN, "Forbidden", ex.getErrorCode(), ex.getMessage(), request);
    }

    /**
     * Handles closed-ticket and transition violations.
     */
    @ExceptionHandler(InvalidTicketOperationException.class)
    public ResponseEntity<ErrorResponse> handleInvalidOperation(
            InvalidTicketOperationException ex, WebRequest request) {

        log.error("❌ INVALID OPERATION - {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Operation", ex.getErrorCode(), ex.getMessage(), request);
    }

    @ExceptionHandler(InvalidTicketDataException.class)
    public ResponseEntity<ErrorResponse> handleInvalidData(
            InvalidTicketDataException ex, WebRequest request) {

        log.error("❌ INVALID DATA - {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Data", ex.getErrorCode(), ex.getMessage(), request);
    }

    @ExceptionHandler(UnknownTicketStateException.class)
    public ResponseEntity<ErrorResponse> handleUnknownState(
            UnknownTicketStateException ex, WebRequest request) {

        log.error("❌ UNKNOWN STATE - {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Unknown State", ex.getErrorCode(), ex.getMessage(), request);
    }

    /**
     * The change is stored; only its notification failed.
     */
    @ExceptionHandler(EventPublishException.class)
    public ResponseEntity<ErrorResponse> handleEventPublish(
            EventPublishException ex, WebRequest request) {

        log.error("💥 EVENT PUBLISH FAILED - {}", ex.getDetailedDescription());
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Event Publish Failed", ex.getErrorCode(),
                "The change was saved but its event could not be published.", request);
    }

    // ==================== SYSTEM EXCEPTIONS ====================

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> handleDataAccess(
            DataAccessException ex, WebRequest request) {

        log.error("💥 DATA ACCESS FAILURE - {}", ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Storage Error", "STORAGE_FAILURE",
                "The ticket store is unavailable. Please try again later.", request);
    }

    /**
     * Handles all other exceptions as a fallback.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleAllExceptions(
            Exception ex, WebRequest request) {

        log.error("💥 UNHANDLED EXCEPTION - {}", ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", null,
                "An unexpected error occurred. Please try again later.", request);
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, String errorCode,
                                                  String message, WebRequest request) {
        ErrorResponse body = new ErrorResponse(
                LocalDateTime.now(),
                status.value(),
                error,
                errorCode,
                message,
                request.getDescription(false)
        );
        return new ResponseEntity<>(body, status);
    }
}
