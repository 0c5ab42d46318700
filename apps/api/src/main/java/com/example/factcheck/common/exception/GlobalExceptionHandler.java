package com.example.factcheck.common.exception;

import com.example.factcheck.exception.ApiException;
import com.example.factcheck.permissions.exception.PermissionsException;
import com.example.factcheck.user.exception.UserNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebInputException;

import java.time.Instant;
import java.util.Map;

/**
 * Global exception handler for REST controllers.
 *
 * <p>Every quota denial becomes a single "forbidden" error carrying the reason,
 * so clients can tell a missing user apart from a refused action.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger LOG = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final int MAX_LOG_MESSAGE_LENGTH = 200;

    /**
     * Handles actions refused by the permissions service.
     *
     * @param ex the exception
     * @return error response with the denial reason
     */
    @ExceptionHandler(PermissionsException.class)
    @NonNull
    public ResponseEntity<Map<String, Object>> handlePermissions(@NonNull PermissionsException ex) {
        LOG.debug("Permission denied: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.FORBIDDEN)
                .body(Map.of(
                        "error", "forbidden",
                        "message", ex.getMessage(),
                        "timestamp", Instant.now().toString()
                ));
    }

    /**
     * Handles unknown users.
     *
     * @param ex the exception
     * @return error response
     */
    @ExceptionHandler(UserNotFoundException.class)
    @NonNull
    public ResponseEntity<Map<String, Object>> handleUserNotFound(@NonNull UserNotFoundException ex) {
        LOG.debug("User not found: {}", ex.getUserId());
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(Map.of(
                        "error", "not_found",
                        "message", "User not found",
                        "timestamp", Instant.now().toString()
                ));
    }

    /**
     * Handles failures of downstream services.
     *
     * @param ex the exception
     * @return error response
     */
    @ExceptionHandler(ApiException.class)
    @NonNull
    public ResponseEntity<Map<String, Object>> handleApiException(@NonNull ApiException ex) {
        LOG.error("{} error: {}", ex.getServiceName(), sanitizeForLog(ex.getMessage()));
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(Map.of(
                        "error", "service_unavailable",
                        "message", "A required service is unavailable. Please try again later.",
                        "timestamp", Instant.now().toString()
                ));
    }

    /**
     * Handles malformed path variables or request bodies.
     *
     * @param ex the exception
     * @return error response
     */
    @ExceptionHandler(ServerWebInputException.class)
    @NonNull
    public ResponseEntity<Map<String, Object>> handleInputException(@NonNull ServerWebInputException ex) {
        LOG.warn("Input error: {}", sanitizeForLog(ex.getMessage()));
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(Map.of(
                        "error", "invalid_request",
                        "message", "Invalid request format",
                        "timestamp", Instant.now().toString()
                ));
    }

    /**
     * Handles illegal arguments such as non-positive IDs.
     *
     * @param ex the exception
     * @return error response
     */
    @ExceptionHandler(IllegalArgumentException.class)
    @NonNull
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(@NonNull IllegalArgumentException ex) {
        LOG.warn("Illegal argument: {}", sanitizeForLog(ex.getMessage()));
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(Map.of(
                        "error", "invalid_argument",
                        "message", "Invalid request parameter",
                        "timestamp", Instant.now().toString()
                ));
    }

    /**
     * Handles all unhandled exceptions.
     *
     * @param ex the exception
     * @return generic error response
     */
    @ExceptionHandler(Exception.class)
    @NonNull
    public ResponseEntity<Map<String, Object>> handleGeneral(@NonNull Exception ex) {
        LOG.error("Unhandled exception: {}", sanitizeForLog(ex.getMessage()), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of(
                        "error", "internal_error",
                        "message", "An unexpected error occurred",
                        "timestamp", Instant.now().toString()
                ));
    }

    @NonNull
    private String sanitizeForLog(@Nullable String value) {
        if (value == null) {
            return "null";
        }
        String sanitized = value
                .replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t");

        if (sanitized.length() > MAX_LOG_MESSAGE_LENGTH) {
            return sanitized.substring(0, MAX_LOG_MESSAGE_LENGTH) + "...";
        }
        return sanitized;
    }
}
