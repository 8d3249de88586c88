package com.ownmyhealth.phi.exception;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps the exception taxonomy to HTTP responses. Client messages are never
 * more detailed than the log entry, and crypto failures are never described.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);
    private static final Pattern PACKAGE_PATTERN = Pattern.compile("\\w+(\\.\\w+){2,}");

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(ValidationException ex) {
        Map<String, Object> body = body("VALIDATION_ERROR", sanitizeExceptionMessage(ex.getMessage()));
        body.put("violations", ex.getViolations());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadRequest(IllegalArgumentException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body("BAD_REQUEST", sanitizeExceptionMessage(ex.getMessage())));
    }

    @ExceptionHandler(AuthenticationFailedException.class)
    public ResponseEntity<Map<String, Object>> handleAuthenticationFailed(AuthenticationFailedException ex) {
        Map<String, Object> body = body("INVALID_CREDENTIALS", sanitizeExceptionMessage(ex.getMessage()));
        if (ex.getRemainingAttempts() != null) {
            body.put("remainingAttempts", ex.getRemainingAttempts());
        }
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(body);
    }

    @ExceptionHandler({TokenInvalidException.class, TokenExpiredException.class})
    public ResponseEntity<Map<String, Object>> handleToken(PhiCoreException ex) {
        log.debug("Token rejected: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(body("UNAUTHORIZED", "Invalid or expired token"));
    }

    @ExceptionHandler(EmailNotVerifiedException.class)
    public ResponseEntity<Map<String, Object>> handleEmailNotVerified(EmailNotVerifiedException ex) {
        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(body("EMAIL_NOT_VERIFIED", ex.getMessage()));
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<Map<String, Object>> handleAccessDenied(AccessDeniedException ex) {
        log.warn("Access denied: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(body("FORBIDDEN", "Access denied"));
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(NotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(body("NOT_FOUND", sanitizeExceptionMessage(ex.getMessage())));
    }

    @ExceptionHandler(AccountLockedException.class)
    public ResponseEntity<Map<String, Object>> handleLocked(AccountLockedException ex) {
        Map<String, Object> body = body("ACCOUNT_LOCKED", ex.getMessage());
        if (ex.getLockedUntil() != null) {
            body.put("lockedUntil", ex.getLockedUntil().toString());
        }
        return ResponseEntity.status(HttpStatus.LOCKED).body(body);
    }

    @ExceptionHandler(CryptoException.class)
    public ResponseEntity<Map<String, Object>> handleCrypto(CryptoException ex) {
        log.error("Cryptographic failure: {}", ex.getClass().getSimpleName());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body("INTERNAL_ERROR", "Internal server error"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnhandled(Exception ex) {
        log.error("Unhandled exception", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body("INTERNAL_ERROR", "Internal server error"));
    }

    private static Map<String, Object> body(String code, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message);
        body.put("code", code);
        body.put("timestamp", Instant.now().toString());
        return body;
    }

    static String sanitizeExceptionMessage(String message) {
        if (message == null || message.isBlank()) {
            return "Invalid request";
        }
        // File paths, class names and stack-trace fragments stay server-side.
        if (message.contains("/") || message.contains("\\")
                || message.contains("Exception") || message.contains("\tat ")
                || PACKAGE_PATTERN.matcher(message).find()
                || message.length() > 500) {
            return "Invalid request";
        }
        return message;
    }
}
