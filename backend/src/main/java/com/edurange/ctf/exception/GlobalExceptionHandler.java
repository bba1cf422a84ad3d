package com.edurange.ctf.exception;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(ResourceNotFoundException ex, HttpServletRequest request) {
        log.warn("[404 NOT_FOUND] {} {} - {}", request.getMethod(), request.getRequestURI(), ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, ex.getMessage(), request);
    }

    @ExceptionHandler(CodeNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleCodeNotFound(CodeNotFoundException ex, HttpServletRequest request) {
        log.warn("[404 CODE_NOT_FOUND] {} {} - {}", request.getMethod(), request.getRequestURI(), ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, "Invalid access code", request);
    }

    @ExceptionHandler(CodeExpiredException.class)
    public ResponseEntity<ErrorResponse> handleCodeExpired(CodeExpiredException ex, HttpServletRequest request) {
        log.warn("[410 CODE_EXPIRED] {} {} - {}", request.getMethod(), request.getRequestURI(), ex.getMessage());
        return respond(HttpStatus.GONE, "Access code has expired", request);
    }

    @ExceptionHandler(CodeAlreadyConsumedException.class)
    public ResponseEntity<ErrorResponse> handleCodeConsumed(CodeAlreadyConsumedException ex,
            HttpServletRequest request) {
        log.warn("[409 CODE_CONSUMED] {} {} - {}", request.getMethod(), request.getRequestURI(), ex.getMessage());
        return respond(HttpStatus.CONFLICT, ex.getMessage(), request);
    }

    @ExceptionHandler(DuplicateCompletionException.class)
    public ResponseEntity<ErrorResponse> handleDuplicateCompletion(DuplicateCompletionException ex,
            HttpServletRequest request) {
        log.warn("[409 DUPLICATE_COMPLETION] {} {} - {}", request.getMethod(), request.getRequestURI(),
                ex.getMessage());
        return respond(HttpStatus.CONFLICT, ex.getMessage(), request);
    }

    @ExceptionHandler(UnauthorizedAccessException.class)
    public ResponseEntity<ErrorResponse> handleUnauthorized(UnauthorizedAccessException ex,
            HttpServletRequest request) {
        log.warn("[403 FORBIDDEN] {} {} - {}", request.getMethod(), request.getRequestURI(), ex.getMessage());
        return respond(HttpStatus.FORBIDDEN, ex.getMessage(), request);
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<ErrorResponse> handleAccessDenied(AccessDeniedException ex, HttpServletRequest request) {
        log.warn("[403 ACCESS_DENIED] {} {} - {}", request.getMethod(), request.getRequestURI(), ex.getMessage());
        return respond(HttpStatus.FORBIDDEN, "Access denied", request);
    }

    @ExceptionHandler(RateLimitExceededException.class)
    public ResponseEntity<ErrorResponse> handleRateLimit(RateLimitExceededException ex, HttpServletRequest request) {
        log.warn("[429 TOO_MANY_REQUESTS] {} {} - {}", request.getMethod(), request.getRequestURI(),
                ex.getMessage());
        return respond(HttpStatus.TOO_MANY_REQUESTS, ex.getMessage(), request);
    }

    @ExceptionHandler(ProvisionFailedException.class)
    public ResponseEntity<ErrorResponse> handleProvisionFailed(ProvisionFailedException ex,
            HttpServletRequest request) {
        log.error("[502 PROVISION_FAILED] {} {} - {} (backendStatus={}, backendBody={})", request.getMethod(),
                request.getRequestURI(), ex.getMessage(), ex.getBackendStatus(), ex.getBackendBody());
        return respond(HttpStatus.BAD_GATEWAY, ex.getMessage(), request);
    }

    @ExceptionHandler(InternalInconsistencyException.class)
    public ResponseEntity<ErrorResponse> handleInconsistency(InternalInconsistencyException ex,
            HttpServletRequest request) {
        log.error("[500 INTERNAL_INCONSISTENCY] {} {} - {}", request.getMethod(), request.getRequestURI(),
                ex.getMessage());
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal inconsistency detected", request);
    }

    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ErrorResponse> handleBusiness(BusinessException ex, HttpServletRequest request) {
        log.warn("[400 BAD_REQUEST] {} {} - {}", request.getMethod(), request.getRequestURI(), ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex.getMessage(), request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex,
            HttpServletRequest request) {
        Map<String, String> errors = new HashMap<>();
        ex.getBindingResult().getAllErrors().forEach(error -> {
            String fieldName = ((FieldError) error).getField();
            errors.put(fieldName, error.getDefaultMessage());
        });
        log.warn("[400 VALIDATION] {} {} - fields: {}", request.getMethod(), request.getRequestURI(), errors);
        return respond(HttpStatus.BAD_REQUEST, "Validation failed: " + errors, request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneral(Exception ex, HttpServletRequest request) {
        log.error("[500 INTERNAL_ERROR] {} {} - {}", request.getMethod(), request.getRequestURI(), ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error", request);
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String message, HttpServletRequest request) {
        return ResponseEntity.status(status)
                .body(new ErrorResponse(status.value(), message, request.getRequestURI()));
    }

    public record ErrorResponse(int status, String message, String path, Instant timestamp) {
        public ErrorResponse(int status, String message, String path) {
            this(status, message, path, Instant.now());
        }
    }
}
