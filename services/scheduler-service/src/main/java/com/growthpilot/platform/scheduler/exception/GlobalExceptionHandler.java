package com.growthpilot.platform.scheduler.exception;

import com.growthpilot.platform.scheduler.client.PlatformClientException;
import com.growthpilot.platform.scheduler.dto.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.ServletWebRequest;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.OffsetDateTime;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(ResourceNotFoundException ex, WebRequest request) {
        return build(HttpStatus.NOT_FOUND, "NOT_FOUND", ex.getMessage(), request);
    }

    @ExceptionHandler(ForbiddenOperationException.class)
    public ResponseEntity<ErrorResponse> handleForbidden(ForbiddenOperationException ex, WebRequest request) {
        log.warn("Forbidden operation: {}", ex.getMessage());
        return build(HttpStatus.FORBIDDEN, "FORBIDDEN", ex.getMessage(), request);
    }

    @ExceptionHandler(IllegalStateTransitionException.class)
    public ResponseEntity<ErrorResponse> handleTransition(IllegalStateTransitionException ex, WebRequest request) {
        return build(HttpStatus.CONFLICT, "ILLEGAL_STATE_TRANSITION", ex.getMessage(), request);
    }

    @ExceptionHandler(OptimisticLockingFailureException.class)
    public ResponseEntity<ErrorResponse> handleConcurrentUpdate(OptimisticLockingFailureException ex, WebRequest request) {
        log.warn("Concurrent update on {}: {}", describe(request), ex.getMessage());
        return build(HttpStatus.CONFLICT, "CONCURRENT_UPDATE", "The resource was modified concurrently, retry the request", request);
    }

    @ExceptionHandler(QuotaExhaustedException.class)
    public ResponseEntity<ErrorResponse> handleQuota(QuotaExhaustedException ex, WebRequest request) {
        return build(HttpStatus.TOO_MANY_REQUESTS, "QUOTA_EXHAUSTED", ex.getMessage(), request);
    }

    @ExceptionHandler(PlatformClientException.class)
    public ResponseEntity<ErrorResponse> handlePlatform(PlatformClientException ex, WebRequest request) {
        log.warn("Platform call failed ({}): {}", ex.getErrorCode(), ex.getMessage());
        HttpStatus status = ex.isRateLimited() ? HttpStatus.TOO_MANY_REQUESTS : HttpStatus.BAD_GATEWAY;
        return build(status, ex.getErrorCode(), ex.getMessage(), request);
    }

    @ExceptionHandler({ContentValidationException.class, InvalidStrategyException.class})
    public ResponseEntity<ErrorResponse> handleValidation(RuntimeException ex, WebRequest request) {
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "VALIDATION_ERROR", ex.getMessage(), request);
    }

    @ExceptionHandler({MissingRequestHeaderException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex, WebRequest request) {
        return build(HttpStatus.BAD_REQUEST, "BAD_REQUEST", ex.getMessage(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, WebRequest request) {
        log.error("Unexpected error handling {}", describe(request), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "An unexpected error occurred", request);
    }

    private ResponseEntity<ErrorResponse> build(HttpStatus status, String error, String message, WebRequest request) {
        ErrorResponse body = ErrorResponse.builder()
                .status(status.value())
                .error(error)
                .message(message)
                .path(describe(request))
                .timestamp(OffsetDateTime.now())
                .build();
        return ResponseEntity.status(status).body(body);
    }

    private String describe(WebRequest request) {
        if (request instanceof ServletWebRequest) {
            return ((ServletWebRequest) request).getRequest().getRequestURI();
        }
        return request.getDescription(false);
    }
}
