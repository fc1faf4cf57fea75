package com.williamcallahan.keycoordinator.web;

import com.williamcallahan.keycoordinator.service.credential.PoolConfigurationException;
import com.williamcallahan.keycoordinator.service.ratelimit.RateLimitExceededException;
import com.williamcallahan.keycoordinator.service.retry.FinalFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps coordinator exceptions to HTTP responses with the standard error payload.
 */
@RestControllerAdvice
public class CoordinatorExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(CoordinatorExceptionHandler.class);

    @ExceptionHandler(RateLimitExceededException.class)
    public ResponseEntity<ApiErrorResponse> handleRateLimit(RateLimitExceededException exception) {
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(exception.retryAfterSeconds()))
                .body(ApiErrorResponse.error(
                        "Too many requests. Please wait before trying again.",
                        "retryAfterMs=" + exception.retryAfterMs()));
    }

    @ExceptionHandler(FinalFailureException.class)
    public ResponseEntity<ApiErrorResponse> handleFinalFailure(FinalFailureException exception) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(ApiErrorResponse.error(exception.notice().message()));
    }

    @ExceptionHandler(PoolConfigurationException.class)
    public ResponseEntity<ApiErrorResponse> handlePoolConfiguration(PoolConfigurationException exception) {
        log.warn("Request for unconfigured provider: {}", exception.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(ApiErrorResponse.error("This service is not configured.", exception.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiErrorResponse> handleValidation(IllegalArgumentException exception) {
        String message = exception.getMessage() == null ? "Invalid request." : exception.getMessage();
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ApiErrorResponse.error(message));
    }
}
