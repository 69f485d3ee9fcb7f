package com.patentintel.status.config;

import com.patentintel.status.exception.PatentLookupException;
import com.patentintel.status.exception.RateLimitExceededException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Clock;
import java.time.Duration;

@RestControllerAdvice
@Slf4j
public class LookupExceptionAdvice {

    private final Clock clock;

    public LookupExceptionAdvice(Clock clock) {
        this.clock = clock;
    }

    @ExceptionHandler(RateLimitExceededException.class)
    public ResponseEntity<ErrorResponse> handleRateLimit(RateLimitExceededException ex) {
        long retryAfter = Math.max(1, Duration.between(clock.instant(), ex.resetAt()).getSeconds());
        HttpHeaders headers = PatentStatusController.rateLimitHeaders(ex.status());
        headers.set(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfter));
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .headers(headers)
                .body(new ErrorResponse(ex.errorCode(), ex.getMessage(), "resets_at=" + ex.resetAt()));
    }

    @ExceptionHandler(PatentLookupException.class)
    public ResponseEntity<ErrorResponse> handleLookup(PatentLookupException ex) {
        if (ex.outcomeCode() >= 500) {
            log.warn("Lookup failed: {} {}", ex.errorCode(), ex.getMessage());
        }
        return ResponseEntity.status(ex.outcomeCode())
                .body(new ErrorResponse(ex.errorCode(), ex.getMessage(), null));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParam(MissingServletRequestParameterException ex) {
        return ResponseEntity.badRequest()
                .body(new ErrorResponse("INVALID_IDENTIFIER_FORMAT", ex.getMessage(), null));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleBadArgument(IllegalArgumentException ex) {
        return ResponseEntity.badRequest()
                .body(new ErrorResponse("BAD_REQUEST", ex.getMessage(), null));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex) {
        log.error("Unhandled error: {}", ex.getMessage(), ex);
        return ResponseEntity.internalServerError()
                .body(new ErrorResponse("INTERNAL_ERROR", "Unexpected error", null));
    }
}
