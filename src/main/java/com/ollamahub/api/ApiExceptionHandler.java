package com.ollamahub.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ollamahub.orchestration.exception.AllWorkersFailedException;
import com.ollamahub.orchestration.exception.ReviewerException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Maps request-level failures to HTTP responses. "No worker answered" and "synthesis failed"
 * use different error codes so callers can tell them apart.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    static final String ALL_WORKERS_FAILED = "ALL_WORKERS_FAILED";
    static final String REVIEWER_FAILED = "REVIEWER_FAILED";
    static final String INVALID_REQUEST = "INVALID_REQUEST";
    static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    @ExceptionHandler(AllWorkersFailedException.class)
    ResponseEntity<ApiError> handleAllWorkersFailed(AllWorkersFailedException ex) {
        return ResponseEntity
                .status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ApiError(ALL_WORKERS_FAILED, "All worker agents failed to respond",
                        ex.failureSummary(), Instant.now()));
    }

    @ExceptionHandler(ReviewerException.class)
    ResponseEntity<ApiError> handleReviewerFailed(ReviewerException ex) {
        return ResponseEntity
                .status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ApiError(REVIEWER_FAILED, "The reviewer agent failed to respond",
                        ex.getDetail(), Instant.now()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleInvalid(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getAllErrors().stream()
                .map(error -> error.getDefaultMessage())
                .collect(Collectors.joining("; "));
        log.warn("Rejected invalid generate request: {}", details);
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(new ApiError(INVALID_REQUEST, "Invalid request", details, Instant.now()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Rejected unreadable request body: {}", ex.getMessage());
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(new ApiError(INVALID_REQUEST, "Invalid request", "Request body is not valid JSON", Instant.now()));
    }

    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        log.error("Unexpected error while handling request", ex);
        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ApiError(INTERNAL_ERROR, "An unexpected error occurred",
                        ex.getClass().getSimpleName(), Instant.now()));
    }

    public record ApiError(
            @JsonProperty("error_code") String errorCode,
            String message,
            String details,
            Instant timestamp
    ) {}
}
