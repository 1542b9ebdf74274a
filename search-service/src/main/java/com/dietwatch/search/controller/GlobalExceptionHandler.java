package com.dietwatch.search.controller;

import com.dietwatch.search.exception.InvalidQueryException;
import com.dietwatch.search.exception.RateLimitExceededException;
import com.dietwatch.search.exception.SearchEngineException;
import com.dietwatch.search.exception.SearchUnavailableException;
import com.fasterxml.jackson.core.JsonProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps the engine's exceptions to RFC 9457 problem details.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(InvalidQueryException.class)
    ProblemDetail handleInvalidQuery(InvalidQueryException ex) {
        return problem(HttpStatus.BAD_REQUEST, "invalid-query", ex.getMessage());
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, JsonProcessingException.class})
    ProblemDetail handleUnreadable(Exception ex) {
        return problem(HttpStatus.BAD_REQUEST, "invalid-query", "malformed request body");
    }

    @ExceptionHandler(RateLimitExceededException.class)
    ResponseEntity<ProblemDetail> handleRateLimited(RateLimitExceededException ex) {
        long retryAfterSeconds = Math.max(1L, (ex.getSuggestedWait().toMillis() + 999) / 1000);
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfterSeconds))
                .body(problem(HttpStatus.TOO_MANY_REQUESTS, "rate-limit-exceeded", ex.getMessage()));
    }

    @ExceptionHandler(SearchUnavailableException.class)
    ProblemDetail handleUnavailable(SearchUnavailableException ex) {
        log.error("search unavailable: {}", ex.getMessage(), ex.getCause());
        return problem(HttpStatus.SERVICE_UNAVAILABLE, "search-unavailable", ex.getMessage());
    }

    @ExceptionHandler(SearchEngineException.class)
    ProblemDetail handleEngine(SearchEngineException ex) {
        log.error("unhandled engine error", ex);
        return problem(HttpStatus.BAD_GATEWAY, "backend-error", ex.getMessage());
    }

    private static ProblemDetail problem(HttpStatus status, String title, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        return problem;
    }
}
