package com.dietwatch.search.exception;

/**
 * Client error: blank query text, filters outside the known schema, or a 4xx (other than 429)
 * from the structured store. Never retried.
 */
public class InvalidQueryException extends SearchEngineException {

    public InvalidQueryException(String message) {
        super(message);
    }

    public InvalidQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
