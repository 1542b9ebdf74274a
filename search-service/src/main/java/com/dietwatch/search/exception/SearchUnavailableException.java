package com.dietwatch.search.exception;

public class SearchUnavailableException extends SearchEngineException {

    public SearchUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
