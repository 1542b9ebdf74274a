package com.dietwatch.search.exception;

public class BackendUnavailableException extends SearchEngineException {

    public BackendUnavailableException(String message) {
        super(message);
    }

    public BackendUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
