package com.dietwatch.search.exception;

public class BackendTimeoutException extends SearchEngineException {

    public BackendTimeoutException(String message) {
        super(message);
    }

    public BackendTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
