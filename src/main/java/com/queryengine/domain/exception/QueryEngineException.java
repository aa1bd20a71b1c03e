package com.queryengine.domain.exception;

/**
 * Base class for every failure the engine surfaces to its caller.
 */
public class QueryEngineException extends RuntimeException {

    public QueryEngineException(String message) {
        super(message);
    }

    public QueryEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
