package com.queryengine.domain.exception;

/**
 * Database execution failed.
 *
 * Transient failures (connection reset, deadlock, timeout) have already been
 * retried when this surfaces. The message never contains SQL text.
 */
public class QueryExecutionException extends QueryEngineException {

    private final boolean transientFailure;

    public QueryExecutionException(String message, boolean transientFailure, Throwable cause) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    public static QueryExecutionException transientFailure(Throwable cause) {
        return new QueryExecutionException("Query execution failed after retries", true, cause);
    }

    public static QueryExecutionException fatal(Throwable cause) {
        return new QueryExecutionException("Query execution failed", false, cause);
    }

    public boolean isTransientFailure() {
        return transientFailure;
    }
}
