package com.queryengine.domain.exception;

/**
 * Filter value failed its type or pattern check. Values are rejected whole,
 * never partially cleaned.
 */
public class SanitizationException extends QueryValidationException {

    public SanitizationException(String reason) {
        super(null, reason);
    }

    public SanitizationException(String field, String reason) {
        super(field, reason);
    }
}
