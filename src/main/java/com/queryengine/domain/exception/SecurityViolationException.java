package com.queryengine.domain.exception;

import com.queryengine.domain.model.ValidationError;

import java.util.List;

/**
 * Whitelist breach: unknown table, field or operator.
 *
 * Kept distinct from plain validation failures so audits can single them out.
 */
public class SecurityViolationException extends QueryValidationException {

    public SecurityViolationException(String field, String reason) {
        super(field, reason);
    }

    public SecurityViolationException(List<ValidationError> errors) {
        super(errors);
    }
}
