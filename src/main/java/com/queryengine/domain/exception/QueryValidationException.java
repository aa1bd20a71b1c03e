package com.queryengine.domain.exception;

import com.queryengine.domain.model.ValidationError;
import com.queryengine.domain.model.ValidationResult;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Request rejected before any SQL was built.
 *
 * The message only ever carries the offending field name. The reason is kept
 * apart for server-side logs and never contains the rejected value.
 */
public class QueryValidationException extends QueryEngineException {

    private static final Pattern PRINTABLE_FIELD = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]{0,62}$");
    private static final String UNPRINTABLE_FIELD = "<invalid field>";

    private final String field;
    private final String reason;
    private final List<ValidationError> errors;

    public QueryValidationException(String field, String reason) {
        this(List.of(new ValidationError(field, reason)));
    }

    public QueryValidationException(List<ValidationError> errors) {
        super(buildMessage(errors));
        this.errors = List.copyOf(errors);
        this.field = errors.isEmpty() ? null : displayField(errors.get(0).getField());
        this.reason = errors.isEmpty() ? null : errors.get(0).getReason();
    }

    public static QueryValidationException from(ValidationResult result) {
        return new QueryValidationException(result.getErrors());
    }

    public String getField() {
        return field;
    }

    public String getReason() {
        return reason;
    }

    public List<ValidationError> getErrors() {
        return errors;
    }

    /**
     * Field names come from the request; only echo the ones that look like identifiers.
     */
    public static String displayField(String field) {
        if (field == null) {
            return "request";
        }
        return PRINTABLE_FIELD.matcher(field).matches() ? field : UNPRINTABLE_FIELD;
    }

    private static String buildMessage(List<ValidationError> errors) {
        if (errors.isEmpty()) {
            return "Query validation failed";
        }
        return "Query validation failed: " + displayField(errors.get(0).getField());
    }
}
