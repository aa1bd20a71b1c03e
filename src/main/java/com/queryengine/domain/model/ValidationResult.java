package com.queryengine.domain.model;

import lombok.Value;

import java.util.List;

/**
 * Outcome of validating a request against a data source.
 */
@Value
public class ValidationResult {

    boolean valid;
    List<ValidationError> errors;

    public static ValidationResult ok() {
        return new ValidationResult(true, List.of());
    }

    public static ValidationResult of(List<ValidationError> errors) {
        return errors.isEmpty() ? ok() : new ValidationResult(false, List.copyOf(errors));
    }
}
