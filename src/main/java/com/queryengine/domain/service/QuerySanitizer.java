package com.queryengine.domain.service;

import com.queryengine.domain.exception.SanitizationException;
import com.queryengine.domain.model.FilterOperator;
import com.queryengine.domain.model.QueryFilter;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Type- and pattern-aware checks on filter values.
 *
 * Values that fail are rejected outright. Nothing is escaped or trimmed:
 * values only ever reach the database as bound parameters, this just turns
 * obviously hostile input away early. Collection shapes are normalized and
 * {@code YYYY-MM-DD} strings become {@link LocalDate} so they bind as SQL dates.
 */
@Component
public class QuerySanitizer {

    static final int MAX_STRING_LENGTH = 255;

    private static final Pattern SAFE_STRING = Pattern.compile("^[a-zA-Z0-9\\s\\-_.,()&]+$");
    private static final Pattern SAFE_LIKE_PATTERN = Pattern.compile("^[a-zA-Z0-9\\s\\-_.,()&%]+$");
    private static final Pattern DATE_SHAPE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");
    private static final DateTimeFormatter STRICT_DATE =
            DateTimeFormatter.ofPattern("uuuu-MM-dd").withResolverStyle(ResolverStyle.STRICT);

    public QueryFilter sanitizeFilter(QueryFilter filter, FilterOperator operator) {
        try {
            return new QueryFilter(filter.getField(), operator.getCode(), sanitizeValue(filter.getValue(), operator));
        } catch (SanitizationException e) {
            throw new SanitizationException(filter.getField(), e.getReason());
        }
    }

    public Object sanitizeValue(Object value, FilterOperator operator) {
        if (value == null) {
            throw new SanitizationException("value is required");
        }

        if (operator.isMultiValued()) {
            List<Object> values = asList(value, operator);
            if (values.isEmpty()) {
                throw new SanitizationException(operator.getCode() + " requires at least one value");
            }
            List<Object> sanitized = new ArrayList<>(values.size());
            for (Object element : values) {
                sanitized.add(sanitizeSingleValue(element, operator));
            }
            return List.copyOf(sanitized);
        }

        if (operator == FilterOperator.BETWEEN) {
            List<Object> bounds = asList(value, operator);
            if (bounds.size() != 2) {
                throw new SanitizationException("between requires exactly two values");
            }
            return List.of(sanitizeSingleValue(bounds.get(0), operator), sanitizeSingleValue(bounds.get(1), operator));
        }

        if (value instanceof Collection || value.getClass().isArray()) {
            throw new SanitizationException(operator.getCode() + " requires a single value");
        }
        return sanitizeSingleValue(value, operator);
    }

    Object sanitizeSingleValue(Object value, FilterOperator operator) {
        if (value == null) {
            throw new SanitizationException("value is required");
        }
        if (value instanceof String) {
            return sanitizeString((String) value, operator);
        }
        if (value instanceof Double || value instanceof Float) {
            double number = ((Number) value).doubleValue();
            if (!Double.isFinite(number)) {
                throw new SanitizationException("number must be finite");
            }
            return number;
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof BigDecimal || value instanceof BigInteger) {
            return value;
        }
        if (value instanceof LocalDate || value instanceof Boolean) {
            return value;
        }
        throw new SanitizationException("unsupported value type");
    }

    private Object sanitizeString(String value, FilterOperator operator) {
        if (value.isEmpty() || value.length() > MAX_STRING_LENGTH) {
            throw new SanitizationException("string length is out of range");
        }
        if (DATE_SHAPE.matcher(value).matches()) {
            if (!isValidDate(value)) {
                throw new SanitizationException("not a real calendar date");
            }
            // ILIKE compares text; every other operator compares against a date column
            return operator == FilterOperator.LIKE ? value : LocalDate.parse(value, STRICT_DATE);
        }
        Pattern pattern = operator == FilterOperator.LIKE ? SAFE_LIKE_PATTERN : SAFE_STRING;
        if (!pattern.matcher(value).matches()) {
            throw new SanitizationException("string contains disallowed characters");
        }
        return value;
    }

    public boolean isValidDate(String value) {
        if (value == null || !DATE_SHAPE.matcher(value).matches()) {
            return false;
        }
        try {
            LocalDate.parse(value, STRICT_DATE);
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }

    private List<Object> asList(Object value, FilterOperator operator) {
        if (value instanceof Collection) {
            return new ArrayList<>((Collection<?>) value);
        }
        if (value instanceof Object[]) {
            return Arrays.asList((Object[]) value);
        }
        throw new SanitizationException(operator.getCode() + " requires an array value");
    }
}
