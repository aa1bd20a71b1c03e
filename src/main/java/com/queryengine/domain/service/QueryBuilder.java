package com.queryengine.domain.service;

import com.queryengine.config.QueryEngineProperties;
import com.queryengine.domain.exception.SecurityViolationException;
import com.queryengine.domain.model.ColumnMappings;
import com.queryengine.domain.model.DataSourceConfig;
import com.queryengine.domain.model.FilterOperator;
import com.queryengine.domain.model.PermissionScope;
import com.queryengine.domain.model.QueryFilter;
import com.queryengine.domain.model.SecurityContext;
import com.queryengine.domain.model.SqlFragment;
import com.queryengine.domain.model.ValidationResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Assembles parameterized SQL for analytics tables.
 *
 * Every fragment is a {@link SqlFragment}: identifiers come from the
 * validated data source configuration, values only ever appear as
 * {@code $n} placeholders. The security predicate is always emitted first and
 * is never omitted; with no accessible tenants it becomes a predicate no row
 * can satisfy.
 */
@Component
@RequiredArgsConstructor
public class QueryBuilder {

    /** Bound in place of tenant ids when the context grants none. No row carries it. */
    static final int NO_ACCESS_SENTINEL = -1;

    private static final String CURRENCY_TYPES = "('currency', 'quantity')";

    private final QueryValidator validator;
    private final QuerySanitizer sanitizer;
    private final QueryEngineProperties properties;

    /**
     * Security predicate, then the caller's predicates, sharing one placeholder sequence.
     */
    public SqlFragment buildWhereClause(List<QueryFilter> filters, SecurityContext context, DataSourceConfig config) {
        ValidationResult validation = validator.validateFilters(filters, config);
        if (!validation.isValid()) {
            throw new SecurityViolationException(validation.getErrors());
        }

        Parameters params = new Parameters();
        List<String> conditions = new ArrayList<>();

        conditions.add(tenantPredicate(context, params));

        String subEntity = subEntityPredicate(context, params);
        if (subEntity != null) {
            conditions.add(subEntity);
        }

        if (filters != null) {
            for (QueryFilter filter : filters) {
                FilterOperator operator = validator.validateOperator(filter.operatorOrDefault());
                QueryFilter sanitized = sanitizer.sanitizeFilter(filter, operator);
                conditions.add(filterPredicate(sanitized.getField(), operator, sanitized.getValue(), params));
            }
        }

        return new SqlFragment("WHERE " + String.join(" AND ", conditions), params.values());
    }

    public SqlFragment buildSelectColumns(ColumnMappings mappings) {
        for (String column : mappings.getAllColumns()) {
            requireIdentifier(column);
        }
        return SqlFragment.of(String.join(", ", mappings.getAllColumns()));
    }

    public SqlFragment buildOrderBy(ColumnMappings mappings) {
        return SqlFragment.of("ORDER BY " + requireIdentifier(mappings.getDateField()) + " ASC");
    }

    /**
     * Full row query: projection, source table, the given WHERE clause and ordering.
     */
    public SqlFragment buildSelectQuery(DataSourceConfig config, ColumnMappings mappings, SqlFragment where) {
        String sql = "SELECT " + buildSelectColumns(mappings).getSql()
                + " FROM " + qualifiedTable(config)
                + " " + where.getSql()
                + " " + buildOrderBy(mappings).getSql();
        return new SqlFragment(sql, where.getParams());
    }

    /**
     * Summary total per measure type: currency and quantity measures are summed,
     * anything else is counted.
     */
    public SqlFragment buildAggregationQuery(DataSourceConfig config, ColumnMappings mappings, SqlFragment where) {
        String typeField = requireIdentifier(mappings.getMeasureTypeField());
        String valueField = requireIdentifier(mappings.getMeasureValueField());

        String sql = "SELECT CASE WHEN " + typeField + " IN " + CURRENCY_TYPES
                + " THEN SUM(" + valueField + ") ELSE COUNT(*) END AS total, "
                + typeField + " AS measure_type"
                + " FROM " + qualifiedTable(config)
                + " " + where.getSql()
                + " GROUP BY " + typeField;
        return new SqlFragment(sql, where.getParams());
    }

    private String tenantPredicate(SecurityContext context, Parameters params) {
        String column = requireIdentifier(properties.getSecurity().getTenantColumn());
        if (!context.hasTenantAccess()) {
            return column + " = " + params.bind(NO_ACCESS_SENTINEL);
        }
        return column + " = ANY(" + params.bind(sorted(context.getAccessibleTenantIds())) + ")";
    }

    private String subEntityPredicate(SecurityContext context, Parameters params) {
        String column = requireIdentifier(properties.getSecurity().getSubEntityColumn());
        if (!context.getAccessibleSubEntityIds().isEmpty()) {
            return "(" + column + " IS NULL OR " + column + " = ANY("
                    + params.bind(sorted(context.getAccessibleSubEntityIds())) + "))";
        }
        if (context.getPermissionScope() == PermissionScope.OWN) {
            return column + " = " + params.bind(NO_ACCESS_SENTINEL);
        }
        return null;
    }

    private String filterPredicate(String field, FilterOperator operator, Object value, Parameters params) {
        String column = requireIdentifier(field);
        return switch (operator) {
            case IN, NOT_IN -> column + " " + operator.getSqlOperator() + "(" + params.bind(value) + ")";
            case BETWEEN -> betweenPredicate(column, (List<?>) value, params);
            default -> column + " " + operator.getSqlOperator() + " " + params.bind(value);
        };
    }

    private String betweenPredicate(String column, List<?> bounds, Parameters params) {
        String low = params.bind(bounds.get(0));
        String high = params.bind(bounds.get(1));
        return column + " BETWEEN " + low + " AND " + high;
    }

    private String qualifiedTable(DataSourceConfig config) {
        validator.validateTable(config.getTableName(), config.getSchemaName(), config);
        return config.qualifiedTableName();
    }

    private String requireIdentifier(String name) {
        if (!validator.isIdentifier(name)) {
            throw new SecurityViolationException(name, "malformed identifier");
        }
        return name;
    }

    private static List<Integer> sorted(Set<Integer> ids) {
        return List.copyOf(new TreeSet<>(ids));
    }

    /**
     * Ordered bind values. The placeholder index is derived from the list size,
     * so there is exactly one counter for the whole statement.
     */
    private static final class Parameters {

        private final List<Object> values = new ArrayList<>();

        String bind(Object value) {
            values.add(value);
            return "$" + values.size();
        }

        List<Object> values() {
            return values;
        }
    }
}
