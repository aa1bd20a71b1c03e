package com.queryengine.domain.service;

import com.queryengine.domain.exception.SecurityViolationException;
import com.queryengine.domain.model.AnalyticsQueryParams;
import com.queryengine.domain.model.ComparisonType;
import com.queryengine.domain.model.DataSourceConfig;
import com.queryengine.domain.model.FilterOperator;
import com.queryengine.domain.model.PeriodComparison;
import com.queryengine.domain.model.QueryFilter;
import com.queryengine.domain.model.SeriesSpec;
import com.queryengine.domain.model.ValidationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for QueryValidator.
 *
 * Whitelisting must fail closed: unknown tables, fields and operators are
 * rejected, never skipped.
 */
class QueryValidatorTest {

    private QueryValidator validator;
    private DataSourceConfig config;

    @BeforeEach
    void setUp() {
        validator = new QueryValidator();
        config = DataSourceConfig.builder()
                .dataSourceId(7)
                .schemaName("ih")
                .tableName("agg_monthly")
                .allowedFields(Set.of("measure", "frequency", "date_index", "practice_uid"))
                .allowedOperatorsPerField(Map.of("practice_uid", Set.of(FilterOperator.EQ, FilterOperator.IN)))
                .build();
    }

    @Test
    void testValidateTable_RegisteredTable() {
        assertDoesNotThrow(() -> validator.validateTable("agg_monthly", "ih", config));
    }

    @Test
    void testValidateTable_WrongTable() {
        SecurityViolationException e = assertThrows(SecurityViolationException.class,
                () -> validator.validateTable("users", "ih", config));

        assertEquals("table", e.getField());
    }

    @Test
    void testValidateTable_InjectedIdentifier() {
        assertThrows(SecurityViolationException.class,
                () -> validator.validateTable("agg_monthly; DROP TABLE users", "ih", config));
    }

    @Test
    void testValidateTable_InactiveDataSource() {
        config.setActive(false);

        assertThrows(SecurityViolationException.class,
                () -> validator.validateTable("agg_monthly", "ih", config));
    }

    @Test
    void testValidateField_NotWhitelisted() {
        SecurityViolationException e = assertThrows(SecurityViolationException.class,
                () -> validator.validateField("password_hash", "agg_monthly", "ih", config));

        assertEquals("password_hash", e.getField());
        assertEquals("Query validation failed: password_hash", e.getMessage());
    }

    @Test
    void testValidateOperator_Known() {
        assertEquals(FilterOperator.NOT_IN, validator.validateOperator("not_in"));
        assertEquals(FilterOperator.LIKE, validator.validateOperator("like"));
    }

    @Test
    void testValidateOperator_Unknown() {
        assertThrows(SecurityViolationException.class, () -> validator.validateOperator("OR 1=1"));
        assertThrows(SecurityViolationException.class, () -> validator.validateOperator("EQ"));
        assertThrows(SecurityViolationException.class, () -> validator.validateOperator(null));
    }

    @Test
    void testValidateFilters_UnknownFieldRejectsWholeList() {
        // Given
        List<QueryFilter> filters = List.of(
                QueryFilter.of("measure", FilterOperator.EQ, "AR"),
                QueryFilter.of("ssn", FilterOperator.EQ, "123"));

        // When
        ValidationResult result = validator.validateFilters(filters, config);

        // Then
        assertFalse(result.isValid());
        assertEquals(1, result.getErrors().size());
        assertEquals("ssn", result.getErrors().get(0).getField());
    }

    @Test
    void testValidateFilters_PerFieldOperatorRestriction() {
        List<QueryFilter> filters = List.of(QueryFilter.of("practice_uid", FilterOperator.GT, 5));

        ValidationResult result = validator.validateFilters(filters, config);

        assertFalse(result.isValid());
    }

    @Test
    void testValidateFilters_AllowedFilters() {
        List<QueryFilter> filters = List.of(
                QueryFilter.of("practice_uid", FilterOperator.IN, List.of(1, 2)),
                QueryFilter.of("date_index", FilterOperator.GTE, LocalDate.of(2024, 1, 1)));

        assertTrue(validator.validateFilters(filters, config).isValid());
    }

    @Test
    void testValidateParams_UnknownFieldRejected() {
        AnalyticsQueryParams params = paramsWithFilters(QueryFilter.of("ssn", FilterOperator.EQ, "x"));

        ValidationResult result = validator.validateParams(params, config);

        assertFalse(result.isValid());
        assertEquals("ssn", result.getErrors().get(0).getField());
    }

    @Test
    void testValidateParams_PerFieldOperatorRejected() {
        AnalyticsQueryParams params = paramsWithFilters(QueryFilter.of("practice_uid", FilterOperator.GT, 5));

        ValidationResult result = validator.validateParams(params, config);

        assertFalse(result.isValid());
        assertEquals("practice_uid", result.getErrors().get(0).getField());
    }

    @Test
    void testValidateParams_MissingOperatorMeansEquality() {
        // practice_uid only allows eq/in, so a missing operator must resolve to eq
        AnalyticsQueryParams params = paramsWithFilters(new QueryFilter("practice_uid", null, 12));

        assertTrue(validator.validateParams(params, config).isValid());
    }

    @Test
    void testValidateParams_CollectsStructuralAndFilterErrors() {
        AnalyticsQueryParams params = AnalyticsQueryParams.builder()
                .dataSourceId(7)
                .startDate(LocalDate.of(2024, 6, 1))
                .endDate(LocalDate.of(2024, 1, 1))
                .filters(List.of(QueryFilter.of("ssn", FilterOperator.EQ, "x")))
                .build();

        ValidationResult result = validator.validateParams(params, config);

        assertEquals(2, result.getErrors().size());
    }

    @Test
    void testValidateRequest_StartAfterEnd() {
        AnalyticsQueryParams params = AnalyticsQueryParams.builder()
                .dataSourceId(7)
                .startDate(LocalDate.of(2024, 6, 1))
                .endDate(LocalDate.of(2024, 1, 1))
                .build();

        ValidationResult result = validator.validateRequest(params);

        assertFalse(result.isValid());
        assertEquals("startDate", result.getErrors().get(0).getField());
    }

    @Test
    void testValidateRequest_MissingDataSource() {
        ValidationResult result = validator.validateRequest(AnalyticsQueryParams.builder().build());

        assertFalse(result.isValid());
        assertEquals("dataSourceId", result.getErrors().get(0).getField());
    }

    @Test
    void testValidateRequest_PeriodComparisonNeedsFrequency() {
        AnalyticsQueryParams params = AnalyticsQueryParams.builder()
                .dataSourceId(7)
                .startDate(LocalDate.of(2024, 1, 1))
                .endDate(LocalDate.of(2024, 1, 31))
                .periodComparison(PeriodComparison.builder()
                        .enabled(true)
                        .comparisonType(ComparisonType.PREVIOUS_PERIOD)
                        .build())
                .build();

        assertFalse(validator.validateRequest(params).isValid());
    }

    @Test
    void testValidateRequest_CustomPeriodOffsetMustBePositive() {
        AnalyticsQueryParams params = AnalyticsQueryParams.builder()
                .dataSourceId(7)
                .frequency("Monthly")
                .startDate(LocalDate.of(2024, 1, 1))
                .endDate(LocalDate.of(2024, 1, 31))
                .periodComparison(PeriodComparison.builder()
                        .enabled(true)
                        .comparisonType(ComparisonType.CUSTOM_PERIOD)
                        .customPeriodOffset(0)
                        .build())
                .build();

        assertFalse(validator.validateRequest(params).isValid());
    }

    @Test
    void testValidateRequest_MixedSeriesFrequencies() {
        AnalyticsQueryParams params = AnalyticsQueryParams.builder()
                .dataSourceId(7)
                .frequency("Monthly")
                .multipleSeries(List.of(
                        SeriesSpec.builder().id("a").measure("AR").build(),
                        SeriesSpec.builder().id("b").measure("Charges").frequency("Weekly").build()))
                .build();

        ValidationResult result = validator.validateRequest(params);

        assertFalse(result.isValid());
        assertEquals("multipleSeries", result.getErrors().get(0).getField());
    }

    @Test
    void testValidateRequest_ValidSeries() {
        AnalyticsQueryParams params = AnalyticsQueryParams.builder()
                .dataSourceId(7)
                .frequency("Monthly")
                .multipleSeries(List.of(
                        SeriesSpec.builder().id("a").measure("AR").frequency("Monthly").build(),
                        SeriesSpec.builder().id("b").measure("Charges").build()))
                .build();

        assertTrue(validator.validateRequest(params).isValid());
    }

    private AnalyticsQueryParams paramsWithFilters(QueryFilter... filters) {
        return AnalyticsQueryParams.builder()
                .dataSourceId(7)
                .startDate(LocalDate.of(2024, 1, 1))
                .endDate(LocalDate.of(2024, 1, 31))
                .filters(List.of(filters))
                .build();
    }
}
