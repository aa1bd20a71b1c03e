package com.queryengine.domain.service;

import com.queryengine.config.QueryEngineConfig;
import com.queryengine.config.QueryEngineProperties;
import com.queryengine.domain.exception.QueryExecutionException;
import com.queryengine.domain.model.AnalyticsQueryParams;
import com.queryengine.domain.model.ColumnMappings;
import com.queryengine.domain.model.ComparisonType;
import com.queryengine.domain.model.DataSourceConfig;
import com.queryengine.domain.model.PeriodComparison;
import com.queryengine.domain.model.PermissionScope;
import com.queryengine.domain.model.QueryResult;
import com.queryengine.domain.model.SecurityContext;
import com.queryengine.domain.model.SeriesSpec;
import com.queryengine.domain.model.SqlFragment;
import com.queryengine.infrastructure.cache.AnalyticsCache;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for QueryExecutor.
 *
 * Query building runs for real; the SQL boundary, caches and metadata are mocked.
 * Concurrency of the period comparison is checked with latches rather than timing.
 */
@ExtendWith(MockitoExtension.class)
class QueryExecutorTest {

    private static final LocalDate MARCH_1 = LocalDate.of(2024, 3, 1);
    private static final LocalDate FEB_1 = LocalDate.of(2024, 2, 1);

    @Mock
    private AnalyticsSqlExecutor sqlExecutor;

    @Mock
    private AnalyticsCache cache;

    @Mock
    private DataSourceConfigService configService;

    @Mock
    private ColumnMappingService columnMappingService;

    private MeterRegistry meterRegistry;
    private ThreadPoolTaskExecutor taskExecutor;
    private QueryEngineProperties properties;
    private QueryExecutor queryExecutor;

    private DataSourceConfig config;
    private ColumnMappings mappings;
    private SecurityContext context;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        properties = new QueryEngineProperties();
        properties.getRetry().setInitialBackoffMs(1);
        properties.getExecution().setComparisonTimeoutSeconds(5);

        taskExecutor = new ThreadPoolTaskExecutor();
        taskExecutor.setCorePoolSize(4);
        taskExecutor.setMaxPoolSize(4);
        taskExecutor.initialize();

        QueryValidator validator = new QueryValidator();
        QuerySanitizer sanitizer = new QuerySanitizer();
        queryExecutor = new QueryExecutor(
                sqlExecutor,
                cache,
                configService,
                columnMappingService,
                new FilterListBuilder(),
                new QueryBuilder(validator, sanitizer, properties),
                new ComparisonPeriodCalculator(),
                taskExecutor,
                QueryEngineConfig.analyticsRetry(properties.getRetry()),
                meterRegistry,
                properties);

        config = DataSourceConfig.builder()
                .dataSourceId(1)
                .schemaName("ih")
                .tableName("agg_monthly")
                .allowedFields(Set.of("measure", "frequency", "date_index", "practice_uid"))
                .build();
        mappings = ColumnMappings.builder()
                .dateField("date_index")
                .timePeriodField("frequency")
                .measureValueField("measure_value")
                .measureTypeField("measure_type")
                .allColumns(List.of("measure", "frequency", "date_index", "measure_value", "measure_type"))
                .build();
        context = SecurityContext.builder()
                .accessibleTenantIds(Set.of(100, 101))
                .permissionScope(PermissionScope.ORGANIZATION)
                .userId("user-1")
                .build();
    }

    @AfterEach
    void tearDown() {
        taskExecutor.shutdown();
    }

    @Test
    void testExecuteCore_CacheHit() {
        // Given
        AnalyticsQueryParams params = baseParams();
        QueryResult cached = QueryResult.builder().rows(List.of(row("AR", MARCH_1))).rowCount(1).build();
        when(cache.getQueryResult(params, context)).thenReturn(Optional.of(cached));

        // When
        QueryResult result = queryExecutor.executeCore(params, context);

        // Then
        assertTrue(result.isCacheHit());
        assertEquals(1, result.getRowCount());

        // Verify database was NOT called (cache hit)
        verifyNoInteractions(sqlExecutor, configService);
        assertEquals(1.0, meterRegistry.counter("query.cache", "result", "hit").count());
    }

    @Test
    void testExecuteCore_CacheMiss() {
        // Given
        AnalyticsQueryParams params = baseParams();
        stubMetadata();
        when(cache.getQueryResult(params, context)).thenReturn(Optional.empty());
        when(sqlExecutor.query(any())).thenReturn(List.of(row("AR", MARCH_1), row("AR", FEB_1)));

        // When
        QueryResult result = queryExecutor.executeCore(params, context);

        // Then
        assertFalse(result.isCacheHit());
        assertEquals(2, result.getRowCount());
        assertNull(result.getTotal());

        ArgumentCaptor<SqlFragment> statement = ArgumentCaptor.forClass(SqlFragment.class);
        verify(sqlExecutor).query(statement.capture());
        assertTrue(statement.getValue().getSql().startsWith(
                "SELECT measure, frequency, date_index, measure_value, measure_type FROM ih.agg_monthly "
                        + "WHERE tenant_id = ANY($1) AND measure = $2"));
        assertEquals(List.of(100, 101), statement.getValue().getParams().get(0));

        // Cache write happens off the request thread
        verify(cache, timeout(2000)).setQueryResult(eq(params), eq(context), same(result));
        assertEquals(1.0, meterRegistry.counter("query.cache", "result", "miss").count());
    }

    @Test
    void testExecuteCore_NoCacheSkipsReadButStillWrites() {
        AnalyticsQueryParams params = baseParams().toBuilder().noCache(true).build();
        stubMetadata();
        when(sqlExecutor.query(any())).thenReturn(List.of(row("AR", MARCH_1)));

        queryExecutor.executeCore(params, context);

        verify(cache, never()).getQueryResult(any(), any());
        verify(cache, timeout(2000)).setQueryResult(eq(params), eq(context), any(QueryResult.class));
    }

    @Test
    void testExecuteCore_NoTenantsReturnsEmptyWithoutDatabase() {
        SecurityContext noAccess = SecurityContext.builder().permissionScope(PermissionScope.ALL).build();

        QueryResult result = queryExecutor.executeCore(baseParams(), noAccess);

        assertEquals(0, result.getRowCount());
        assertTrue(result.getRows().isEmpty());
        verifyNoInteractions(sqlExecutor, cache, configService);
    }

    @Test
    void testExecuteCore_TransientFailureRetried() {
        // Given
        AnalyticsQueryParams params = baseParams();
        stubMetadata();
        when(cache.getQueryResult(params, context)).thenReturn(Optional.empty());
        when(sqlExecutor.query(any()))
                .thenThrow(new QueryTimeoutException("canceling statement due to statement timeout"))
                .thenReturn(List.of(row("AR", MARCH_1)));

        // When
        QueryResult result = queryExecutor.executeCore(params, context);

        // Then
        assertEquals(1, result.getRowCount());
        verify(sqlExecutor, times(2)).query(any());
        assertEquals(1.0, meterRegistry.counter("query.retry").count());
    }

    @Test
    void testExecuteCore_TransientFailureExhaustsRetries() {
        AnalyticsQueryParams params = baseParams();
        stubMetadata();
        when(cache.getQueryResult(params, context)).thenReturn(Optional.empty());
        when(sqlExecutor.query(any())).thenThrow(new QueryTimeoutException("timeout"));

        QueryExecutionException e = assertThrows(QueryExecutionException.class,
                () -> queryExecutor.executeCore(params, context));

        assertTrue(e.isTransientFailure());
        verify(sqlExecutor, times(3)).query(any());
        verify(cache, never()).setQueryResult(any(), any(), any());
        assertEquals(1.0, meterRegistry.counter("query.executed", "strategy", "core", "result", "error").count());
    }

    @Test
    void testExecuteCore_FatalFailureNotRetried() {
        AnalyticsQueryParams params = baseParams();
        stubMetadata();
        when(cache.getQueryResult(params, context)).thenReturn(Optional.empty());
        when(sqlExecutor.query(any())).thenThrow(new DataIntegrityViolationException("column does not exist"));

        QueryExecutionException e = assertThrows(QueryExecutionException.class,
                () -> queryExecutor.executeCore(params, context));

        assertFalse(e.isTransientFailure());
        assertFalse(e.getMessage().contains("SELECT"));
        verify(sqlExecutor, times(1)).query(any());
    }

    @Test
    void testExecuteCore_IncludeTotals() {
        // Given
        AnalyticsQueryParams params = baseParams().toBuilder().includeTotals(true).build();
        stubMetadata();
        when(cache.getQueryResult(params, context)).thenReturn(Optional.empty());
        when(sqlExecutor.query(any())).thenAnswer(invocation -> {
            SqlFragment statement = invocation.getArgument(0);
            if (statement.getSql().startsWith("SELECT CASE")) {
                return List.of(
                        Map.of("total", new BigDecimal("1500.25"), "measure_type", "currency"),
                        Map.of("total", 4L, "measure_type", "count"));
            }
            return List.of(row("AR", MARCH_1));
        });

        // When
        QueryResult result = queryExecutor.executeCore(params, context);

        // Then
        assertEquals(new BigDecimal("1504.25"), result.getTotal());
        verify(sqlExecutor, times(2)).query(any());
    }

    @Test
    void testExecuteMultipleSeries_SingleStatement() {
        // Given
        AnalyticsQueryParams params = baseParams().toBuilder()
                .measure(null)
                .multipleSeries(List.of(
                        SeriesSpec.builder().id("s1").measure("AR").label("Receivables").color("#111").build(),
                        SeriesSpec.builder().id("s2").measure("Charges").aggregation("avg").build(),
                        SeriesSpec.builder().id("s3").measure("Payments").build()))
                .build();
        stubMetadata();
        when(cache.getQueryResult(any(), eq(context))).thenReturn(Optional.empty());
        when(sqlExecutor.query(any())).thenReturn(List.of(
                row("Payments", MARCH_1),
                row("AR", MARCH_1),
                row("Charges", MARCH_1),
                row("AR", FEB_1)));

        // When
        QueryResult result = queryExecutor.executeMultipleSeries(params, context);

        // Then
        ArgumentCaptor<SqlFragment> statement = ArgumentCaptor.forClass(SqlFragment.class);
        verify(sqlExecutor, times(1)).query(statement.capture());
        assertTrue(statement.getValue().getSql().contains("measure = ANY($"));
        assertTrue(statement.getValue().getParams().contains(List.of("AR", "Charges", "Payments")));

        assertEquals(4, result.getRowCount());
        List<Object> seriesOrder = new ArrayList<>();
        result.getRows().forEach(r -> seriesOrder.add(r.get("series_id")));
        assertEquals(List.of("s1", "s1", "s2", "s3"), seriesOrder);

        Map<String, Object> first = result.getRows().get(0);
        assertEquals("Receivables", first.get("series_label"));
        assertEquals("sum", first.get("series_aggregation"));
        assertEquals("#111", first.get("series_color"));
        assertEquals("avg", result.getRows().get(2).get("series_aggregation"));
        assertEquals("Payments", result.getRows().get(3).get("series_label"));
    }

    @Test
    void testExecutePeriodComparison_RunsConcurrently() {
        // Given
        AnalyticsQueryParams params = comparisonParams();
        stubMetadata();
        when(cache.getQueryResult(any(), eq(context))).thenReturn(Optional.empty());

        // Each half only returns once both are in flight
        CountDownLatch bothRunning = new CountDownLatch(2);
        when(sqlExecutor.query(any())).thenAnswer(invocation -> {
            bothRunning.countDown();
            if (!bothRunning.await(5, TimeUnit.SECONDS)) {
                throw new IllegalStateException("halves did not overlap");
            }
            SqlFragment statement = invocation.getArgument(0);
            LocalDate start = statement.getParams().contains(FEB_1) ? FEB_1 : MARCH_1;
            return List.of(row("AR", start));
        });

        // When
        QueryResult result = queryExecutor.executePeriodComparison(params, context);

        // Then
        assertEquals(2, result.getRowCount());
        Map<String, Object> current = result.getRows().get(0);
        Map<String, Object> comparison = result.getRows().get(1);
        assertEquals("current", current.get("comparison_period"));
        assertEquals("Current Period", current.get("comparison_label"));
        assertEquals(MARCH_1, current.get("date_index"));
        assertEquals("comparison", comparison.get("comparison_period"));
        assertEquals("Previous Month", comparison.get("comparison_label"));
        assertEquals(FEB_1, comparison.get("date_index"));
        verify(sqlExecutor, times(2)).query(any());
    }

    @Test
    void testExecutePeriodComparison_FailureCancelsSibling() throws Exception {
        // Given
        AnalyticsQueryParams params = comparisonParams();
        stubMetadata();
        when(cache.getQueryResult(any(), eq(context))).thenReturn(Optional.empty());

        CountDownLatch currentStarted = new CountDownLatch(1);
        CountDownLatch currentInterrupted = new CountDownLatch(1);
        when(sqlExecutor.query(any())).thenAnswer(invocation -> {
            SqlFragment statement = invocation.getArgument(0);
            if (statement.getParams().contains(FEB_1)) {
                currentStarted.await(5, TimeUnit.SECONDS);
                throw new DataIntegrityViolationException("comparison failed");
            }
            currentStarted.countDown();
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                currentInterrupted.countDown();
                throw new IllegalStateException("interrupted");
            }
            return List.of(row("AR", MARCH_1));
        });

        // When
        QueryExecutionException e = assertThrows(QueryExecutionException.class,
                () -> queryExecutor.executePeriodComparison(params, context));

        // Then
        assertEquals("Period comparison query failed", e.getMessage());
        assertTrue(currentInterrupted.await(5, TimeUnit.SECONDS), "sibling query was not cancelled");
    }

    @Test
    void testExecutePeriodComparison_Timeout() throws Exception {
        // Given
        properties.getExecution().setComparisonTimeoutSeconds(1);
        AnalyticsQueryParams params = comparisonParams();
        stubMetadata();
        when(cache.getQueryResult(any(), eq(context))).thenReturn(Optional.empty());

        CountDownLatch interrupted = new CountDownLatch(2);
        when(sqlExecutor.query(any())).thenAnswer(invocation -> {
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
                throw new IllegalStateException("interrupted");
            }
            return List.of();
        });

        // When
        QueryExecutionException e = assertThrows(QueryExecutionException.class,
                () -> queryExecutor.executePeriodComparison(params, context));

        // Then
        assertTrue(e.isTransientFailure());
        assertTrue(interrupted.await(5, TimeUnit.SECONDS));
    }

    @Test
    void testExecutePeriodComparison_SamePeriodLastYearRange() {
        AnalyticsQueryParams params = comparisonParams().toBuilder()
                .periodComparison(PeriodComparison.builder()
                        .enabled(true)
                        .comparisonType(ComparisonType.SAME_PERIOD_LAST_YEAR)
                        .build())
                .build();
        stubMetadata();
        when(cache.getQueryResult(any(), eq(context))).thenReturn(Optional.empty());
        when(sqlExecutor.query(any())).thenReturn(List.of());

        QueryResult result = queryExecutor.executePeriodComparison(params, context);

        assertEquals(0, result.getRowCount());
        ArgumentCaptor<SqlFragment> statements = ArgumentCaptor.forClass(SqlFragment.class);
        verify(sqlExecutor, times(2)).query(statements.capture());
        assertTrue(statements.getAllValues().stream()
                .anyMatch(s -> s.getParams().contains(LocalDate.of(2023, 3, 1))));
    }

    private void stubMetadata() {
        when(configService.getConfig(1)).thenReturn(config);
        when(columnMappingService.getMappings(config)).thenReturn(mappings);
    }

    private AnalyticsQueryParams baseParams() {
        return AnalyticsQueryParams.builder()
                .dataSourceId(1)
                .measure("AR")
                .frequency("Monthly")
                .build();
    }

    private AnalyticsQueryParams comparisonParams() {
        return baseParams().toBuilder()
                .startDate(MARCH_1)
                .endDate(LocalDate.of(2024, 3, 31))
                .periodComparison(PeriodComparison.builder()
                        .enabled(true)
                        .comparisonType(ComparisonType.PREVIOUS_PERIOD)
                        .build())
                .build();
    }

    private static Map<String, Object> row(String measure, LocalDate date) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("measure", measure);
        row.put("frequency", "Monthly");
        row.put("date_index", date);
        row.put("measure_value", new BigDecimal("100.00"));
        row.put("measure_type", "currency");
        return row;
    }
}
