package com.queryengine.domain.service;

import com.queryengine.config.QueryEngineConfig;
import com.queryengine.config.QueryEngineProperties;
import com.queryengine.domain.exception.QueryEngineException;
import com.queryengine.domain.exception.QueryExecutionException;
import com.queryengine.domain.exception.QueryValidationException;
import com.queryengine.domain.model.AnalyticsQueryParams;
import com.queryengine.domain.model.ColumnMappings;
import com.queryengine.domain.model.DataSourceConfig;
import com.queryengine.domain.model.DateRange;
import com.queryengine.domain.model.FilterOperator;
import com.queryengine.domain.model.PeriodComparison;
import com.queryengine.domain.model.QueryFilter;
import com.queryengine.domain.model.QueryResult;
import com.queryengine.domain.model.SecurityContext;
import com.queryengine.domain.model.SeriesSpec;
import com.queryengine.domain.model.SqlFragment;
import com.queryengine.infrastructure.cache.AnalyticsCache;
import io.github.resilience4j.retry.Retry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs analytics queries against the analytics store.
 *
 * Query Flow ({@link #executeCore}):
 * 1. Fail closed when the context grants no tenants
 * 2. Check the result cache (key bound to the security context)
 * 3. Resolve data source config and column mappings (long-TTL cache)
 * 4. Build parameterized SQL, run it with retry on transient failures
 * 5. Optionally run the summary aggregation
 * 6. Hand the result to the cache writer without waiting for it
 *
 * Multi-series and period-comparison execution are thin wrappers that derive
 * new params and call {@link #executeCore} directly. Neither goes back through
 * the orchestrator's routing.
 */
@Slf4j
@Service
public class QueryExecutor {

    static final String SERIES_ID = "series_id";
    static final String SERIES_LABEL = "series_label";
    static final String SERIES_AGGREGATION = "series_aggregation";
    static final String SERIES_COLOR = "series_color";
    static final String COMPARISON_PERIOD = "comparison_period";
    static final String COMPARISON_LABEL = "comparison_label";

    private static final String DEFAULT_SERIES_AGGREGATION = "sum";
    private static final String CURRENT_PERIOD_LABEL = "Current Period";

    private final AnalyticsSqlExecutor sqlExecutor;
    private final AnalyticsCache cache;
    private final DataSourceConfigService configService;
    private final ColumnMappingService columnMappingService;
    private final FilterListBuilder filterListBuilder;
    private final QueryBuilder queryBuilder;
    private final ComparisonPeriodCalculator periodCalculator;
    private final AsyncTaskExecutor taskExecutor;
    private final Retry retry;
    private final MeterRegistry meterRegistry;
    private final QueryEngineProperties properties;

    public QueryExecutor(AnalyticsSqlExecutor sqlExecutor,
                         AnalyticsCache cache,
                         DataSourceConfigService configService,
                         ColumnMappingService columnMappingService,
                         FilterListBuilder filterListBuilder,
                         QueryBuilder queryBuilder,
                         ComparisonPeriodCalculator periodCalculator,
                         @Qualifier("analyticsTaskExecutor") AsyncTaskExecutor taskExecutor,
                         Retry analyticsQueryRetry,
                         MeterRegistry meterRegistry,
                         QueryEngineProperties properties) {
        this.sqlExecutor = sqlExecutor;
        this.cache = cache;
        this.configService = configService;
        this.columnMappingService = columnMappingService;
        this.filterListBuilder = filterListBuilder;
        this.queryBuilder = queryBuilder;
        this.periodCalculator = periodCalculator;
        this.taskExecutor = taskExecutor;
        this.retry = analyticsQueryRetry;
        this.meterRegistry = meterRegistry;
        this.properties = properties;

        this.retry.getEventPublisher().onRetry(event -> {
            log.warn("Retrying analytics query (attempt {}): {}",
                    event.getNumberOfRetryAttempts(), event.getLastThrowable().getClass().getSimpleName());
            Counter.builder("query.retry")
                    .register(meterRegistry)
                    .increment();
        });
    }

    /**
     * Single, non-recursive execution of one query shape.
     */
    public QueryResult executeCore(AnalyticsQueryParams params, SecurityContext context) {
        Timer.Sample sample = Timer.start(meterRegistry);
        long startTime = System.currentTimeMillis();

        if (!context.hasTenantAccess()) {
            log.warn("No accessible tenants for user {}, returning empty result", context.getUserId());
            return QueryResult.empty(System.currentTimeMillis() - startTime);
        }

        try {
            if (!params.isNoCache()) {
                Optional<QueryResult> cached = cache.getQueryResult(params, context);
                if (cached.isPresent()) {
                    recordCache("hit");
                    QueryResult result = cached.get();
                    result.setCacheHit(true);
                    return result;
                }
            }
            recordCache("miss");

            DataSourceConfig config = configService.getConfig(params.getDataSourceId());
            ColumnMappings mappings = columnMappingService.getMappings(config);
            List<QueryFilter> filters = filterListBuilder.build(params, mappings);

            SqlFragment where = queryBuilder.buildWhereClause(filters, context, config);
            List<Map<String, Object>> rows = run(queryBuilder.buildSelectQuery(config, mappings, where));

            BigDecimal total = null;
            if (params.isIncludeTotals()) {
                total = sumTotals(run(queryBuilder.buildAggregationQuery(config, mappings, where)));
            }

            long queryTime = System.currentTimeMillis() - startTime;
            QueryResult result = QueryResult.builder()
                    .rows(rows)
                    .rowCount(rows.size())
                    .total(total)
                    .queryTimeMs(queryTime)
                    .cacheHit(false)
                    .build();

            writeCache(params, context, result);

            sample.stop(Timer.builder("query.latency")
                    .tag("strategy", "core")
                    .tag("cached", "false")
                    .register(meterRegistry));
            recordExecuted("core", "success");

            log.info("Analytics query completed: data source {}, {} rows, {} ms, user {}",
                    params.getDataSourceId(), rows.size(), queryTime, context.getUserId());
            return result;

        } catch (QueryEngineException e) {
            recordExecuted("core", "error");
            throw e;
        }
    }

    /**
     * All series in one statement: the measure predicate becomes
     * {@code measure = ANY($n)} and rows are split back out per series here.
     */
    public QueryResult executeMultipleSeries(AnalyticsQueryParams params, SecurityContext context) {
        if (!params.hasMultipleSeries()) {
            throw new QueryValidationException("multipleSeries", "multiple series configuration is required");
        }
        long startTime = System.currentTimeMillis();
        List<SeriesSpec> series = params.getMultipleSeries();

        LinkedHashSet<String> measures = new LinkedHashSet<>();
        series.forEach(s -> measures.add(s.getMeasure()));

        List<QueryFilter> filters = new ArrayList<>();
        filters.add(QueryFilter.of(ColumnMappings.MEASURE_FIELD, FilterOperator.IN, List.copyOf(measures)));
        if (params.getFilters() != null) {
            filters.addAll(params.getFilters());
        }

        AnalyticsQueryParams consolidated = params.toBuilder()
                .measure(null)
                .multipleSeries(null)
                .periodComparison(null)
                .filters(filters)
                .build();

        log.info("Consolidated {} series into one query for user {}", series.size(), context.getUserId());
        QueryResult combined = executeCore(consolidated, context);

        List<Map<String, Object>> tagged = tagSeries(combined.getRows(), series);
        long queryTime = System.currentTimeMillis() - startTime;
        recordStrategy("multiple_series", queryTime);

        return QueryResult.builder()
                .rows(tagged)
                .rowCount(tagged.size())
                .total(combined.getTotal())
                .queryTimeMs(queryTime)
                .cacheHit(combined.isCacheHit())
                .build();
    }

    /**
     * Current and comparison ranges run concurrently through {@link #executeCore}.
     * Either failing, a timeout, or interruption of the calling thread cancels
     * both and raises one error; partial results are never returned.
     */
    public QueryResult executePeriodComparison(AnalyticsQueryParams params, SecurityContext context) {
        if (!params.hasPeriodComparison()) {
            throw new QueryValidationException("periodComparison", "period comparison configuration is required");
        }
        long startTime = System.currentTimeMillis();
        PeriodComparison comparison = params.getPeriodComparison();

        DateRange currentRange = params.currentRange();
        if (currentRange == null) {
            throw new QueryValidationException("periodComparison", "start date and end date are required");
        }
        DateRange comparisonRange = periodCalculator.calculate(currentRange, params.getFrequency(), comparison);
        String comparisonLabel = periodCalculator.label(params.getFrequency(), comparison);

        AnalyticsQueryParams currentParams = params.toBuilder()
                .periodComparison(null)
                .multipleSeries(null)
                .startDate(currentRange.getStart())
                .endDate(currentRange.getEnd())
                .build();
        AnalyticsQueryParams comparisonParams = currentParams.toBuilder()
                .startDate(comparisonRange.getStart())
                .endDate(comparisonRange.getEnd())
                .build();

        log.info("Period comparison {} -> {} for user {}", currentRange, comparisonRange, context.getUserId());
        List<QueryResult> results = executeConcurrently(List.of(currentParams, comparisonParams), context);
        QueryResult current = results.get(0);
        QueryResult previous = results.get(1);

        if (current.getRowCount() == 0) {
            log.warn("No data found for current period {}", currentRange);
        }
        if (previous.getRowCount() == 0) {
            log.warn("No data found for comparison period {}", comparisonRange);
        }

        List<Map<String, Object>> rows = new ArrayList<>(current.getRowCount() + previous.getRowCount());
        rows.addAll(tagPeriod(current.getRows(), "current", CURRENT_PERIOD_LABEL));
        rows.addAll(tagPeriod(previous.getRows(), "comparison", comparisonLabel));

        long queryTime = System.currentTimeMillis() - startTime;
        recordStrategy("period_comparison", queryTime);

        return QueryResult.builder()
                .rows(rows)
                .rowCount(rows.size())
                .total(current.getTotal())
                .queryTimeMs(queryTime)
                .cacheHit(current.isCacheHit() || previous.isCacheHit())
                .build();
    }

    private List<QueryResult> executeConcurrently(List<AnalyticsQueryParams> paramSets, SecurityContext context) {
        ExecutorCompletionService<QueryResult> completion = new ExecutorCompletionService<>(taskExecutor);
        List<Future<QueryResult>> futures = new ArrayList<>(paramSets.size());
        long deadline = System.nanoTime()
                + TimeUnit.SECONDS.toNanos(properties.getExecution().getComparisonTimeoutSeconds());

        try {
            for (AnalyticsQueryParams subParams : paramSets) {
                futures.add(completion.submit(() -> executeCore(subParams, context)));
            }

            // Fail fast: whichever finishes first is checked first
            for (int i = 0; i < futures.size(); i++) {
                Future<QueryResult> done = completion.poll(deadline - System.nanoTime(), TimeUnit.NANOSECONDS);
                if (done == null) {
                    throw new TimeoutException();
                }
                done.get();
            }

            List<QueryResult> results = new ArrayList<>(futures.size());
            for (Future<QueryResult> future : futures) {
                results.add(future.get());
            }
            return results;

        } catch (InterruptedException e) {
            cancelAll(futures);
            Thread.currentThread().interrupt();
            throw new QueryExecutionException("Period comparison was cancelled", false, e);
        } catch (TimeoutException e) {
            cancelAll(futures);
            throw new QueryExecutionException("Period comparison timed out", true, e);
        } catch (RejectedExecutionException e) {
            cancelAll(futures);
            throw new QueryExecutionException("Period comparison could not be scheduled", true, e);
        } catch (ExecutionException e) {
            cancelAll(futures);
            Throwable cause = e.getCause();
            log.error("Period comparison sub-query failed: {}", cause.getMessage());
            if (cause instanceof QueryValidationException) {
                throw (QueryValidationException) cause;
            }
            boolean transientFailure = cause instanceof QueryExecutionException
                    && ((QueryExecutionException) cause).isTransientFailure();
            throw new QueryExecutionException("Period comparison query failed", transientFailure, cause);
        }
    }

    private void cancelAll(List<Future<QueryResult>> futures) {
        futures.forEach(future -> future.cancel(true));
    }

    private List<Map<String, Object>> run(SqlFragment statement) {
        try {
            return Retry.decorateSupplier(retry, () -> sqlExecutor.query(statement)).get();
        } catch (DataAccessException e) {
            log.error("Analytics query failed: {}", e.getClass().getSimpleName());
            if (QueryEngineConfig.isTransient(e)) {
                throw QueryExecutionException.transientFailure(e);
            }
            throw QueryExecutionException.fatal(e);
        }
    }

    private void writeCache(AnalyticsQueryParams params, SecurityContext context, QueryResult result) {
        try {
            taskExecutor.execute(() -> cache.setQueryResult(params, context, result));
        } catch (RejectedExecutionException e) {
            log.warn("Skipping result cache write, executor saturated");
        }
    }

    private static BigDecimal sumTotals(List<Map<String, Object>> totals) {
        BigDecimal sum = BigDecimal.ZERO;
        for (Map<String, Object> row : totals) {
            Object value = row.get("total");
            if (value != null) {
                sum = sum.add(new BigDecimal(value.toString()));
            }
        }
        return sum;
    }

    private static List<Map<String, Object>> tagSeries(List<Map<String, Object>> rows, List<SeriesSpec> series) {
        Map<String, List<Map<String, Object>>> byMeasure = new LinkedHashMap<>();
        for (Map<String, Object> row : rows) {
            Object measure = row.get(ColumnMappings.MEASURE_FIELD);
            byMeasure.computeIfAbsent(String.valueOf(measure), k -> new ArrayList<>()).add(row);
        }

        List<Map<String, Object>> tagged = new ArrayList<>(rows.size());
        for (SeriesSpec seriesSpec : series) {
            for (Map<String, Object> row : byMeasure.getOrDefault(seriesSpec.getMeasure(), List.of())) {
                Map<String, Object> copy = new LinkedHashMap<>(row);
                copy.put(SERIES_ID, seriesSpec.getId() != null ? seriesSpec.getId() : seriesSpec.getMeasure());
                copy.put(SERIES_LABEL, seriesSpec.getLabel() != null ? seriesSpec.getLabel() : seriesSpec.getMeasure());
                copy.put(SERIES_AGGREGATION, seriesSpec.getAggregation() != null ? seriesSpec.getAggregation() : DEFAULT_SERIES_AGGREGATION);
                if (seriesSpec.getColor() != null) {
                    copy.put(SERIES_COLOR, seriesSpec.getColor());
                }
                tagged.add(copy);
            }
        }
        return tagged;
    }

    private static List<Map<String, Object>> tagPeriod(List<Map<String, Object>> rows, String period, String label) {
        List<Map<String, Object>> tagged = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            Map<String, Object> copy = new LinkedHashMap<>(row);
            copy.put(COMPARISON_PERIOD, period);
            copy.put(COMPARISON_LABEL, label);
            tagged.add(copy);
        }
        return tagged;
    }

    private void recordCache(String outcome) {
        Counter.builder("query.cache")
                .tag("result", outcome)
                .register(meterRegistry)
                .increment();
    }

    private void recordExecuted(String strategy, String outcome) {
        Counter.builder("query.executed")
                .tag("strategy", strategy)
                .tag("result", outcome)
                .register(meterRegistry)
                .increment();
    }

    private void recordStrategy(String strategy, long queryTimeMs) {
        Timer.builder("query.latency")
                .tag("strategy", strategy)
                .tag("cached", "n/a")
                .register(meterRegistry)
                .record(queryTimeMs, TimeUnit.MILLISECONDS);
        recordExecuted(strategy, "success");
    }
}
