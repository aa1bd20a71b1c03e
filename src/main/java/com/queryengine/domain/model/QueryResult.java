package com.queryengine.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Result of an analytics query.
 *
 * Serialized as JSON into the short-TTL result cache.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryResult {

    private List<Map<String, Object>> rows;
    private int rowCount;

    // Summary total; null unless totals were requested
    private BigDecimal total;

    private long queryTimeMs;
    private boolean cacheHit;

    public static QueryResult empty(long queryTimeMs) {
        return QueryResult.builder()
                .rows(List.of())
                .rowCount(0)
                .queryTimeMs(queryTimeMs)
                .cacheHit(false)
                .build();
    }
}
