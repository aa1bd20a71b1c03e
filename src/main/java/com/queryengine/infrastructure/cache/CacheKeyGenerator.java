package com.queryengine.infrastructure.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.queryengine.config.QueryEngineProperties;
import com.queryengine.domain.model.AnalyticsQueryParams;
import com.queryengine.domain.model.QueryFilter;
import com.queryengine.domain.model.SecurityContext;
import com.queryengine.domain.model.SeriesSpec;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Builds every Redis key the engine uses.
 *
 * Result keys hash the query-relevant params together with the caller's
 * security context: sorted tenant ids, sorted sub-entity ids and the
 * permission scope. Two callers with identical params but different access
 * never share a key, so a result computed for one can never be served to the
 * other.
 *
 * Key Format:
 * - Result:   {prefix}:result:{ds:<id>}:<sha256>
 * - Columns:  {prefix}:columns:<schema>.<table>
 * - Config:   {prefix}:datasource:<id>
 */
@Component
@RequiredArgsConstructor
public class CacheKeyGenerator {

    // Sorted properties and map entries make the JSON, and so the digest, canonical
    private static final ObjectMapper CANONICAL_MAPPER = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .build();

    private final QueryEngineProperties properties;

    public String resultKey(AnalyticsQueryParams params, SecurityContext context) {
        return resultPrefix(params.getDataSourceId()) + digest(canonicalForm(params, context));
    }

    public String resultPattern(int dataSourceId) {
        return resultPrefix(dataSourceId) + "*";
    }

    public String columnMappingsKey(String table, String schema) {
        return prefix() + ":columns:" + schema + "." + table;
    }

    public String dataSourceConfigKey(int dataSourceId) {
        return prefix() + ":datasource:" + dataSourceId;
    }

    /**
     * Everything that changes the rows a query returns, security context included.
     */
    Map<String, Object> canonicalForm(AnalyticsQueryParams params, SecurityContext context) {
        Map<String, Object> form = new LinkedHashMap<>();
        form.put("dataSourceId", params.getDataSourceId());
        form.put("measure", params.getMeasure());
        form.put("frequency", params.getFrequency());
        form.put("startDate", params.getStartDate());
        form.put("endDate", params.getEndDate());
        form.put("filters", filterForms(params.getFilters()));
        form.put("series", seriesMeasures(params.getMultipleSeries()));
        form.put("includeTotals", params.isIncludeTotals());

        form.put("tenantIds", new TreeSet<>(context.getAccessibleTenantIds()));
        form.put("subEntityIds", new TreeSet<>(context.getAccessibleSubEntityIds()));
        form.put("permissionScope", context.getPermissionScope().name());
        return form;
    }

    String digest(Map<String, Object> form) {
        try {
            byte[] json = CANONICAL_MAPPER.writeValueAsBytes(form);
            MessageDigest sha256 = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(sha256.digest(json));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Query params are not serializable for cache key", e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private String resultPrefix(Integer dataSourceId) {
        // Hash tag keeps one data source's keys on one cluster slot
        return prefix() + ":result:{ds:" + dataSourceId + "}:";
    }

    private String prefix() {
        return properties.getCache().getKeyPrefix();
    }

    private static List<Map<String, Object>> filterForms(List<QueryFilter> filters) {
        List<Map<String, Object>> forms = new ArrayList<>();
        if (filters == null) {
            return forms;
        }
        for (QueryFilter filter : filters) {
            Map<String, Object> form = new LinkedHashMap<>();
            form.put("field", filter.getField());
            form.put("operator", filter.operatorOrDefault());
            form.put("value", filter.getValue());
            forms.add(form);
        }
        return forms;
    }

    private static List<String> seriesMeasures(List<SeriesSpec> series) {
        List<String> measures = new ArrayList<>();
        if (series != null) {
            series.forEach(s -> measures.add(s.getMeasure()));
        }
        return measures;
    }
}
