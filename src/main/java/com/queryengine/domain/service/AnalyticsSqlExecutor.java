package com.queryengine.domain.service;

import com.queryengine.domain.model.SqlFragment;

import java.util.List;
import java.util.Map;

/**
 * Boundary to the analytics store.
 *
 * Receives SQL with {@code $n} placeholders and the ordered values bound to
 * them. Implementations must be safe for concurrent use and must surface
 * failures as Spring {@code DataAccessException}s so transient errors can be
 * told apart from fatal ones.
 */
public interface AnalyticsSqlExecutor {

    List<Map<String, Object>> query(SqlFragment statement);
}
