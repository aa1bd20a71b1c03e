package com.queryengine.domain.model;

import lombok.Value;

import java.util.List;

/**
 * SQL text with {@code $n} placeholders and the values bound to them, in order.
 */
@Value
public class SqlFragment {

    String sql;
    List<Object> params;

    public SqlFragment(String sql, List<Object> params) {
        this.sql = sql;
        this.params = List.copyOf(params);
    }

    public static SqlFragment of(String sql) {
        return new SqlFragment(sql, List.of());
    }
}
