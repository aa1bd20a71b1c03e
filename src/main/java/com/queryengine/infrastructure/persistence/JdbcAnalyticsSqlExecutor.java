package com.queryengine.infrastructure.persistence;

import com.queryengine.config.QueryEngineProperties;
import com.queryengine.domain.model.SqlFragment;
import com.queryengine.domain.service.AnalyticsSqlExecutor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.ColumnMapRowMapper;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.PreparedStatementCreator;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.sql.Array;
import java.sql.Connection;
import java.sql.Date;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Runs builder output against PostgreSQL through {@link JdbcTemplate}.
 *
 * The builder numbers placeholders {@code $1..$n}; JDBC wants positional
 * {@code ?}. Each occurrence is rewritten in order and bound to the matching
 * parameter, so a placeholder may appear more than once. List parameters are
 * bound as SQL arrays for {@code = ANY} and {@code <> ALL}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JdbcAnalyticsSqlExecutor implements AnalyticsSqlExecutor {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\$(\\d+)");

    private final JdbcTemplate jdbcTemplate;
    private final QueryEngineProperties properties;

    @Override
    public List<Map<String, Object>> query(SqlFragment statement) {
        PositionalStatement positional = toPositional(statement);
        int timeoutSeconds = properties.getExecution().getQueryTimeoutSeconds();

        PreparedStatementCreator creator = connection -> {
            PreparedStatement ps = connection.prepareStatement(positional.sql());
            ps.setQueryTimeout(timeoutSeconds);
            for (int i = 0; i < positional.args().size(); i++) {
                bind(connection, ps, i + 1, positional.args().get(i));
            }
            return ps;
        };

        List<Map<String, Object>> rows = jdbcTemplate.query(creator, new AnalyticsRowMapper());
        log.debug("Analytics statement returned {} rows", rows.size());
        return rows;
    }

    static PositionalStatement toPositional(SqlFragment statement) {
        Matcher matcher = PLACEHOLDER.matcher(statement.getSql());
        StringBuilder sql = new StringBuilder();
        List<Object> args = new ArrayList<>();

        while (matcher.find()) {
            int index = Integer.parseInt(matcher.group(1));
            if (index < 1 || index > statement.getParams().size()) {
                throw new IllegalArgumentException("Placeholder $" + index + " has no bound parameter");
            }
            args.add(statement.getParams().get(index - 1));
            matcher.appendReplacement(sql, "?");
        }
        matcher.appendTail(sql);

        return new PositionalStatement(sql.toString(), List.copyOf(args));
    }

    private static void bind(Connection connection, PreparedStatement ps, int position, Object value)
            throws SQLException {
        if (value instanceof Collection) {
            ps.setArray(position, toSqlArray(connection, (Collection<?>) value));
        } else if (value instanceof LocalDate) {
            ps.setDate(position, Date.valueOf((LocalDate) value));
        } else {
            ps.setObject(position, value);
        }
    }

    static Array toSqlArray(Connection connection, Collection<?> values) throws SQLException {
        String typeName = arrayElementType(values);
        Object[] elements = new Object[values.size()];
        int i = 0;
        for (Object value : values) {
            elements[i++] = switch (typeName) {
                case "numeric" -> new BigDecimal(value.toString());
                case "date" -> Date.valueOf((LocalDate) value);
                case "text" -> String.valueOf(value);
                default -> value;
            };
        }
        return connection.createArrayOf(typeName, elements);
    }

    static String arrayElementType(Collection<?> values) {
        if (!values.isEmpty() && values.stream().allMatch(v -> v instanceof Integer)) {
            return "integer";
        }
        if (!values.isEmpty() && values.stream().allMatch(v -> v instanceof Integer || v instanceof Long)) {
            return "bigint";
        }
        if (!values.isEmpty() && values.stream().allMatch(v -> v instanceof Number)) {
            return "numeric";
        }
        if (!values.isEmpty() && values.stream().allMatch(v -> v instanceof LocalDate)) {
            return "date";
        }
        if (!values.isEmpty() && values.stream().allMatch(v -> v instanceof Boolean)) {
            return "boolean";
        }
        return "text";
    }

    static final class PositionalStatement {

        private final String sql;
        private final List<Object> args;

        PositionalStatement(String sql, List<Object> args) {
            this.sql = sql;
            this.args = args;
        }

        String sql() {
            return sql;
        }

        List<Object> args() {
            return args;
        }
    }

    /**
     * Plain insertion-ordered rows with {@link LocalDate} in place of {@link java.sql.Date},
     * so rows serialize the same way whether fresh or cached.
     */
    private static final class AnalyticsRowMapper extends ColumnMapRowMapper {

        @Override
        protected Map<String, Object> createColumnMap(int columnCount) {
            return new LinkedHashMap<>(columnCount);
        }

        @Override
        protected Object getColumnValue(ResultSet rs, int index) throws SQLException {
            Object value = super.getColumnValue(rs, index);
            if (value instanceof Date) {
                return ((Date) value).toLocalDate();
            }
            return value;
        }
    }
}
