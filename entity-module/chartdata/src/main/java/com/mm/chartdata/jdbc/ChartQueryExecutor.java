package com.mm.chartdata.jdbc;

import com.mm.chartdata.query.CompiledQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.ResultSetMetaData;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs a {@link CompiledQuery} with every parameter bound. One call, one round trip.
 */
@Component
public class ChartQueryExecutor {
    private static final Logger log = LoggerFactory.getLogger(ChartQueryExecutor.class);

    private final int queryTimeoutSeconds;

    public ChartQueryExecutor(@Value("${CHART_QUERY_TIMEOUT_SECONDS:60}") int queryTimeoutSeconds) {
        this.queryTimeoutSeconds = queryTimeoutSeconds;
    }

    public List<Map<String, Object>> execute(DataSource dataSource, CompiledQuery query) {
        return execute(dataSource, query, 0);
    }

    /**
     * @param maxRows driver-side row cap, 0 for none
     * @throws QueryExecutionException on any driver failure
     */
    public List<Map<String, Object>> execute(DataSource dataSource, CompiledQuery query, int maxRows) {
        JdbcTemplate jdbc = new JdbcTemplate(dataSource);
        jdbc.setQueryTimeout(queryTimeoutSeconds);
        if (maxRows > 0) jdbc.setMaxRows(maxRows);
        NamedParameterJdbcTemplate named = new NamedParameterJdbcTemplate(jdbc);

        log.debug("Executing chart query params={}\n{}", query.parameterNames(), query.sql());
        try {
            return named.query(query.sql(), new MapSqlParameterSource(query.parameterMap()), (rs, rowNum) -> {
                ResultSetMetaData md = rs.getMetaData();
                int cols = md.getColumnCount();
                Map<String, Object> row = new LinkedHashMap<>();
                for (int i = 1; i <= cols; i++) {
                    row.put(md.getColumnLabel(i), normalize(rs.getObject(i)));
                }
                return row;
            });
        } catch (DataAccessException e) {
            String reason = e.getMostSpecificCause().getMessage();
            log.error("Chart query failed: {}", reason);
            throw new QueryExecutionException(reason != null ? reason : "Query execution failed", e);
        }
    }

    /** Driver types to JSON friendly values; dates become ISO text so both query paths agree. */
    static Object normalize(Object v) {
        if (v == null) return null;
        if (v instanceof java.sql.Date d) return d.toLocalDate().toString();
        if (v instanceof LocalDate d) return d.toString();
        if (v instanceof Timestamp ts) return ts.toLocalDateTime().toString();
        if (v instanceof LocalDateTime dt) return dt.toString();
        if (v instanceof byte[] b) return "(binary " + b.length + " bytes)";
        return v;
    }
}
