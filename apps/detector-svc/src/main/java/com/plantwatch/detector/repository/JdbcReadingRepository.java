package com.plantwatch.detector.repository;

import com.plantwatch.detector.model.Reading;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import org.springframework.context.annotation.Primary;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@Primary
public class JdbcReadingRepository implements ReadingRepository {

    private final NamedParameterJdbcTemplate jdbcTemplate;

    public JdbcReadingRepository(NamedParameterJdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public List<Reading> findAfter(Instant after, Collection<String> variables, int maxTimestamps) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("after", Timestamp.from(after))
                .addValue("limit", maxTimestamps);
        String variableFilter = "";
        if (variables != null && !variables.isEmpty()) {
            variableFilter = " AND variable_id IN (:variables)";
            params.addValue("variables", variables);
        }
        String sql = """
                SELECT reading_time, variable_id, value, source_tag
                FROM process_readings
                WHERE reading_time > :after
                """ + variableFilter + """
                 AND reading_time IN (
                    SELECT DISTINCT reading_time
                    FROM process_readings
                    WHERE reading_time > :after
                """ + variableFilter + """
                    ORDER BY reading_time
                    LIMIT :limit
                 )
                ORDER BY reading_time, variable_id
                """;
        return jdbcTemplate.query(sql, params, this::mapReading);
    }

    @Override
    public List<Reading> findBetween(Instant fromInclusive, Instant toExclusive, Collection<String> variables) {
        StringBuilder sql = new StringBuilder("""
                SELECT reading_time, variable_id, value, source_tag
                FROM process_readings
                WHERE 1 = 1
                """);
        MapSqlParameterSource params = new MapSqlParameterSource();
        if (fromInclusive != null) {
            sql.append(" AND reading_time >= :from");
            params.addValue("from", Timestamp.from(fromInclusive));
        }
        if (toExclusive != null) {
            sql.append(" AND reading_time < :to");
            params.addValue("to", Timestamp.from(toExclusive));
        }
        if (variables != null && !variables.isEmpty()) {
            sql.append(" AND variable_id IN (:variables)");
            params.addValue("variables", variables);
        }
        sql.append(" ORDER BY reading_time, variable_id");
        return jdbcTemplate.query(sql.toString(), params, this::mapReading);
    }

    private Reading mapReading(ResultSet rs, int rowNum) throws SQLException {
        double value = rs.getDouble("value");
        if (rs.wasNull()) {
            value = Double.NaN;
        }
        return new Reading(
                rs.getString("variable_id"),
                rs.getTimestamp("reading_time").toInstant(),
                value,
                rs.getString("source_tag")
        );
    }
}
