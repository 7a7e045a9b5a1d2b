package com.plantwatch.detector.repository;

import com.plantwatch.detector.model.AnomalyRecord;
import com.plantwatch.detector.model.VariableAnomalyStats;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Primary;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
@Primary
public class JdbcAnomalyRecordRepository implements AnomalyRecordRepository {
    private static final Logger log = LoggerFactory.getLogger(JdbcAnomalyRecordRepository.class);

    static final int CHUNK_SIZE = 1000;

    private static final String INSERT_SQL = """
            INSERT INTO anomaly_records (
                variable_id, record_time, actual_value, point_estimate, lower_bound, upper_bound,
                residual, outside_interval, high_residual, is_anomaly, anomaly_score,
                prediction_error_pct, source_tag, processed_at)
            VALUES (
                :variableId, :recordTime, :actualValue, :pointEstimate, :lowerBound, :upperBound,
                :residual, :outsideInterval, :highResidual, :anomaly, :anomalyScore,
                :predictionErrorPct, :sourceTag, now())
            """;

    private final NamedParameterJdbcTemplate jdbcTemplate;

    public JdbcAnomalyRecordRepository(NamedParameterJdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    @Transactional
    public int appendBatch(List<AnomalyRecord> records) {
        if (records.isEmpty()) {
            return 0;
        }
        int written = 0;
        for (int start = 0; start < records.size(); start += CHUNK_SIZE) {
            List<AnomalyRecord> chunk = records.subList(start, Math.min(records.size(), start + CHUNK_SIZE));
            MapSqlParameterSource[] params = chunk.stream()
                    .map(JdbcAnomalyRecordRepository::toParams)
                    .toArray(MapSqlParameterSource[]::new);
            jdbcTemplate.batchUpdate(INSERT_SQL, params);
            written += chunk.size();
        }
        log.debug("Appended {} anomaly records", written);
        return written;
    }

    @Override
    public Optional<Instant> findMaxTimestamp(Collection<String> variables) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        String sql = "SELECT max(record_time) AS max_time FROM anomaly_records";
        if (variables != null && !variables.isEmpty()) {
            sql += " WHERE variable_id IN (:variables)";
            params.addValue("variables", variables);
        }
        Timestamp max = jdbcTemplate.queryForObject(sql, params, (rs, rowNum) -> rs.getTimestamp("max_time"));
        return Optional.ofNullable(max).map(Timestamp::toInstant);
    }

    @Override
    public List<AnomalyRecord> findBetween(Instant fromInclusive, Instant toExclusive, String variableId, boolean onlyAnomalies, int limit) {
        StringBuilder sql = new StringBuilder("""
                SELECT variable_id, record_time, actual_value, point_estimate, lower_bound, upper_bound,
                       residual, outside_interval, high_residual, is_anomaly, anomaly_score,
                       prediction_error_pct, source_tag
                FROM anomaly_records
                WHERE 1 = 1
                """);
        MapSqlParameterSource params = new MapSqlParameterSource().addValue("limit", limit);
        appendRange(sql, params, fromInclusive, toExclusive);
        if (variableId != null) {
            sql.append(" AND variable_id = :variableId");
            params.addValue("variableId", variableId);
        }
        if (onlyAnomalies) {
            sql.append(" AND is_anomaly");
        }
        sql.append(" ORDER BY record_time, variable_id LIMIT :limit");
        return new ArrayList<>(jdbcTemplate.query(sql.toString(), params, this::mapRecord));
    }

    @Override
    public List<VariableAnomalyStats> aggregateByVariable(Instant fromInclusive, Instant toExclusive) {
        StringBuilder sql = new StringBuilder("""
                SELECT variable_id,
                       count(*) AS n_points,
                       count(*) FILTER (WHERE is_anomaly) AS n_anomalies,
                       avg(anomaly_score) AS avg_score,
                       max(anomaly_score) AS max_score,
                       avg(residual) AS avg_residual,
                       stddev_samp(residual) AS std_residual
                FROM anomaly_records
                WHERE 1 = 1
                """);
        MapSqlParameterSource params = new MapSqlParameterSource();
        appendRange(sql, params, fromInclusive, toExclusive);
        sql.append(" GROUP BY variable_id ORDER BY variable_id");
        return jdbcTemplate.query(sql.toString(), params, (rs, rowNum) -> new VariableAnomalyStats(
                rs.getString("variable_id"),
                rs.getLong("n_points"),
                rs.getLong("n_anomalies"),
                rs.getDouble("avg_score"),
                rs.getDouble("max_score"),
                rs.getDouble("avg_residual"),
                rs.getObject("std_residual") != null ? rs.getDouble("std_residual") : null
        ));
    }

    private static void appendRange(StringBuilder sql, MapSqlParameterSource params, Instant fromInclusive, Instant toExclusive) {
        if (fromInclusive != null) {
            sql.append(" AND record_time >= :from");
            params.addValue("from", Timestamp.from(fromInclusive));
        }
        if (toExclusive != null) {
            sql.append(" AND record_time < :to");
            params.addValue("to", Timestamp.from(toExclusive));
        }
    }

    private static MapSqlParameterSource toParams(AnomalyRecord record) {
        return new MapSqlParameterSource()
                .addValue("variableId", record.variableId())
                .addValue("recordTime", Timestamp.from(record.timestamp()))
                .addValue("actualValue", record.actualValue())
                .addValue("pointEstimate", record.pointEstimate())
                .addValue("lowerBound", finiteOrNull(record.lowerBound()))
                .addValue("upperBound", finiteOrNull(record.upperBound()))
                .addValue("residual", record.residual())
                .addValue("outsideInterval", record.outsideInterval())
                .addValue("highResidual", record.highResidual())
                .addValue("anomaly", record.anomaly())
                .addValue("anomalyScore", record.anomalyScore())
                .addValue("predictionErrorPct", record.predictionErrorPct())
                .addValue("sourceTag", record.sourceTag());
    }

    private static Double finiteOrNull(double value) {
        return Double.isFinite(value) ? value : null;
    }

    private AnomalyRecord mapRecord(ResultSet rs, int rowNum) throws SQLException {
        return new AnomalyRecord(
                rs.getString("variable_id"),
                rs.getTimestamp("record_time").toInstant(),
                rs.getDouble("actual_value"),
                rs.getDouble("point_estimate"),
                doubleOrNaN(rs, "lower_bound"),
                doubleOrNaN(rs, "upper_bound"),
                rs.getDouble("residual"),
                rs.getBoolean("outside_interval"),
                rs.getBoolean("high_residual"),
                rs.getBoolean("is_anomaly"),
                rs.getDouble("anomaly_score"),
                rs.getObject("prediction_error_pct") != null ? rs.getDouble("prediction_error_pct") : null,
                rs.getString("source_tag")
        );
    }

    private static double doubleOrNaN(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? Double.NaN : value;
    }
}
