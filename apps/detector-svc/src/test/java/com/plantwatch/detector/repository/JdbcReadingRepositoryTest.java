package com.plantwatch.detector.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.plantwatch.detector.model.Reading;
import java.sql.ResultSet;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;

class JdbcReadingRepositoryTest {

    private static final Instant AFTER = Instant.parse("2024-03-01T10:00:00Z");

    private final NamedParameterJdbcTemplate jdbcTemplate = mock(NamedParameterJdbcTemplate.class);
    private final JdbcReadingRepository repository = new JdbcReadingRepository(jdbcTemplate);

    @Test
    void findAfterLimitsDistinctTimestampsRatherThanRows() {
        repository.findAfter(AFTER, List.of("A", "B"), 500);

        Query query = captureQuery();
        assertThat(query.sql())
                .contains("SELECT DISTINCT reading_time")
                .contains("ORDER BY reading_time\n")
                .contains("LIMIT :limit")
                .endsWith("ORDER BY reading_time, variable_id\n");
        assertThat(query.sql().split("variable_id IN \\(:variables\\)", -1)).hasSize(3);
        assertThat(query.sql().split("reading_time > :after", -1)).hasSize(3);
        assertThat(query.params().getValue("after")).isEqualTo(Timestamp.from(AFTER));
        assertThat(query.params().getValue("limit")).isEqualTo(500);
        assertThat(query.params().getValue("variables")).isEqualTo(List.of("A", "B"));
    }

    @Test
    void findAfterWithoutVariablesReadsWholeFeed() {
        repository.findAfter(AFTER, List.of(), 10);

        Query query = captureQuery();
        assertThat(query.sql()).doesNotContain("variable_id IN");
        assertThat(query.params().hasValue("variables")).isFalse();
    }

    @Test
    void findBetweenAppliesOnlyGivenBounds() {
        Instant to = AFTER.plusSeconds(3600);

        repository.findBetween(null, to, null);

        Query query = captureQuery();
        assertThat(query.sql())
                .doesNotContain(":from")
                .contains("AND reading_time < :to")
                .endsWith("ORDER BY reading_time, variable_id");
        assertThat(query.params().getValue("to")).isEqualTo(Timestamp.from(to));
    }

    @Test
    void nullValueColumnBecomesNaN() throws Exception {
        repository.findAfter(AFTER, List.of(), 10);
        RowMapper<Reading> mapper = captureQuery().mapper();
        ResultSet rs = mock(ResultSet.class);
        when(rs.getDouble("value")).thenReturn(0.0d);
        when(rs.wasNull()).thenReturn(true);
        when(rs.getString("variable_id")).thenReturn("TI-1");
        when(rs.getTimestamp("reading_time")).thenReturn(Timestamp.from(AFTER));
        when(rs.getString("source_tag")).thenReturn("opc");

        Reading reading = mapper.mapRow(rs, 0);

        assertThat(reading.variableId()).isEqualTo("TI-1");
        assertThat(reading.timestamp()).isEqualTo(AFTER);
        assertThat(reading.value()).isNaN();
        assertThat(reading.sourceTag()).isEqualTo("opc");
    }

    @SuppressWarnings("unchecked")
    private Query captureQuery() {
        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<SqlParameterSource> params = ArgumentCaptor.forClass(SqlParameterSource.class);
        ArgumentCaptor<RowMapper<Reading>> mapper = ArgumentCaptor.forClass(RowMapper.class);
        verify(jdbcTemplate).query(sql.capture(), params.capture(), mapper.capture());
        return new Query(sql.getValue(), params.getValue(), mapper.getValue());
    }

    private record Query(String sql, SqlParameterSource params, RowMapper<Reading> mapper) {
    }
}
