package com.plantwatch.detector.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.plantwatch.detector.entity.CheckpointEntity;
import com.plantwatch.detector.model.Checkpoint;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;

class PostgreSQLCheckpointRepositoryTest {

    private static final Instant T1 = Instant.parse("2024-03-01T10:10:00Z");
    private static final Instant T2 = Instant.parse("2024-03-01T10:20:00Z");
    private static final Instant NOW = Instant.parse("2024-03-02T00:00:00Z");

    private final JpaCheckpointRepository jpa = mock(JpaCheckpointRepository.class);
    private final PostgreSQLCheckpointRepository repository =
            new PostgreSQLCheckpointRepository(jpa, Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void advanceUpsertsThenReturnsStoredCheckpoint() {
        when(jpa.findById("global")).thenReturn(Optional.of(new CheckpointEntity("global", T2, NOW)));

        Checkpoint checkpoint = repository.advance("global", T1);

        verify(jpa).upsertMonotonic("global", T1, NOW);
        assertThat(checkpoint.lastProcessedAt()).isEqualTo(T2);
        assertThat(checkpoint.updatedAt()).isEqualTo(NOW);
    }

    @Test
    void advanceFailsWhenRowIsMissingAfterUpsert() {
        when(jpa.findById("global")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> repository.advance("global", T1))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("global");
    }

    @Test
    void findAllOrdersByStreamId() {
        when(jpa.findAll()).thenReturn(List.of(
                new CheckpointEntity("tanks", T1, NOW),
                new CheckpointEntity("boiler", T2, NOW)));

        assertThat(repository.findAll()).extracting(Checkpoint::streamId).containsExactly("boiler", "tanks");
    }

    @Test
    void upsertNeverMovesCheckpointBackwards() throws Exception {
        var method = JpaCheckpointRepository.class.getMethod("upsertMonotonic", String.class, Instant.class, Instant.class);
        Query query = method.getAnnotation(Query.class);

        assertThat(method.isAnnotationPresent(Modifying.class)).isTrue();
        assertThat(query.nativeQuery()).isTrue();
        assertThat(query.value())
                .contains("ON CONFLICT (stream_id) DO UPDATE")
                .contains("GREATEST(detection_checkpoints.last_processed_at, excluded.last_processed_at)");
    }
}
