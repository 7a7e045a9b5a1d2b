package com.plantwatch.detector.repository;

import com.plantwatch.detector.entity.CheckpointEntity;
import java.time.Instant;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaCheckpointRepository extends JpaRepository<CheckpointEntity, String> {

    @Modifying
    @Query(value = """
            INSERT INTO detection_checkpoints (stream_id, last_processed_at, updated_at)
            VALUES (:streamId, :processedThrough, :updatedAt)
            ON CONFLICT (stream_id) DO UPDATE SET
                last_processed_at = GREATEST(detection_checkpoints.last_processed_at, excluded.last_processed_at),
                updated_at = excluded.updated_at
            """, nativeQuery = true)
    int upsertMonotonic(@Param("streamId") String streamId,
                        @Param("processedThrough") Instant processedThrough,
                        @Param("updatedAt") Instant updatedAt);
}
