package com.plantwatch.detector.registry;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.plantwatch.detector.model.VariableSummary;
import java.time.Instant;
import java.util.Map;

/**
 * Index of a persisted registry. Written last, so a directory whose manifest is readable always
 * points at a complete set of model blobs.
 */
public record RegistryManifest(
        @JsonProperty("format_version") int formatVersion,
        @JsonProperty("engine") String engine,
        @JsonProperty("trained_at") Instant trainedAt,
        @JsonProperty("configuration") TrainingConfiguration configuration,
        @JsonProperty("variables") Map<String, Entry> variables
) {

    public static final int FORMAT_VERSION = 1;

    public record Entry(
            @JsonProperty("blob") String blob,
            @JsonProperty("summary") VariableSummary summary,
            @JsonProperty("trained_at") Instant trainedAt
    ) {}
}
