package com.plantwatch.detector.health;

import com.plantwatch.detector.registry.ModelRegistry;
import com.plantwatch.detector.registry.ModelRegistryHolder;
import java.time.Instant;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness for the container platform. Reports how many variables the published registry can
 * score, read from memory only, so a slow feed or result store never fails the check. An empty
 * registry is still live: the workers skip unmodelled variables until the next retraining.
 */
@RestController
public class HealthzController {

    private final ModelRegistryHolder registryHolder;

    public HealthzController(ModelRegistryHolder registryHolder) {
        this.registryHolder = registryHolder;
    }

    @GetMapping(path = "/healthz", produces = MediaType.APPLICATION_JSON_VALUE)
    public HealthzResponse healthz() {
        ModelRegistry registry = registryHolder.current();
        return new HealthzResponse("UP", registry.size(), registry.trainedAt());
    }

    public record HealthzResponse(String status, int modelledVariables, Instant registryTrainedAt) {
    }
}
