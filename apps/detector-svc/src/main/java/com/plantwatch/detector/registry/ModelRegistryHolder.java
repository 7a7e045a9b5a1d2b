package com.plantwatch.detector.registry;

import com.plantwatch.detector.error.RegistrySwapException;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Current registry shared by the detection workers and the retraining job. Publishing replaces the
 * reference atomically; readers holding the previous registry keep using it until they let go.
 */
public class ModelRegistryHolder {
    private static final Logger log = LoggerFactory.getLogger(ModelRegistryHolder.class);

    private final AtomicReference<ModelRegistry> current;

    public ModelRegistryHolder(ModelRegistry initial) {
        this.current = new AtomicReference<>(initial);
    }

    public ModelRegistry current() {
        return current.get();
    }

    public void publish(ModelRegistry registry) {
        if (registry == null) {
            throw new RegistrySwapException("Cannot publish a null registry");
        }
        ModelRegistry previous = current.getAndSet(registry);
        log.info("Published model registry: {} variables (previous: {})",
                registry.size(), previous != null ? previous.size() : 0);
    }
}
