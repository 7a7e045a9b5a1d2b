package com.plantwatch.detector.registry;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.plantwatch.detector.error.ModelPersistenceException;
import com.plantwatch.detector.forecast.Forecaster;
import com.plantwatch.detector.forecast.ForecastingEngine;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Persists a {@link ModelRegistry} as one blob per variable plus a {@code manifest.json} index.
 * <p>
 * Blob names are unique per save, and the manifest is replaced with an atomic move after every
 * blob is on disk. A reader therefore sees either the previous registry or the new one in full.
 * Blobs the new manifest no longer references are removed afterwards.
 */
public class ModelRegistryStore {
    private static final Logger log = LoggerFactory.getLogger(ModelRegistryStore.class);

    static final String MANIFEST = "manifest.json";
    private static final String BLOB_PREFIX = "model-";
    private static final String BLOB_SUFFIX = ".json";

    private final ForecastingEngine engine;
    private final ObjectMapper objectMapper;

    public ModelRegistryStore(ForecastingEngine engine, ObjectMapper objectMapper) {
        this.engine = engine;
        this.objectMapper = objectMapper;
    }

    public void save(ModelRegistry registry, Path directory) {
        String generation = UUID.randomUUID().toString().substring(0, 8);
        Map<String, RegistryManifest.Entry> entries = new LinkedHashMap<>();
        try {
            Files.createDirectories(directory);
            int index = 0;
            for (VariableModel model : registry.models().values()) {
                String blobName = BLOB_PREFIX + generation + "-" + index++ + BLOB_SUFFIX;
                Files.write(directory.resolve(blobName), engine.serialize(model.forecaster()));
                entries.put(model.variableId(), new RegistryManifest.Entry(blobName, model.summary(), model.trainedAt()));
            }
            RegistryManifest manifest = new RegistryManifest(
                    RegistryManifest.FORMAT_VERSION,
                    engine.name(),
                    registry.trainedAt(),
                    registry.configuration(),
                    entries
            );
            Path tmp = directory.resolve(MANIFEST + ".tmp");
            Files.write(tmp, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(manifest));
            Files.move(tmp, directory.resolve(MANIFEST), StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException ex) {
            throw new ModelPersistenceException("Failed to save model registry to " + directory, ex);
        }
        Set<String> referenced = new HashSet<>();
        entries.values().forEach(entry -> referenced.add(entry.blob()));
        removeStaleBlobs(directory, referenced);
        log.info("Saved model registry with {} variables to {}", entries.size(), directory);
    }

    /**
     * Loads the registry in {@code directory}. A missing directory or manifest yields an empty
     * registry; a variable whose blob is missing or unreadable is left out with a warning.
     *
     * @throws ModelPersistenceException when the manifest is unreadable or was written by another engine
     */
    public ModelRegistry load(Path directory, TrainingConfiguration fallbackConfiguration) {
        Path manifestPath = directory.resolve(MANIFEST);
        if (!Files.isRegularFile(manifestPath)) {
            log.info("No model manifest at {}", manifestPath);
            return ModelRegistry.empty(fallbackConfiguration);
        }
        RegistryManifest manifest;
        try {
            manifest = objectMapper.readValue(manifestPath.toFile(), RegistryManifest.class);
        } catch (IOException ex) {
            throw new ModelPersistenceException("Unreadable model manifest " + manifestPath, ex);
        }
        if (manifest.engine() != null && !manifest.engine().equals(engine.name())) {
            throw new ModelPersistenceException("Model registry at " + directory + " was written by engine '"
                    + manifest.engine() + "', configured engine is '" + engine.name() + "'");
        }
        Map<String, VariableModel> models = new TreeMap<>();
        Map<String, RegistryManifest.Entry> variables = manifest.variables() != null ? manifest.variables() : Map.of();
        variables.forEach((variableId, entry) -> {
            try {
                byte[] blob = Files.readAllBytes(directory.resolve(entry.blob()));
                Forecaster forecaster = engine.deserialize(variableId, blob);
                models.put(variableId, new VariableModel(variableId, forecaster, entry.summary(), entry.trainedAt()));
            } catch (IOException | ModelPersistenceException ex) {
                log.warn("Skipping model for {} ({}): {}", variableId, entry.blob(), ex.getMessage());
            }
        });
        TrainingConfiguration configuration = manifest.configuration() != null ? manifest.configuration() : fallbackConfiguration;
        log.info("Loaded {} of {} models from {}", models.size(), variables.size(), directory);
        return new ModelRegistry(models, configuration, manifest.trainedAt());
    }

    private void removeStaleBlobs(Path directory, Set<String> referenced) {
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, BLOB_PREFIX + "*" + BLOB_SUFFIX)) {
            for (Path path : stream) {
                if (!referenced.contains(path.getFileName().toString())) {
                    Files.deleteIfExists(path);
                }
            }
        } catch (IOException ex) {
            // stale blobs are harmless; the manifest no longer points at them
            log.warn("Failed to remove stale model blobs in {}: {}", directory, ex.getMessage());
        }
    }
}
