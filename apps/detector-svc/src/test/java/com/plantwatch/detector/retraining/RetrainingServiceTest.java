package com.plantwatch.detector.retraining;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.plantwatch.detector.config.DetectorProperties;
import com.plantwatch.detector.detection.StoreRetry;
import com.plantwatch.detector.error.ModelPersistenceException;
import com.plantwatch.detector.error.RegistrySwapException;
import com.plantwatch.detector.forecast.profile.SeasonalProfileEngine;
import com.plantwatch.detector.model.Reading;
import com.plantwatch.detector.registry.ModelRegistry;
import com.plantwatch.detector.registry.ModelRegistryHolder;
import com.plantwatch.detector.registry.ModelRegistryStore;
import com.plantwatch.detector.registry.ModelTrainer;
import com.plantwatch.detector.registry.TrainingConfiguration;
import com.plantwatch.detector.repository.InMemoryReadingRepository;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RetrainingServiceTest {

    private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-02-01T02:00:00Z"), ZoneOffset.UTC);
    private static final TrainingConfiguration CONFIGURATION =
            new TrainingConfiguration(SeasonalProfileEngine.NAME, 0.95, 2.0, true, true, 10, "UTC");

    @TempDir
    Path modelDirectory;

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private final SeasonalProfileEngine engine = new SeasonalProfileEngine(objectMapper);
    private final ModelTrainer trainer = new ModelTrainer(engine, CONFIGURATION, CLOCK);
    private final ModelRegistryStore store = new ModelRegistryStore(engine, objectMapper);
    private final InMemoryReadingRepository readings = new InMemoryReadingRepository();
    private final StoreRetry retry = new StoreRetry(DetectorProperties.defaults());
    private ModelRegistry previous;
    private ModelRegistryHolder holder;

    @BeforeEach
    void setUp() {
        previous = ModelRegistry.empty(CONFIGURATION);
        holder = new ModelRegistryHolder(previous);
    }

    @Test
    void trainsSavesAndPublishesNewRegistry() {
        addSeries("TI-1", 48);
        addSeries("PI-2", 3);
        RetrainingService service = new RetrainingService(readings, trainer, store, holder, retry, modelDirectory);

        ModelTrainer.TrainingReport report = service.retrain("manual");

        assertThat(report.trained()).containsExactly("TI-1");
        assertThat(report.failed()).containsOnlyKeys("PI-2");
        assertThat(holder.current()).isSameAs(report.registry());
        assertThat(holder.current().variables()).containsExactly("TI-1");
        assertThat(Files.exists(modelDirectory.resolve("manifest.json"))).isTrue();
        assertThat(store.load(modelDirectory, CONFIGURATION).variables()).containsExactly("TI-1");
    }

    @Test
    void keepsCurrentRegistryWhenNothingTrains() {
        addSeries("PI-2", 3);
        RetrainingService service = new RetrainingService(readings, trainer, store, holder, retry, modelDirectory);

        assertThatThrownBy(() -> service.retrain("manual"))
                .isInstanceOf(RegistrySwapException.class)
                .hasMessageContaining("produced no models");
        assertThat(holder.current()).isSameAs(previous);
    }

    @Test
    void keepsCurrentRegistryWhenSaveFails() {
        addSeries("TI-1", 48);
        ModelRegistryStore failingStore = mock(ModelRegistryStore.class);
        doThrow(new ModelPersistenceException("disk full")).when(failingStore).save(any(), any());
        RetrainingService service = new RetrainingService(readings, trainer, failingStore, holder, retry, modelDirectory);

        assertThatThrownBy(() -> service.retrain("scheduled"))
                .isInstanceOf(RegistrySwapException.class)
                .hasCauseInstanceOf(ModelPersistenceException.class);
        assertThat(holder.current()).isSameAs(previous);
    }

    private void addSeries(String variableId, int points) {
        for (int i = 0; i < points; i++) {
            readings.add(new Reading(variableId, START.plusSeconds(3600L * i), 20 + (i % 24)));
        }
    }
}
