package com.plantwatch.detector.registry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.plantwatch.detector.error.InsufficientDataException;
import com.plantwatch.detector.forecast.ForecastingEngine;
import com.plantwatch.detector.forecast.profile.SeasonalProfileEngine;
import com.plantwatch.detector.model.Reading;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

class ModelTrainerTest {

    private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-02-01T02:00:00Z"), ZoneOffset.UTC);

    static TrainingConfiguration configuration(int minPoints) {
        return new TrainingConfiguration(SeasonalProfileEngine.NAME, 0.95, 2.0, true, true, minPoints, "UTC");
    }

    private final ModelTrainer trainer = new ModelTrainer(new SeasonalProfileEngine(new ObjectMapper()), configuration(10), CLOCK);

    @Test
    void trainsAndSummarizesFiniteHistory() {
        List<Reading> history = series("TI-1", 12);
        history.add(new Reading("TI-1", START.plusSeconds(99_999), Double.NaN));

        VariableModel model = trainer.train("TI-1", history);

        assertThat(model.variableId()).isEqualTo("TI-1");
        assertThat(model.summary().nPoints()).isEqualTo(12);
        assertThat(model.summary().min()).isEqualTo(0d);
        assertThat(model.summary().max()).isEqualTo(11d);
        assertThat(model.trainedAt()).isEqualTo(CLOCK.instant());
    }

    @Test
    void rejectsTooFewFinitePoints() {
        List<Reading> history = series("TI-2", 9);
        history.add(new Reading("TI-2", START.plusSeconds(50_000), Double.POSITIVE_INFINITY));

        assertThatThrownBy(() -> trainer.train("TI-2", history))
                .isInstanceOf(InsufficientDataException.class)
                .satisfies(ex -> {
                    InsufficientDataException insufficient = (InsufficientDataException) ex;
                    assertThat(insufficient.available()).isEqualTo(9);
                    assertThat(insufficient.required()).isEqualTo(10);
                });
    }

    @Test
    void trainAllIsolatesFailingVariables() {
        ForecastingEngine engine = Mockito.mock(ForecastingEngine.class);
        ForecastingEngine real = new SeasonalProfileEngine(new ObjectMapper());
        when(engine.train(eq("GOOD"), anyList(), any())).thenAnswer(inv -> real.train("GOOD", inv.getArgument(1), inv.getArgument(2)));
        when(engine.train(eq("BROKEN"), anyList(), any())).thenThrow(new IllegalStateException("solver diverged"));
        ModelTrainer isolating = new ModelTrainer(engine, configuration(10), CLOCK);

        ModelTrainer.TrainingReport report = isolating.trainAll(Map.of(
                "GOOD", series("GOOD", 20),
                "BROKEN", series("BROKEN", 20),
                "SHORT", series("SHORT", 3)
        ));

        assertThat(report.trained()).containsExactly("GOOD");
        assertThat(report.failed()).containsOnlyKeys("BROKEN", "SHORT");
        assertThat(report.failed().get("BROKEN")).contains("solver diverged");
        assertThat(report.registry().variables()).containsExactly("GOOD");
        assertThat(report.registry().trainedAt()).isEqualTo(CLOCK.instant());
    }

    static List<Reading> series(String variableId, int points) {
        List<Reading> readings = new ArrayList<>();
        for (int i = points - 1; i >= 0; i--) {
            readings.add(new Reading(variableId, START.plusSeconds(600L * i), i));
        }
        return readings;
    }
}
