package com.plantwatch.detector.analytics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.plantwatch.detector.config.DetectorProperties;
import com.plantwatch.detector.detection.StoreRetry;
import com.plantwatch.detector.forecast.Forecaster;
import com.plantwatch.detector.model.ForecastResult;
import com.plantwatch.detector.model.Reading;
import com.plantwatch.detector.registry.ModelRegistry;
import com.plantwatch.detector.registry.ModelRegistryHolder;
import com.plantwatch.detector.registry.TrainingConfiguration;
import com.plantwatch.detector.registry.VariableModel;
import com.plantwatch.detector.repository.InMemoryReadingRepository;
import com.plantwatch.detector.scoring.AnomalyScorer;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ModelEvaluationServiceTest {

    private static final Instant T0 = Instant.parse("2024-03-01T00:00:00Z");

    private final InMemoryReadingRepository readings = new InMemoryReadingRepository();
    private final ModelRegistryHolder holder = new ModelRegistryHolder(new ModelRegistry(
            Map.of("A", new VariableModel("A", constant("A"), null, T0)),
            new TrainingConfiguration("test", 0.95, 2.0, true, true, 10, "UTC"), T0));
    private final ModelEvaluationService service = new ModelEvaluationService(
            readings, holder, new AnomalyScorer(2.0), new StoreRetry(DetectorProperties.defaults()));

    @Test
    void computesAccuracyCoverageAndResiduals() {
        readings.addAll(List.of(
                reading("A", 0, 100), reading("A", 1, 105), reading("A", 2, 95), reading("A", 3, 130),
                reading("A", 4, Double.NaN), reading("Z", 0, 1)));

        List<ModelEvaluationService.VariableEvaluation> evaluations = service.evaluate(T0, T0.plusSeconds(86_400));

        assertThat(evaluations).hasSize(1);
        ModelEvaluationService.VariableEvaluation a = evaluations.get(0);
        assertThat(a.variableId()).isEqualTo("A");
        assertThat(a.nPoints()).isEqualTo(4);
        assertThat(a.mae()).isCloseTo(10.0, within(1e-9));
        assertThat(a.rmse()).isCloseTo(Math.sqrt(237.5), within(1e-9));
        assertThat(a.mape()).isCloseTo((5.0 / 105 + 5.0 / 95 + 30.0 / 130) / 4 * 100, within(1e-9));
        assertThat(a.r2()).isCloseTo(1 - 950.0 / 725.0, within(1e-9));
        assertThat(a.intervalCoveragePct()).isCloseTo(75.0, within(1e-9));
        assertThat(a.nOutsideInterval()).isEqualTo(1);
        assertThat(a.nAnomalies()).isEqualTo(1);
        assertThat(a.anomalyRatePct()).isCloseTo(25.0, within(1e-9));
        assertThat(a.avgAnomalyScore()).isPositive().isEqualTo(a.maxAnomalyScore());

        ModelEvaluationService.ResidualStats residuals = a.residuals();
        assertThat(residuals.mean()).isCloseTo(7.5, within(1e-9));
        assertThat(residuals.std()).isCloseTo(Math.sqrt(181.25), within(1e-9));
        assertThat(residuals.median()).isCloseTo(2.5, within(1e-9));
        assertThat(residuals.q25()).isCloseTo(-1.25, within(1e-9));
        assertThat(residuals.q75()).isCloseTo(11.25, within(1e-9));
        assertThat(residuals.min()).isEqualTo(-5.0);
        assertThat(residuals.max()).isEqualTo(30.0);
    }

    @Test
    void constantActualsLeaveR2Undefined() {
        readings.addAll(List.of(reading("A", 0, 100), reading("A", 1, 100)));

        ModelEvaluationService.VariableEvaluation a = service.evaluate(T0, T0.plusSeconds(86_400)).get(0);

        assertThat(a.r2()).isNull();
        assertThat(a.mae()).isZero();
        assertThat(a.nAnomalies()).isZero();
        assertThat(a.avgAnomalyScore()).isZero();
    }

    @Test
    void noUsablePointsYieldsEmptyMetrics() {
        VariableModel model = holder.current().lookup("A");

        ModelEvaluationService.VariableEvaluation a = service.evaluate(model, List.of(reading("A", 0, Double.NaN)));

        assertThat(a.nPoints()).isZero();
        assertThat(a.mae()).isNull();
        assertThat(a.residuals().mean()).isNull();
    }

    private static Reading reading(String variableId, int hour, double value) {
        return new Reading(variableId, T0.plusSeconds(3600L * hour), value);
    }

    private static Forecaster constant(String variableId) {
        return new Forecaster() {
            @Override
            public String variableId() {
                return variableId;
            }

            @Override
            public ForecastResult forecast(Instant timestamp) {
                return new ForecastResult(variableId, timestamp, 100, 90, 110);
            }
        };
    }
}
