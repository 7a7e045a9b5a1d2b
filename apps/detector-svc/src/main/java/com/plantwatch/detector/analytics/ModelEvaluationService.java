package com.plantwatch.detector.analytics;

import com.plantwatch.detector.detection.StoreRetry;
import com.plantwatch.detector.forecast.Percentiles;
import com.plantwatch.detector.model.AnomalyRecord;
import com.plantwatch.detector.model.ForecastResult;
import com.plantwatch.detector.model.Reading;
import com.plantwatch.detector.registry.ModelRegistry;
import com.plantwatch.detector.registry.ModelRegistryHolder;
import com.plantwatch.detector.registry.VariableModel;
import com.plantwatch.detector.repository.ReadingRepository;
import com.plantwatch.detector.scoring.AnomalyScorer;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Replays the readings of a time range through the current registry and reports forecast accuracy,
 * interval coverage and residual distribution per variable. Metrics that cannot be computed
 * (no usable points, constant actuals for R²) are null.
 */
@Service
public class ModelEvaluationService {
    private static final Logger log = LoggerFactory.getLogger(ModelEvaluationService.class);

    private static final double MAPE_EPSILON = 1e-10;

    private final ReadingRepository readings;
    private final ModelRegistryHolder registryHolder;
    private final AnomalyScorer scorer;
    private final StoreRetry retry;

    public ModelEvaluationService(ReadingRepository readings,
                                  ModelRegistryHolder registryHolder,
                                  AnomalyScorer scorer,
                                  StoreRetry retry) {
        this.readings = readings;
        this.registryHolder = registryHolder;
        this.scorer = scorer;
        this.retry = retry;
    }

    public record ResidualStats(Double mean, Double std, Double median, Double q25, Double q75, Double min, Double max) {}

    public record VariableEvaluation(
            String variableId,
            int nPoints,
            Double mae,
            Double rmse,
            Double mape,
            Double r2,
            Double intervalCoveragePct,
            int nOutsideInterval,
            ResidualStats residuals,
            long nAnomalies,
            Double anomalyRatePct,
            Double avgAnomalyScore,
            Double maxAnomalyScore
    ) {}

    public List<VariableEvaluation> evaluate(Instant fromInclusive, Instant toExclusive) {
        ModelRegistry registry = registryHolder.current();
        List<Reading> history = retry.call("load evaluation readings",
                () -> readings.findBetween(fromInclusive, toExclusive, List.copyOf(registry.variables())));
        Map<String, List<Reading>> byVariable = new TreeMap<>();
        for (Reading reading : history) {
            byVariable.computeIfAbsent(reading.variableId(), key -> new ArrayList<>()).add(reading);
        }
        List<VariableEvaluation> evaluations = new ArrayList<>();
        byVariable.forEach((variableId, variableReadings) -> registry.find(variableId).ifPresent(model -> {
            try {
                evaluations.add(evaluate(model, variableReadings));
            } catch (RuntimeException ex) {
                log.warn("Evaluation of {} failed", variableId, ex);
            }
        }));
        return evaluations;
    }

    VariableEvaluation evaluate(VariableModel model, List<Reading> variableReadings) {
        List<Reading> finite = variableReadings.stream().filter(reading -> Double.isFinite(reading.value())).toList();
        List<ForecastResult> finiteForecasts = model.forecaster().forecastAll(finite.stream().map(Reading::timestamp).toList());
        List<Reading> usable = new ArrayList<>();
        List<ForecastResult> forecasts = new ArrayList<>();
        for (int i = 0; i < finite.size(); i++) {
            if (Double.isFinite(finiteForecasts.get(i).pointEstimate())) {
                usable.add(finite.get(i));
                forecasts.add(finiteForecasts.get(i));
            }
        }
        int n = usable.size();
        if (n == 0) {
            return new VariableEvaluation(model.variableId(), 0, null, null, null, null, null, 0,
                    new ResidualStats(null, null, null, null, null, null, null), 0, null, null, null);
        }

        double[] actual = usable.stream().mapToDouble(Reading::value).toArray();
        double[] predicted = forecasts.stream().mapToDouble(ForecastResult::pointEstimate).toArray();
        double[] residuals = new double[n];
        double absSum = 0d;
        double squareSum = 0d;
        double mapeSum = 0d;
        int mapeCount = 0;
        for (int i = 0; i < n; i++) {
            residuals[i] = actual[i] - predicted[i];
            absSum += Math.abs(residuals[i]);
            squareSum += residuals[i] * residuals[i];
            if (Math.abs(actual[i]) > MAPE_EPSILON) {
                mapeSum += Math.abs(residuals[i] / actual[i]);
                mapeCount++;
            }
        }
        double actualMean = mean(actual);
        double totalSquares = 0d;
        for (double value : actual) {
            totalSquares += (value - actualMean) * (value - actualMean);
        }

        int covered = 0;
        int withInterval = 0;
        for (int i = 0; i < n; i++) {
            ForecastResult forecast = forecasts.get(i);
            if (Double.isFinite(forecast.lowerBound()) && Double.isFinite(forecast.upperBound())) {
                withInterval++;
                if (actual[i] >= forecast.lowerBound() && actual[i] <= forecast.upperBound()) {
                    covered++;
                }
            }
        }

        List<Double> residualList = new ArrayList<>(n);
        for (double residual : residuals) {
            residualList.add(residual);
        }
        double residualStd = AnomalyScorer.residualStd(residualList);
        List<AnomalyRecord> scored = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            scored.add(scorer.score(usable.get(i), forecasts.get(i), residualStd));
        }
        long anomalies = scored.stream().filter(AnomalyRecord::anomaly).count();

        return new VariableEvaluation(
                model.variableId(),
                n,
                absSum / n,
                Math.sqrt(squareSum / n),
                mapeCount > 0 ? mapeSum / mapeCount * 100d : null,
                totalSquares > 0 ? 1d - squareSum / totalSquares : null,
                withInterval > 0 ? covered * 100d / withInterval : null,
                withInterval - covered,
                residualStats(residualList),
                anomalies,
                anomalies * 100d / n,
                anomalies > 0 ? scored.stream().filter(AnomalyRecord::anomaly).mapToDouble(AnomalyRecord::anomalyScore).average().orElse(0d) : 0d,
                scored.stream().mapToDouble(AnomalyRecord::anomalyScore).max().orElse(0d)
        );
    }

    static ResidualStats residualStats(List<Double> residuals) {
        List<Double> sorted = residuals.stream().sorted().toList();
        double[] values = sorted.stream().mapToDouble(Double::doubleValue).toArray();
        double mean = mean(values);
        double sumSquares = 0d;
        for (double value : values) {
            sumSquares += (value - mean) * (value - mean);
        }
        return new ResidualStats(
                mean,
                Math.sqrt(sumSquares / values.length),
                Percentiles.percentile(sorted, 50),
                Percentiles.percentile(sorted, 25),
                Percentiles.percentile(sorted, 75),
                sorted.get(0),
                sorted.get(sorted.size() - 1)
        );
    }

    private static double mean(double[] values) {
        double sum = 0d;
        for (double value : values) {
            sum += value;
        }
        return sum / values.length;
    }
}
