package com.plantwatch.detector.scoring;

import com.plantwatch.detector.config.DetectorProperties;
import com.plantwatch.detector.error.InvalidInputException;
import com.plantwatch.detector.model.AnomalyRecord;
import com.plantwatch.detector.model.ForecastResult;
import com.plantwatch.detector.model.Reading;
import java.util.List;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Turns a reading and its forecast into an anomaly verdict with a severity in [0, 100].
 * <p>
 * Two signals are combined: how far the value lies outside the forecast interval (relative to
 * the half-width of the interval on that side) and how large the residual is relative to the
 * residual standard deviation of the scored window. Readings that are neither outside the
 * interval nor above the residual threshold always score 0.
 */
@Component
public class AnomalyScorer {

    private static final double MAX_SCORE = 100d;
    private static final double INTERVAL_WEIGHT = 50d;
    private static final double RESIDUAL_WEIGHT = 20d;

    private final double thresholdMultiplier;

    @Autowired
    public AnomalyScorer(DetectorProperties properties) {
        this(properties.scoring().thresholdMultiplier());
    }

    public AnomalyScorer(double thresholdMultiplier) {
        if (!(thresholdMultiplier > 0) || Double.isInfinite(thresholdMultiplier)) {
            throw new IllegalArgumentException("thresholdMultiplier must be positive and finite");
        }
        this.thresholdMultiplier = thresholdMultiplier;
    }

    public double thresholdMultiplier() {
        return thresholdMultiplier;
    }

    /**
     * @throws InvalidInputException when the actual value or the point estimate is NaN or infinite
     */
    public AnomalyRecord score(Reading reading, ForecastResult forecast, double residualStd) {
        double actual = reading.value();
        double point = forecast.pointEstimate();
        if (!Double.isFinite(actual)) {
            throw new InvalidInputException("actual value for " + reading.variableId() + " at " + reading.timestamp() + " is not finite");
        }
        if (!Double.isFinite(point)) {
            throw new InvalidInputException("point estimate for " + reading.variableId() + " at " + reading.timestamp() + " is not finite");
        }
        double lower = forecast.lowerBound();
        double upper = forecast.upperBound();
        double std = Double.isFinite(residualStd) && residualStd > 0 ? residualStd : 0d;

        double residual = actual - point;
        boolean above = actual > upper;
        boolean below = actual < lower;
        boolean outsideInterval = above || below;
        boolean highResidual = std > 0 && Math.abs(residual) > thresholdMultiplier * std;
        boolean anomaly = outsideInterval || highResidual;

        double score = 0d;
        if (anomaly) {
            double intervalScore = 0d;
            if (above) {
                intervalScore = intervalScore(actual - upper, upper - point);
            } else if (below) {
                intervalScore = intervalScore(lower - actual, point - lower);
            }
            double residualScore = std > 0 ? Math.min(MAX_SCORE, RESIDUAL_WEIGHT * Math.abs(residual) / std) : 0d;
            score = clamp(Math.max(intervalScore, residualScore));
        }

        return new AnomalyRecord(
                reading.variableId(),
                reading.timestamp(),
                actual,
                point,
                lower,
                upper,
                residual,
                outsideInterval,
                highResidual,
                anomaly,
                score,
                predictionErrorPct(residual, point),
                reading.sourceTag()
        );
    }

    /**
     * Sample standard deviation of the finite residuals; 0 when fewer than two are available.
     */
    public static double residualStd(List<Double> residuals) {
        double[] finite = residuals.stream()
                .filter(value -> value != null && Double.isFinite(value))
                .mapToDouble(Double::doubleValue)
                .toArray();
        if (finite.length < 2) {
            return 0d;
        }
        double mean = 0d;
        for (double value : finite) {
            mean += value;
        }
        mean /= finite.length;
        double sumSquares = 0d;
        for (double value : finite) {
            sumSquares += (value - mean) * (value - mean);
        }
        double std = Math.sqrt(sumSquares / (finite.length - 1));
        return Double.isFinite(std) ? std : 0d;
    }

    private static double intervalScore(double distance, double halfWidth) {
        if (!(halfWidth > 0)) {
            return MAX_SCORE;
        }
        return Math.min(MAX_SCORE, INTERVAL_WEIGHT * distance / halfWidth);
    }

    private static Double predictionErrorPct(double residual, double point) {
        if (point == 0d) {
            return null;
        }
        double pct = Math.abs(residual / point) * 100d;
        return Double.isFinite(pct) ? pct : null;
    }

    private static double clamp(double score) {
        if (Double.isNaN(score)) {
            return MAX_SCORE;
        }
        return Math.max(0d, Math.min(MAX_SCORE, score));
    }
}
