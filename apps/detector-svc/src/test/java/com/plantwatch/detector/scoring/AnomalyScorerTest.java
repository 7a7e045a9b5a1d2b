package com.plantwatch.detector.scoring;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.plantwatch.detector.error.InvalidInputException;
import com.plantwatch.detector.model.AnomalyRecord;
import com.plantwatch.detector.model.ForecastResult;
import com.plantwatch.detector.model.Reading;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;

class AnomalyScorerTest {

    private static final Instant TS = Instant.parse("2024-03-01T10:00:00Z");

    private final AnomalyScorer scorer = new AnomalyScorer(2.0);

    @Test
    void valueAboveIntervalWithLargeResidualScoresByResidual() {
        AnomalyRecord record = scorer.score(reading(120), forecast(100, 90, 110), 5);

        assertThat(record.outsideInterval()).isTrue();
        assertThat(record.residual()).isEqualTo(20d);
        assertThat(record.highResidual()).isTrue();
        assertThat(record.anomaly()).isTrue();
        assertThat(record.anomalyScore()).isCloseTo(80d, within(1e-9));
        assertThat(record.predictionErrorPct()).isCloseTo(20d, within(1e-9));
    }

    @Test
    void valueInsideIntervalWithinThresholdIsNotAnomalous() {
        AnomalyRecord record = scorer.score(reading(100), forecast(100, 95, 105), 2);

        assertThat(record.outsideInterval()).isFalse();
        assertThat(record.highResidual()).isFalse();
        assertThat(record.anomaly()).isFalse();
        assertThat(record.anomalyScore()).isZero();
    }

    @Test
    void zeroPointEstimateLeavesPredictionErrorEmpty() {
        AnomalyRecord record = scorer.score(reading(5), forecast(0, -1, 1), 0);

        assertThat(record.predictionErrorPct()).isNull();
        assertThat(record.outsideInterval()).isTrue();
        assertThat(record.anomalyScore()).isEqualTo(100d);
    }

    @Test
    void valueBelowIntervalUsesLowerHalfWidth() {
        AnomalyRecord record = scorer.score(reading(85), forecast(100, 90, 110), 0);

        assertThat(record.outsideInterval()).isTrue();
        assertThat(record.highResidual()).isFalse();
        assertThat(record.anomalyScore()).isCloseTo(25d, within(1e-9));
    }

    @Test
    void degenerateIntervalScoresMaximum() {
        AnomalyRecord record = scorer.score(reading(101), forecast(100, 100, 100), 0);

        assertThat(record.anomaly()).isTrue();
        assertThat(record.anomalyScore()).isEqualTo(100d);
    }

    @Test
    void insideIntervalButHighResidualIsAnomalous() {
        AnomalyRecord record = scorer.score(reading(108), forecast(100, 80, 120), 2);

        assertThat(record.outsideInterval()).isFalse();
        assertThat(record.highResidual()).isTrue();
        assertThat(record.anomalyScore()).isEqualTo(80d);
    }

    @Test
    void nonFiniteBoundsGiveNoIntervalSignal() {
        AnomalyRecord record = scorer.score(reading(101), forecast(100, Double.NaN, Double.NaN), 10);

        assertThat(record.outsideInterval()).isFalse();
        assertThat(record.anomaly()).isFalse();
        assertThat(record.anomalyScore()).isZero();
    }

    @Test
    void rejectsNonFiniteActualOrPoint() {
        assertThatThrownBy(() -> scorer.score(reading(Double.NaN), forecast(100, 90, 110), 1))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("actual value");
        assertThatThrownBy(() -> scorer.score(reading(100), forecast(Double.POSITIVE_INFINITY, 90, 110), 1))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("point estimate");
    }

    @Test
    void scoreStaysWithinBoundsForRandomFiniteInputs() {
        Random random = new Random(42);
        for (int i = 0; i < 5_000; i++) {
            double point = random.nextGaussian() * 100;
            double lower = point - Math.abs(random.nextGaussian() * 10) * (random.nextInt(5) == 0 ? 0 : 1);
            double upper = point + Math.abs(random.nextGaussian() * 10) * (random.nextInt(5) == 0 ? 0 : 1);
            double actual = point + random.nextGaussian() * 50;
            double std = random.nextInt(4) == 0 ? 0 : Math.abs(random.nextGaussian() * 5);

            AnomalyRecord record = scorer.score(reading(actual), forecast(point, lower, upper), std);

            assertThat(record.anomalyScore()).isBetween(0d, 100d);
            if (!record.anomaly()) {
                assertThat(record.anomalyScore()).isZero();
            }
        }
    }

    @Test
    void residualStdIsSampleDeviationOfFiniteValues() {
        assertThat(AnomalyScorer.residualStd(List.of(2d, 4d, 4d, 4d, 5d, 5d, 7d, 9d)))
                .isCloseTo(Math.sqrt(32d / 7d), within(1e-12));
        assertThat(AnomalyScorer.residualStd(Arrays.asList(1d, Double.NaN, 3d, null)))
                .isCloseTo(Math.sqrt(2d), within(1e-12));
        assertThat(AnomalyScorer.residualStd(List.of(5d))).isZero();
        assertThat(AnomalyScorer.residualStd(List.of())).isZero();
    }

    @Test
    void rejectsNonPositiveMultiplier() {
        assertThatThrownBy(() -> new AnomalyScorer(0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("thresholdMultiplier");
    }

    private static Reading reading(double value) {
        return new Reading("TI-101", TS, value, "plant-a");
    }

    private static ForecastResult forecast(double point, double lower, double upper) {
        return new ForecastResult("TI-101", TS, point, lower, upper);
    }
}
