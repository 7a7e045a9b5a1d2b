package com.plantwatch.detector.forecast.profile;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.util.Arrays;
import org.junit.jupiter.api.Test;

class SeasonalProfileForecasterTest {

    private static final Instant MONDAY_3AM = Instant.parse("2024-03-04T03:00:00Z");

    @Test
    void publishedModelCannotBeChangedThroughItsOffsets() {
        double[] hours = new double[SeasonalProfileForecaster.HOURS];
        hours[3] = 5;
        SeasonalProfileForecaster forecaster = new SeasonalProfileForecaster("TI-1", 100, hours, null, 2, "UTC");

        hours[3] = 500;
        forecaster.hourOffsets()[3] = 500;

        assertThat(forecaster.forecast(MONDAY_3AM).pointEstimate()).isEqualTo(105.0);
        assertThat(forecaster.hourOffsets()[3]).isEqualTo(5.0);
    }

    @Test
    void equalityComparesOffsetValues() {
        double[] hours = new double[SeasonalProfileForecaster.HOURS];
        Arrays.fill(hours, 1.5);
        double[] weekdays = new double[SeasonalProfileForecaster.WEEKDAYS];
        weekdays[0] = -2;

        SeasonalProfileForecaster first = new SeasonalProfileForecaster("TI-1", 100, hours, weekdays, 2, "UTC");
        SeasonalProfileForecaster second = new SeasonalProfileForecaster("TI-1", 100, hours.clone(), weekdays.clone(), 2, "UTC");
        SeasonalProfileForecaster other = new SeasonalProfileForecaster("TI-1", 100, hours, new double[0], 2, "UTC");

        assertThat(first).isEqualTo(second).hasSameHashCodeAs(second);
        assertThat(first).isNotEqualTo(other);
        assertThat(first.toString()).contains("weekdayOffsets=[-2.0");
    }
}
