package com.plantwatch.detector.forecast.profile;

import com.plantwatch.detector.forecast.Forecaster;
import com.plantwatch.detector.model.ForecastResult;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Arrays;
import java.util.Objects;

/**
 * Level plus optional hour-of-day and day-of-week offsets, with a symmetric interval.
 * Offset arrays are empty when the matching seasonality is disabled.
 */
public record SeasonalProfileForecaster(
        String variableId,
        double level,
        double[] hourOffsets,
        double[] weekdayOffsets,
        double halfWidth,
        String zone
) implements Forecaster {

    static final int HOURS = 24;
    static final int WEEKDAYS = 7;

    public SeasonalProfileForecaster {
        if (variableId == null || variableId.isBlank()) {
            throw new IllegalArgumentException("variableId must be provided");
        }
        hourOffsets = hourOffsets == null ? new double[0] : hourOffsets.clone();
        weekdayOffsets = weekdayOffsets == null ? new double[0] : weekdayOffsets.clone();
        if (hourOffsets.length != 0 && hourOffsets.length != HOURS) {
            throw new IllegalArgumentException("hourOffsets must have 0 or 24 entries");
        }
        if (weekdayOffsets.length != 0 && weekdayOffsets.length != WEEKDAYS) {
            throw new IllegalArgumentException("weekdayOffsets must have 0 or 7 entries");
        }
        if (halfWidth < 0 || Double.isNaN(halfWidth)) {
            throw new IllegalArgumentException("halfWidth must be non-negative");
        }
        zone = zone == null || zone.isBlank() ? "UTC" : zone;
    }

    @Override
    public double[] hourOffsets() {
        return hourOffsets.clone();
    }

    @Override
    public double[] weekdayOffsets() {
        return weekdayOffsets.clone();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof SeasonalProfileForecaster that)) {
            return false;
        }
        return variableId.equals(that.variableId)
                && Double.compare(level, that.level) == 0
                && Arrays.equals(hourOffsets, that.hourOffsets)
                && Arrays.equals(weekdayOffsets, that.weekdayOffsets)
                && Double.compare(halfWidth, that.halfWidth) == 0
                && zone.equals(that.zone);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(variableId, level, halfWidth, zone);
        result = 31 * result + Arrays.hashCode(hourOffsets);
        return 31 * result + Arrays.hashCode(weekdayOffsets);
    }

    @Override
    public String toString() {
        return "SeasonalProfileForecaster[variableId=" + variableId + ", level=" + level
                + ", hourOffsets=" + Arrays.toString(hourOffsets)
                + ", weekdayOffsets=" + Arrays.toString(weekdayOffsets)
                + ", halfWidth=" + halfWidth + ", zone=" + zone + "]";
    }

    @Override
    public ForecastResult forecast(Instant timestamp) {
        double point = pointEstimate(timestamp);
        return new ForecastResult(variableId, timestamp, point, point - halfWidth, point + halfWidth);
    }

    double pointEstimate(Instant timestamp) {
        ZonedDateTime local = timestamp.atZone(ZoneId.of(zone));
        double point = level;
        if (hourOffsets.length == HOURS) {
            point += hourOffsets[local.getHour()];
        }
        if (weekdayOffsets.length == WEEKDAYS) {
            point += weekdayOffsets[local.getDayOfWeek().getValue() - 1];
        }
        return point;
    }
}
