package com.plantwatch.detector.forecast;

import java.time.ZoneId;

public record ForecastSettings(
        double intervalWidth,
        boolean dailySeasonality,
        boolean weeklySeasonality,
        ZoneId zone
) {
    public ForecastSettings {
        if (!(intervalWidth > 0 && intervalWidth < 1)) {
            throw new IllegalArgumentException("intervalWidth must be in (0, 1)");
        }
        if (zone == null) {
            zone = ZoneId.of("UTC");
        }
    }
}
