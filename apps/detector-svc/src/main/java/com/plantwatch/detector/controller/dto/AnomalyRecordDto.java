package com.plantwatch.detector.controller.dto;

import com.plantwatch.detector.model.AnomalyRecord;
import java.time.Instant;

public record AnomalyRecordDto(
        String variableId,
        Instant timestamp,
        double actualValue,
        double pointEstimate,
        Double lowerBound,
        Double upperBound,
        double residual,
        boolean outsideInterval,
        boolean highResidual,
        boolean anomaly,
        double anomalyScore,
        Double predictionErrorPct,
        String sourceTag
) {

    public static AnomalyRecordDto from(AnomalyRecord record) {
        return new AnomalyRecordDto(
                record.variableId(),
                record.timestamp(),
                record.actualValue(),
                record.pointEstimate(),
                Double.isFinite(record.lowerBound()) ? record.lowerBound() : null,
                Double.isFinite(record.upperBound()) ? record.upperBound() : null,
                record.residual(),
                record.outsideInterval(),
                record.highResidual(),
                record.anomaly(),
                record.anomalyScore(),
                record.predictionErrorPct(),
                record.sourceTag()
        );
    }
}
