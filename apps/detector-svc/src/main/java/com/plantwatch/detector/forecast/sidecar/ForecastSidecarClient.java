package com.plantwatch.detector.forecast.sidecar;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.plantwatch.detector.config.DetectorProperties;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Client for an external forecasting service (e.g. a Prophet process) exposing
 * {@code POST /train} and {@code POST /predict}. Uses blocking calls bounded by the configured timeout.
 */
public class ForecastSidecarClient {
    private static final Logger log = LoggerFactory.getLogger(ForecastSidecarClient.class);

    private final WebClient webClient;
    private final Duration timeout;

    public ForecastSidecarClient(DetectorProperties properties) {
        this(properties.forecaster().sidecar().baseUrl(), properties.forecaster().sidecar().timeout());
    }

    public ForecastSidecarClient(String baseUrl, Duration timeout) {
        this.timeout = timeout;
        this.webClient = WebClient.builder()
                .baseUrl(baseUrl.replaceAll("/+$", ""))
                .defaultHeader("Content-Type", MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    public TrainResponse train(TrainRequest request) {
        TrainResponse response = webClient.post().uri("/train")
                .bodyValue(request)
                .retrieve()
                .bodyToMono(TrainResponse.class)
                .doOnError(e -> log.error("Forecast sidecar train failed for {}", request.modelKey(), e))
                .block(timeout);
        if (response == null || !response.ok()) {
            throw new IllegalStateException("Forecast sidecar rejected training for " + request.modelKey()
                    + (response != null && response.message() != null ? ": " + response.message() : ""));
        }
        return response;
    }

    public PredictResponse predict(PredictRequest request) {
        PredictResponse response = webClient.post().uri("/predict")
                .bodyValue(request)
                .retrieve()
                .bodyToMono(PredictResponse.class)
                .doOnError(e -> log.error("Forecast sidecar predict failed for {}", request.modelKey(), e))
                .block(timeout);
        if (response == null || !response.ok()) {
            throw new IllegalStateException("Forecast sidecar rejected prediction for " + request.modelKey()
                    + (response != null && response.message() != null ? ": " + response.message() : ""));
        }
        int expected = request.timestamps().size();
        if (response.yhat() == null || response.yhat().size() != expected
                || response.yhatLower() == null || response.yhatLower().size() != expected
                || response.yhatUpper() == null || response.yhatUpper().size() != expected) {
            throw new IllegalStateException("Forecast sidecar returned arrays not matching the " + expected
                    + " requested timestamps for " + request.modelKey());
        }
        return response;
    }

    // --- Request/response DTOs --- //
    public record TrainRequest(
            @JsonProperty("model_key") String modelKey,
            @JsonProperty("timestamps") List<String> timestamps,
            @JsonProperty("values") List<Double> values,
            @JsonProperty("params") Map<String, Object> params
    ) {}

    public record TrainResponse(
            @JsonProperty("ok") boolean ok,
            @JsonProperty("model_key") String modelKey,
            @JsonProperty("model_version") String modelVersion,
            @JsonProperty("message") String message
    ) {}

    public record PredictRequest(
            @JsonProperty("model_key") String modelKey,
            @JsonProperty("model_version") String modelVersion,
            @JsonProperty("timestamps") List<String> timestamps
    ) {}

    public record PredictResponse(
            @JsonProperty("ok") boolean ok,
            @JsonProperty("yhat") List<Double> yhat,
            @JsonProperty("yhat_lower") List<Double> yhatLower,
            @JsonProperty("yhat_upper") List<Double> yhatUpper,
            @JsonProperty("message") String message
    ) {}
}
