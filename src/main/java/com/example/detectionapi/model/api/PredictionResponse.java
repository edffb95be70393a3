package com.example.detectionapi.model.api;

import com.example.detectionapi.model.PredictionResult;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Wire shape of {@code GET /result/}. {@code timestamp} is always written, as {@code null} when
 * nothing has been published; {@code total_objects} and {@code message} are left out when they
 * do not apply.
 */
@Schema(description = "Most recent detection result")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PredictionResponse(
        @Schema(description = "Detections sorted by confidence, highest first")
        List<DetectionResponse> detections,
        @Schema(description = "Completion time in seconds since the Unix epoch, null before the first result",
                example = "1718000000.123", nullable = true)
        @JsonInclude(JsonInclude.Include.ALWAYS) Double timestamp,
        @Schema(description = "Number of detections", example = "1")
        @JsonProperty("total_objects") Integer totalObjects,
        @Schema(description = "Explanation when there are no detections to report")
        String message) {

    public static final String NO_PREDICTION_MESSAGE = "No prediction available yet";
    public static final String NO_OBJECTS_MESSAGE = "No objects detected in the image";

    public static PredictionResponse from(PredictionResult result) {
        if (result instanceof PredictionResult.Result present) {
            List<DetectionResponse> detections = present.detections().stream()
                    .map(DetectionResponse::from)
                    .collect(Collectors.toList());
            return new PredictionResponse(detections, epochSeconds(present.timestamp()), detections.size(), null);
        }
        if (result instanceof PredictionResult.EmptyResult empty) {
            return new PredictionResponse(List.of(), epochSeconds(empty.timestamp()), 0, NO_OBJECTS_MESSAGE);
        }
        return new PredictionResponse(List.of(), null, null, NO_PREDICTION_MESSAGE);
    }

    static double epochSeconds(Instant instant) {
        return instant.getEpochSecond() + instant.getNano() / 1_000_000_000.0;
    }
}
