package com.example.detectionapi.model.api;

import com.example.detectionapi.model.Detection;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(description = "A single detected object")
public record DetectionResponse(
        @Schema(description = "Label of the detected class", example = "person")
        @JsonProperty("class_name") String className,
        @Schema(description = "Model confidence in [0, 1]", example = "0.95") double confidence,
        @Schema(description = "Bounding box as [x1, y1, x2, y2] in pixels", example = "[100, 50, 200, 300]")
        List<Double> bbox) {

    public static DetectionResponse from(Detection detection) {
        return new DetectionResponse(detection.className(), detection.confidence(), detection.boundingBox().toList());
    }
}
