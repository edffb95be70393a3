package com.example.detectionapi.model.api;

import com.example.detectionapi.model.Detection;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "A detection produced on the built-in warmup image")
public record WarmupDetectionResponse(
        @Schema(description = "Label of the detected class", example = "person")
        @JsonProperty("class_name") String className,
        @Schema(description = "Model confidence in [0, 1]", example = "0.31") double confidence) {

    public static WarmupDetectionResponse from(Detection detection) {
        return new WarmupDetectionResponse(detection.className(), detection.confidence());
    }
}
