package com.example.detectionapi.model.api;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(description = "Detections computed on the built-in warmup image")
public record WarmupResponse(List<WarmupDetectionResponse> detections) {
}
