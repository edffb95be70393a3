package com.example.detectionapi.model;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * The outcome of one completed inference. Detections are ordered by confidence, highest first;
 * equal confidences keep the order the model emitted them in.
 */
public record DetectionBatch(List<Detection> detections, Instant timestamp) {

    private static final Comparator<Detection> BY_CONFIDENCE_DESC =
            Comparator.comparingDouble(Detection::confidence).reversed();

    public DetectionBatch {
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        detections = List.copyOf(Objects.requireNonNull(detections, "detections must not be null"));
    }

    public static DetectionBatch of(List<Detection> modelOutput, Clock clock) {
        return new DetectionBatch(sortByConfidence(modelOutput), clock.instant());
    }

    public static List<Detection> sortByConfidence(List<Detection> modelOutput) {
        List<Detection> sorted = new ArrayList<>(modelOutput);
        // List.sort is a stable merge sort
        sorted.sort(BY_CONFIDENCE_DESC);
        return sorted;
    }

    public int size() {
        return detections.size();
    }

    public boolean isEmpty() {
        return detections.isEmpty();
    }
}
