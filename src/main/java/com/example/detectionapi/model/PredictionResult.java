package com.example.detectionapi.model;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * What a reader of the latest result can observe: nothing published yet, a published batch with
 * no objects in it, or a published batch with detections.
 */
public interface PredictionResult {

    static PredictionResult from(Optional<DetectionBatch> snapshot) {
        if (snapshot.isEmpty()) {
            return new NoResultYet();
        }
        DetectionBatch batch = snapshot.get();
        if (batch.isEmpty()) {
            return new EmptyResult(batch.timestamp());
        }
        return new Result(batch.timestamp(), batch.detections());
    }

    record NoResultYet() implements PredictionResult {
    }

    record EmptyResult(Instant timestamp) implements PredictionResult {
    }

    record Result(Instant timestamp, List<Detection> detections) implements PredictionResult {

        public Result {
            detections = List.copyOf(detections);
        }
    }
}
