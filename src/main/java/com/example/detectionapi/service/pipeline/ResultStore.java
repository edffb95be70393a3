package com.example.detectionapi.service.pipeline;

import com.example.detectionapi.model.DetectionBatch;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the most recently completed {@link DetectionBatch}. Batches are immutable and swapped in
 * as a whole, so a reader sees either the previous or the new batch, never a mix.
 */
public class ResultStore {

    private final AtomicReference<DetectionBatch> latest = new AtomicReference<>();

    public void publish(DetectionBatch batch) {
        latest.set(Objects.requireNonNull(batch, "batch must not be null"));
    }

    public Optional<DetectionBatch> snapshot() {
        return Optional.ofNullable(latest.get());
    }
}
