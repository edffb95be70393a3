package com.example.detectionapi.model;

import java.util.Objects;

public record Detection(String className, double confidence, BoundingBox boundingBox) {

    public Detection {
        Objects.requireNonNull(className, "className must not be null");
        Objects.requireNonNull(boundingBox, "boundingBox must not be null");
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Detection confidence must be within [0, 1] but was " + confidence);
        }
    }
}
