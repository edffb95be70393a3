package com.example.detectionapi.model;

import java.awt.image.BufferedImage;
import java.time.Instant;
import java.util.Objects;

/**
 * A decoded upload waiting for inference. The {@code sequence} is assigned on submission and
 * only used to trace an image through the logs.
 */
public record PendingImage(long sequence, BufferedImage image, Instant receivedAt) {

    public PendingImage {
        Objects.requireNonNull(image, "image must not be null");
        Objects.requireNonNull(receivedAt, "receivedAt must not be null");
    }

    public int width() {
        return image.getWidth();
    }

    public int height() {
        return image.getHeight();
    }
}
