package com.example.detectionapi.model;

import java.util.List;

/**
 * Axis-aligned rectangle describing a detected object inside a source image. Coordinates follow
 * the image pixel grid with the origin located in the top-left corner, expressed as the top-left
 * {@code (x1, y1)} and bottom-right {@code (x2, y2)} corners.
 */
public record BoundingBox(double x1, double y1, double x2, double y2) {

    public BoundingBox {
        if (!(x1 < x2)) {
            throw new IllegalArgumentException("Bounding box x1 must be smaller than x2");
        }
        if (!(y1 < y2)) {
            throw new IllegalArgumentException("Bounding box y1 must be smaller than y2");
        }
    }

    public double width() {
        return x2 - x1;
    }

    public double height() {
        return y2 - y1;
    }

    public double area() {
        return width() * height();
    }

    public List<Double> toList() {
        return List.of(x1, y1, x2, y2);
    }
}
