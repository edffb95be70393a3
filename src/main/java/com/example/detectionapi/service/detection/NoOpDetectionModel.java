package com.example.detectionapi.service.detection;

import com.example.detectionapi.model.Detection;

import java.awt.image.BufferedImage;
import java.util.List;

/**
 * Fallback model that never detects anything. Lets the service run end to end when no model
 * file is available.
 */
public class NoOpDetectionModel implements DetectionModel {

    @Override
    public void load() {
    }

    @Override
    public List<Detection> infer(BufferedImage image) {
        return List.of();
    }
}
