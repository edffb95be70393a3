package com.example.detectionapi.service.detection;

import com.example.detectionapi.model.Detection;

import java.awt.image.BufferedImage;
import java.util.List;

/**
 * Wraps an object detection engine. Implementations are expensive to call and are not expected to
 * be thread safe: callers must never invoke {@link #infer(BufferedImage)} from more than one
 * thread at a time.
 */
public interface DetectionModel {

    /**
     * Loads model weights. Called once before any inference.
     *
     * @throws ModelUnavailableException when the model cannot be loaded
     */
    void load() throws DetectionException;

    /**
     * Runs a first inference so lazy initialisation happens before real traffic arrives.
     */
    default List<Detection> warmup(BufferedImage warmupImage) throws DetectionException {
        return infer(warmupImage);
    }

    /**
     * @param image decoded input image
     * @return detections in model output order; empty when nothing was found
     */
    List<Detection> infer(BufferedImage image) throws DetectionException;
}
