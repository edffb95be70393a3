package com.example.detectionapi.service.detection;

/**
 * Raised when the model fails on a single image. The caller may retry with another image.
 */
public class DetectionException extends Exception {

    public DetectionException(String message) {
        super(message);
    }

    public DetectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
