package com.example.detectionapi.service.detection;

/**
 * Raised when the model can no longer run at all, for example when it failed to load or its
 * device was lost. Unlike a plain {@link DetectionException} this is not recoverable.
 */
public class ModelUnavailableException extends DetectionException {

    public ModelUnavailableException(String message) {
        super(message);
    }

    public ModelUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
