package com.example.detectionapi.service.pipeline;

/**
 * Thrown to request handlers once the inference worker has stopped because the model failed
 * fatally.
 */
public class PipelineUnavailableException extends RuntimeException {

    public PipelineUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
