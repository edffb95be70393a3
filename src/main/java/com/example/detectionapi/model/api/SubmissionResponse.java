package com.example.detectionapi.model.api;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Acknowledgement that an image was accepted for processing")
public record SubmissionResponse(
        @Schema(example = "Image received for prediction") String status) {

    public static final String ACCEPTED = "Image received for prediction";

    public static SubmissionResponse accepted() {
        return new SubmissionResponse(ACCEPTED);
    }
}
