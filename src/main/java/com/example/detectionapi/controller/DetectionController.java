package com.example.detectionapi.controller;

import com.example.detectionapi.model.api.PredictionResponse;
import com.example.detectionapi.model.api.SubmissionResponse;
import com.example.detectionapi.model.api.WarmupDetectionResponse;
import com.example.detectionapi.model.api.WarmupResponse;
import com.example.detectionapi.service.pipeline.DetectionPipeline;
import com.example.detectionapi.util.ImageDecoder;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.List;
import java.util.stream.Collectors;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

@RestController
@Tag(name = "Detection", description = "Latest-wins object detection endpoints")
public class DetectionController {

    private static final Logger log = LoggerFactory.getLogger(DetectionController.class);

    private final DetectionPipeline pipeline;

    public DetectionController(DetectionPipeline pipeline) {
        this.pipeline = pipeline;
    }

    @GetMapping("/")
    @Operation(summary = "Health check", description = "Runs the model on the built-in warmup image and returns its detections.")
    public ResponseEntity<WarmupResponse> health() {
        List<WarmupDetectionResponse> detections = pipeline.warmupDetections().stream()
                .map(WarmupDetectionResponse::from)
                .collect(Collectors.toList());
        return ResponseEntity.ok(new WarmupResponse(detections));
    }

    @Operation(
            summary = "Submit an image for detection",
            description = "Accepts a JPEG, PNG, BMP or TIFF image and queues it for the background worker. "
                    + "An image still waiting for the worker is replaced by the newer upload.")
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "Image accepted for processing",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON_VALUE,
                            schema = @Schema(implementation = SubmissionResponse.class))),
            @ApiResponse(responseCode = "400", description = "Missing or undecodable image", content = @Content)
    })
    @PostMapping(value = {"/predict/", "/predict"}, consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<SubmissionResponse> predict(
            @Parameter(description = "Image to run detection on", required = true)
            @RequestPart("image") MultipartFile image) {
        BufferedImage decoded = readImage(image);
        long sequence = pipeline.submit(decoded);
        log.debug("Queued upload '{}' as image #{}", image.getOriginalFilename(), sequence);
        return ResponseEntity.ok(SubmissionResponse.accepted());
    }

    @GetMapping({"/result/", "/result"})
    @Operation(summary = "Most recent detection result",
            description = "Returns the latest published detections, or an explicit empty state before the first result.")
    public ResponseEntity<PredictionResponse> result() {
        return ResponseEntity.ok(PredictionResponse.from(pipeline.latestPrediction()));
    }

    private BufferedImage readImage(MultipartFile image) {
        if (image == null || image.isEmpty()) {
            throw new ResponseStatusException(BAD_REQUEST, "Image file is required");
        }
        try {
            return ImageDecoder.decode(image.getBytes());
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(BAD_REQUEST, ex.getMessage(), ex);
        } catch (IOException ex) {
            throw new ResponseStatusException(BAD_REQUEST, "Failed to read uploaded image", ex);
        }
    }
}
