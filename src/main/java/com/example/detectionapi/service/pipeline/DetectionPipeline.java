package com.example.detectionapi.service.pipeline;

import com.example.detectionapi.config.PipelineProperties;
import com.example.detectionapi.model.Detection;
import com.example.detectionapi.model.DetectionBatch;
import com.example.detectionapi.model.PendingImage;
import com.example.detectionapi.model.PredictionResult;
import com.example.detectionapi.service.detection.DetectionException;
import com.example.detectionapi.service.detection.DetectionModel;
import com.example.detectionapi.util.WarmupImageFactory;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-wide pipeline state: the ingestion mailbox, the result store and the inference worker
 * that connects them. The model is loaded and warmed up during bean initialisation, before the
 * web server starts accepting requests; a failure there aborts startup.
 */
@Service
public class DetectionPipeline {

    private static final Logger log = LoggerFactory.getLogger(DetectionPipeline.class);

    private final DetectionModel model;
    private final PipelineProperties properties;
    private final ThreadPoolTaskExecutor executor;
    private final LatestImageMailbox mailbox = new LatestImageMailbox();
    private final ResultStore store = new ResultStore();
    private final InferenceWorker worker;
    private final Clock clock;
    private final AtomicLong sequence = new AtomicLong();

    private BufferedImage warmupImage;
    private List<Detection> warmupDetections = List.of();

    public DetectionPipeline(DetectionModel model,
                             PipelineProperties properties,
                             @Qualifier("inferenceExecutor") ThreadPoolTaskExecutor executor,
                             Clock clock) {
        this.model = model;
        this.properties = properties;
        this.executor = executor;
        this.clock = clock;
        this.worker = new InferenceWorker(mailbox, store, model, clock);
    }

    @PostConstruct
    public void start() {
        warmupImage = WarmupImageFactory.create(
                properties.getWarmupWidth(), properties.getWarmupHeight(), properties.getWarmupSeed());
        try {
            model.load();
            long warmupStart = System.nanoTime();
            warmupDetections = DetectionBatch.sortByConfidence(model.warmup(warmupImage));
            log.info("Detection model warmed up in {} ms ({} detections on the {}x{} warmup image)",
                    Duration.ofNanos(System.nanoTime() - warmupStart).toMillis(),
                    warmupDetections.size(), warmupImage.getWidth(), warmupImage.getHeight());
        } catch (DetectionException | RuntimeException ex) {
            log.error("Detection model failed to start", ex);
            throw new IllegalStateException("Detection model failed to load or warm up: " + ex.getMessage(), ex);
        }
        executor.execute(worker);
        log.info("Detection pipeline started");
    }

    @PreDestroy
    public void stop() {
        log.info("Stopping detection pipeline after {} submissions ({} discarded, {} published, {} failed)",
                mailbox.submittedCount(), mailbox.discardedCount(), worker.processedCount(), worker.failedCount());
        executor.shutdown();
    }

    /**
     * Hands a decoded image to the worker, replacing any image it has not picked up yet.
     *
     * @return the sequence number assigned to the image
     */
    public long submit(BufferedImage image) {
        Objects.requireNonNull(image, "image must not be null");
        ensureAvailable();
        long id = sequence.incrementAndGet();
        mailbox.submit(new PendingImage(id, image, clock.instant()));
        log.debug("Accepted image #{} ({}x{}) for prediction", id, image.getWidth(), image.getHeight());
        return id;
    }

    public Optional<DetectionBatch> latestBatch() {
        return store.snapshot();
    }

    public PredictionResult latestPrediction() {
        return PredictionResult.from(store.snapshot());
    }

    /**
     * Detections for the built-in warmup image, sorted by confidence. Recomputed through the
     * worker's model lock on every call unless {@code pipeline.health-recompute} is off.
     */
    public List<Detection> warmupDetections() {
        if (!properties.isHealthRecompute()) {
            return warmupDetections;
        }
        ensureAvailable();
        try {
            return DetectionBatch.sortByConfidence(worker.detectExclusively(warmupImage));
        } catch (DetectionException | RuntimeException ex) {
            log.warn("Warmup image inference failed: {}", ex.getMessage());
            throw new PipelineUnavailableException("Detection model failed on the warmup image", ex);
        }
    }

    public boolean isAvailable() {
        return worker.fatalFailure().isEmpty();
    }

    public long submittedCount() {
        return mailbox.submittedCount();
    }

    public long discardedCount() {
        return mailbox.discardedCount();
    }

    public long processedCount() {
        return worker.processedCount();
    }

    public long failedCount() {
        return worker.failedCount();
    }

    private void ensureAvailable() {
        Optional<Throwable> failure = worker.fatalFailure();
        if (failure.isPresent()) {
            throw new PipelineUnavailableException("Detection model is unavailable", failure.get());
        }
    }
}
