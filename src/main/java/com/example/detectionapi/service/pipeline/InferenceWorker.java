package com.example.detectionapi.service.pipeline;

import com.example.detectionapi.model.Detection;
import com.example.detectionapi.model.DetectionBatch;
import com.example.detectionapi.model.PendingImage;
import com.example.detectionapi.service.detection.DetectionException;
import com.example.detectionapi.service.detection.DetectionModel;
import com.example.detectionapi.service.detection.ModelUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Drains the {@link LatestImageMailbox}, runs every claimed image through the
 * {@link DetectionModel} and publishes the outcome to the {@link ResultStore}. Exactly one thread
 * runs {@link #run()}; every model call, including the ones made on behalf of the health endpoint,
 * goes through {@link #detectExclusively(BufferedImage)} so the model never sees two callers.
 */
public class InferenceWorker implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(InferenceWorker.class);

    enum Outcome {
        PUBLISHED,
        FAILED
    }

    private final LatestImageMailbox mailbox;
    private final ResultStore store;
    private final DetectionModel model;
    private final Clock clock;
    private final ReentrantLock modelLock = new ReentrantLock();
    private final AtomicLong processed = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    private volatile boolean running;
    private volatile Throwable fatalFailure;

    public InferenceWorker(LatestImageMailbox mailbox, ResultStore store, DetectionModel model, Clock clock) {
        this.mailbox = mailbox;
        this.store = store;
        this.model = model;
        this.clock = clock;
    }

    @Override
    public void run() {
        running = true;
        log.info("Inference worker started on thread {}", Thread.currentThread().getName());
        try {
            while (!Thread.currentThread().isInterrupted()) {
                PendingImage image = mailbox.take();
                process(image);
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.info("Inference worker interrupted, stopping");
        } catch (ModelUnavailableException ex) {
            fatalFailure = ex;
            log.error("Detection model is no longer available, inference worker stopped", ex);
        } catch (Error error) {
            fatalFailure = error;
            log.error("Fatal error in inference worker", error);
            throw error;
        } finally {
            running = false;
        }
    }

    /**
     * Runs one claimed image to completion. A failed inference leaves the previously published
     * batch in place.
     *
     * @throws ModelUnavailableException when the model cannot run any more
     */
    Outcome process(PendingImage image) throws ModelUnavailableException {
        long start = System.nanoTime();
        List<Detection> detections;
        try {
            detections = detectExclusively(image.image());
        } catch (ModelUnavailableException ex) {
            failed.incrementAndGet();
            throw ex;
        } catch (DetectionException | RuntimeException ex) {
            failed.incrementAndGet();
            log.warn("Inference failed for image #{} ({}x{}), keeping previous result: {}",
                    image.sequence(), image.width(), image.height(), ex.getMessage(), ex);
            return Outcome.FAILED;
        }
        DetectionBatch batch = DetectionBatch.of(detections, clock);
        store.publish(batch);
        processed.incrementAndGet();
        long elapsedMs = Duration.ofNanos(System.nanoTime() - start).toMillis();
        log.debug("Image #{} produced {} detections in {} ms", image.sequence(), batch.size(), elapsedMs);
        return Outcome.PUBLISHED;
    }

    /**
     * Calls the model while holding the model lock, waiting for any inference in progress.
     */
    public List<Detection> detectExclusively(BufferedImage image) throws DetectionException {
        modelLock.lock();
        try {
            return model.infer(image);
        } finally {
            modelLock.unlock();
        }
    }

    public boolean isRunning() {
        return running;
    }

    public Optional<Throwable> fatalFailure() {
        return Optional.ofNullable(fatalFailure);
    }

    public long processedCount() {
        return processed.get();
    }

    public long failedCount() {
        return failed.get();
    }
}
