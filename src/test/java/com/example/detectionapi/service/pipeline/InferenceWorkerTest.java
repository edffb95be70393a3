package com.example.detectionapi.service.pipeline;

import com.example.detectionapi.model.BoundingBox;
import com.example.detectionapi.model.Detection;
import com.example.detectionapi.model.DetectionBatch;
import com.example.detectionapi.model.PendingImage;
import com.example.detectionapi.service.detection.DetectionException;
import com.example.detectionapi.service.detection.DetectionModel;
import com.example.detectionapi.service.detection.ModelUnavailableException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class InferenceWorkerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-06-10T12:00:00Z"), ZoneOffset.UTC);

    private final LatestImageMailbox mailbox = new LatestImageMailbox();
    private final ResultStore store = new ResultStore();
    private final AtomicLong ids = new AtomicLong();
    private Thread workerThread;

    @AfterEach
    void stopWorker() throws InterruptedException {
        if (workerThread != null) {
            workerThread.interrupt();
            workerThread.join(2_000);
        }
    }

    @Test
    void publishesSortedBatchForClaimedImage() throws Exception {
        DetectionModel model = mock(DetectionModel.class);
        PendingImage image = image();
        when(model.infer(image.image())).thenReturn(List.of(
                detection("chair", 0.3), detection("person", 0.9), detection("cup", 0.5)));
        InferenceWorker worker = new InferenceWorker(mailbox, store, model, CLOCK);

        assertThat(worker.process(image)).isEqualTo(InferenceWorker.Outcome.PUBLISHED);

        DetectionBatch batch = store.snapshot().orElseThrow();
        assertThat(batch.detections()).extracting(Detection::confidence).containsExactly(0.9, 0.5, 0.3);
        assertThat(batch.timestamp()).isEqualTo(CLOCK.instant());
        assertThat(worker.processedCount()).isEqualTo(1);
    }

    @Test
    void failedInferenceKeepsPreviouslyPublishedBatch() throws Exception {
        DetectionModel model = mock(DetectionModel.class);
        PendingImage good = image();
        PendingImage corrupt = image();
        when(model.infer(good.image())).thenReturn(List.of(detection("person", 0.8)));
        when(model.infer(corrupt.image())).thenThrow(new DetectionException("corrupt input"));
        InferenceWorker worker = new InferenceWorker(mailbox, store, model, CLOCK);

        worker.process(good);
        DetectionBatch published = store.snapshot().orElseThrow();

        assertThat(worker.process(corrupt)).isEqualTo(InferenceWorker.Outcome.FAILED);
        assertThat(store.snapshot()).containsSame(published);
        assertThat(worker.failedCount()).isEqualTo(1);
        assertThat(worker.fatalFailure()).isEmpty();
    }

    @Test
    void unexpectedRuntimeFailureIsTreatedAsRecoverable() throws Exception {
        DetectionModel model = mock(DetectionModel.class);
        when(model.infer(any())).thenThrow(new IllegalArgumentException("bad tensor"));
        InferenceWorker worker = new InferenceWorker(mailbox, store, model, CLOCK);

        assertThat(worker.process(image())).isEqualTo(InferenceWorker.Outcome.FAILED);
        assertThat(store.snapshot()).isEmpty();
    }

    @Test
    void workerKeepsRunningAfterFailedInference() throws Exception {
        DetectionModel model = mock(DetectionModel.class);
        PendingImage corrupt = image();
        PendingImage good = image();
        when(model.infer(corrupt.image())).thenThrow(new DetectionException("corrupt input"));
        when(model.infer(good.image())).thenReturn(List.of(detection("person", 0.6)));
        InferenceWorker worker = new InferenceWorker(mailbox, store, model, CLOCK);
        start(worker);

        mailbox.submit(corrupt);
        awaitTrue(() -> worker.failedCount() == 1);
        mailbox.submit(good);
        awaitTrue(() -> worker.processedCount() == 1);

        assertThat(store.snapshot().orElseThrow().detections()).extracting(Detection::className).containsExactly("person");
        assertThat(worker.isRunning()).isTrue();
    }

    @Test
    void onlyLatestSubmissionReachesModelWhileWorkerIsBusy() throws Exception {
        CountDownLatch inferenceStarted = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        DetectionModel model = mock(DetectionModel.class);
        PendingImage inFlight = image();
        PendingImage stale = image();
        PendingImage latest = image();
        when(model.infer(inFlight.image())).thenAnswer(invocation -> {
            inferenceStarted.countDown();
            assertThat(release.await(5, TimeUnit.SECONDS)).isTrue();
            return List.of(detection("in-flight", 0.5));
        });
        when(model.infer(latest.image())).thenReturn(List.of(detection("latest", 0.7)));
        InferenceWorker worker = new InferenceWorker(mailbox, store, model, CLOCK);
        start(worker);

        mailbox.submit(inFlight);
        assertThat(inferenceStarted.await(5, TimeUnit.SECONDS)).isTrue();
        mailbox.submit(stale);
        mailbox.submit(latest);
        release.countDown();
        awaitTrue(() -> worker.processedCount() == 2);

        verify(model, never()).infer(same(stale.image()));
        assertThat(mailbox.discardedCount()).isEqualTo(1);
        assertThat(store.snapshot().orElseThrow().detections()).extracting(Detection::className).containsExactly("latest");
    }

    @Test
    void neverRunsTwoInferencesConcurrently() throws Exception {
        ConcurrencyTrackingModel model = new ConcurrencyTrackingModel();
        InferenceWorker worker = new InferenceWorker(mailbox, store, model, CLOCK);
        start(worker);

        int submitters = 6;
        int perSubmitter = 40;
        List<Thread> threads = new ArrayList<>();
        for (int t = 0; t < submitters; t++) {
            Thread submitter = new Thread(() -> {
                for (int i = 0; i < perSubmitter; i++) {
                    mailbox.submit(image());
                    Thread.yield();
                }
            });
            threads.add(submitter);
        }
        Thread healthChecker = new Thread(() -> {
            for (int i = 0; i < 20; i++) {
                try {
                    worker.detectExclusively(new BufferedImage(2, 2, BufferedImage.TYPE_INT_RGB));
                } catch (DetectionException ex) {
                    throw new IllegalStateException(ex);
                }
            }
        });
        threads.add(healthChecker);
        threads.forEach(Thread::start);
        for (Thread thread : threads) {
            thread.join(10_000);
        }

        long total = (long) submitters * perSubmitter;
        awaitTrue(() -> worker.processedCount() + mailbox.discardedCount() == total);

        assertThat(model.maxConcurrent.get()).isEqualTo(1);
        assertThat(model.duplicateCalls.get()).isZero();
        assertThat(worker.processedCount()).isPositive();
    }

    @Test
    void modelUnavailableStopsWorkerAndRecordsCause() throws Exception {
        DetectionModel model = mock(DetectionModel.class);
        ModelUnavailableException deviceLost = new ModelUnavailableException("device lost");
        when(model.infer(any())).thenThrow(deviceLost);
        InferenceWorker worker = new InferenceWorker(mailbox, store, model, CLOCK);
        start(worker);

        mailbox.submit(image());
        workerThread.join(5_000);

        assertThat(workerThread.isAlive()).isFalse();
        assertThat(worker.isRunning()).isFalse();
        assertThat(worker.fatalFailure()).containsSame(deviceLost);
        assertThat(store.snapshot()).isEmpty();
    }

    @Test
    void processPropagatesModelUnavailable() throws Exception {
        DetectionModel model = mock(DetectionModel.class);
        when(model.infer(any())).thenThrow(new ModelUnavailableException("not loaded"));
        InferenceWorker worker = new InferenceWorker(mailbox, store, model, CLOCK);

        assertThatThrownBy(() -> worker.process(image())).isInstanceOf(ModelUnavailableException.class);
        assertThat(worker.failedCount()).isEqualTo(1);
    }

    private void start(InferenceWorker worker) {
        workerThread = new Thread(worker, "inference-test");
        workerThread.start();
    }

    private PendingImage image() {
        return new PendingImage(ids.incrementAndGet(), new BufferedImage(8, 8, BufferedImage.TYPE_INT_RGB), Instant.now());
    }

    private static Detection detection(String name, double confidence) {
        return new Detection(name, confidence, new BoundingBox(1, 1, 5, 5));
    }

    private static void awaitTrue(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 10_000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                throw new AssertionError("Condition not met within timeout");
            }
            Thread.sleep(5);
        }
    }

    private static final class ConcurrencyTrackingModel implements DetectionModel {

        private final AtomicInteger inFlight = new AtomicInteger();
        private final AtomicInteger maxConcurrent = new AtomicInteger();
        private final AtomicInteger duplicateCalls = new AtomicInteger();
        private final Map<BufferedImage, Boolean> seen = Collections.synchronizedMap(new IdentityHashMap<>());

        @Override
        public void load() {
        }

        @Override
        public List<Detection> infer(BufferedImage image) {
            int current = inFlight.incrementAndGet();
            maxConcurrent.accumulateAndGet(current, Math::max);
            try {
                if (image.getWidth() > 2 && seen.put(image, Boolean.TRUE) != null) {
                    duplicateCalls.incrementAndGet();
                }
                Thread.sleep(2);
                return List.of(detection("object", 0.5));
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                return List.of();
            } finally {
                inFlight.decrementAndGet();
            }
        }
    }
}
