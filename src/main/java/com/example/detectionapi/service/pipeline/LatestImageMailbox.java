package com.example.detectionapi.service.pipeline;

import com.example.detectionapi.model.PendingImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Capacity-one hand-off between request threads and the inference worker. A submission replaces
 * any image the worker has not claimed yet, so the worker always sees the freshest upload and the
 * mailbox never grows.
 */
public class LatestImageMailbox {

    private static final Logger log = LoggerFactory.getLogger(LatestImageMailbox.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition imageAvailable = lock.newCondition();
    private final AtomicLong submitted = new AtomicLong();
    private final AtomicLong discarded = new AtomicLong();

    private PendingImage pending;

    /**
     * Stores {@code image} as the pending item without waiting on the worker.
     *
     * @return {@code true} when an image that had not been claimed yet was replaced
     */
    public boolean submit(PendingImage image) {
        Objects.requireNonNull(image, "image must not be null");
        PendingImage replaced;
        lock.lock();
        try {
            replaced = pending;
            pending = image;
            imageAvailable.signal();
        } finally {
            lock.unlock();
        }
        submitted.incrementAndGet();
        if (replaced != null) {
            discarded.incrementAndGet();
            log.debug("Image #{} replaced unclaimed image #{}", image.sequence(), replaced.sequence());
            return true;
        }
        return false;
    }

    /**
     * Removes and returns the pending image, waiting until one is submitted. Only the inference
     * worker calls this.
     */
    public PendingImage take() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (pending == null) {
                imageAvailable.await();
            }
            PendingImage claimed = pending;
            pending = null;
            return claimed;
        } finally {
            lock.unlock();
        }
    }

    public boolean hasPending() {
        lock.lock();
        try {
            return pending != null;
        } finally {
            lock.unlock();
        }
    }

    public long submittedCount() {
        return submitted.get();
    }

    public long discardedCount() {
        return discarded.get();
    }
}
