package com.aicli.isolation.monitor;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Bounded pull channel returned by {@link SecurityMonitor#startMonitoring()}. The monitor offers
 * without blocking; consumers poll. Closing is idempotent and stops new offers, while alerts
 * already queued can still be drained.
 */
public class AlertChannel {

    private final BlockingQueue<SecurityAlert> queue;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public AlertChannel(int capacity) {
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    /**
     * @return false when the channel is full or closed
     */
    boolean offer(SecurityAlert alert) {
        if (closed.get()) {
            return false;
        }
        return queue.offer(alert);
    }

    /**
     * Waits up to {@code timeout} for the next alert.
     *
     * @return the alert, or {@code null} on timeout or once closed and drained
     */
    public SecurityAlert poll(Duration timeout) throws InterruptedException {
        if (closed.get()) {
            return queue.poll();
        }
        return queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * @return true only for the call that actually closed the channel
     */
    boolean close() {
        return closed.compareAndSet(false, true);
    }

    public boolean isClosed() {
        return closed.get();
    }

    public boolean isDrained() {
        return closed.get() && queue.isEmpty();
    }

    public int size() {
        return queue.size();
    }

    public int capacity() {
        return queue.size() + queue.remainingCapacity();
    }
}
