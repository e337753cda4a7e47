package com.aicli.isolation.network;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Timer-fed stream of {@link NetworkStats} for one network. Closing the stream stops sampling;
 * samples already queued can still be polled.
 */
public class NetworkUsageStream implements AutoCloseable {

    static final int BUFFER_SIZE = 10;

    private final String networkId;
    private final BlockingQueue<NetworkStats> buffer = new ArrayBlockingQueue<>(BUFFER_SIZE);
    private volatile ScheduledFuture<?> sampler;
    private volatile boolean closed;

    NetworkUsageStream(String networkId) {
        this.networkId = networkId;
    }

    void attach(ScheduledFuture<?> future) {
        this.sampler = future;
        if (closed) {
            future.cancel(false);
        }
    }

    /**
     * @return false when the stream is closed or the buffer is full
     */
    boolean publish(NetworkStats stats) {
        return !closed && buffer.offer(stats);
    }

    public String getNetworkId() {
        return networkId;
    }

    /**
     * Waits up to {@code timeout} for the next sample.
     *
     * @return the sample, or {@code null} on timeout
     */
    public NetworkStats poll(Duration timeout) throws InterruptedException {
        return buffer.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        closed = true;
        ScheduledFuture<?> future = sampler;
        if (future != null) {
            future.cancel(false);
        }
    }
}
