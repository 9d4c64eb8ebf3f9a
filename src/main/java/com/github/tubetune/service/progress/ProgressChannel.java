package com.github.tubetune.service.progress;

import com.github.tubetune.service.messaging.MessagingGateway;
import com.github.tubetune.util.PipelineConstants;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Progress stream of one task.
 * <p>
 * Values are clamped to 0..99, non-increasing values are dropped and accepted
 * values are throttled by time and by delta. Sends run on the progress executor
 * with at most one in flight; a send always carries the newest accepted value,
 * older pending ones are coalesced. After {@link #close()} returns no further
 * progress reaches the gateway.
 */
@Slf4j
public class ProgressChannel implements ProgressSink, AutoCloseable {

    private static final int NONE = -1;

    private final String ownerId;
    private final String taskId;
    private final MessagingGateway gateway;
    private final Executor executor;
    private final Clock clock;
    private final long intervalMs;
    private final int minDelta;
    private final Duration closeTimeout;

    // Guarded by this
    private int lastAccepted = NONE;
    private long lastAcceptedAt;
    private int pending = NONE;
    private int lastSent = NONE;
    private boolean inFlight;
    private boolean closed;

    ProgressChannel(String ownerId, String taskId, MessagingGateway gateway, Executor executor,
                    Clock clock, long intervalMs, int minDelta, Duration closeTimeout) {
        this.ownerId = ownerId;
        this.taskId = taskId;
        this.gateway = gateway;
        this.executor = executor;
        this.clock = clock;
        this.intervalMs = intervalMs;
        this.minDelta = minDelta;
        this.closeTimeout = closeTimeout;
    }

    @Override
    public void report(int percent) {
        int clamped = Math.max(0, Math.min(PipelineConstants.MAX_REPORTED_PERCENT, percent));
        long now = clock.millis();

        synchronized (this) {
            if (closed || clamped <= lastAccepted) {
                return;
            }
            if (lastAccepted != NONE
                    && (clamped - lastAccepted < minDelta || now - lastAcceptedAt < intervalMs)) {
                return;
            }

            lastAccepted = clamped;
            lastAcceptedAt = now;
            pending = clamped;

            if (inFlight) {
                return;
            }
            inFlight = true;
        }

        try {
            executor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            log.warn("Progress dispatch rejected for task {}", taskId);
            synchronized (this) {
                inFlight = false;
                notifyAll();
            }
        }
    }

    private void drain() {
        while (true) {
            int value;
            synchronized (this) {
                if (closed || pending == NONE) {
                    inFlight = false;
                    notifyAll();
                    return;
                }
                value = pending;
                pending = NONE;
            }

            try {
                gateway.sendProgress(ownerId, taskId, value);
                synchronized (this) {
                    lastSent = value;
                }
            } catch (Exception e) {
                log.warn("Progress update {}% for task {} dropped: {}", value, taskId, e.getMessage());
            }
        }
    }

    /**
     * Stop accepting progress and wait for the send in flight, if any.
     */
    @Override
    public void close() {
        long deadline = System.nanoTime() + closeTimeout.toNanos();
        synchronized (this) {
            closed = true;
            pending = NONE;
            while (inFlight) {
                long remainingMs = (deadline - System.nanoTime()) / 1_000_000;
                if (remainingMs <= 0) {
                    log.warn("Progress send for task {} still in flight after {}ms", taskId, closeTimeout.toMillis());
                    return;
                }
                try {
                    wait(remainingMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
            }
        }
    }

    public synchronized int getLastAccepted() {
        return lastAccepted;
    }

    public synchronized int getLastSent() {
        return lastSent;
    }

    public synchronized boolean isClosed() {
        return closed;
    }
}
