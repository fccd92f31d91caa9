package com.dealtracker.poller.domain.notification;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Outbound side of one live viewer. Producers never block: a full queue rejects the message and
 * the registry drops the connection. A single consumer drains the queue onto the transport.
 */
public class LiveConnection {

    private final String id;
    private final BlockingQueue<String> outbound;
    private final AtomicBoolean closed = new AtomicBoolean();

    public LiveConnection(String id, int capacity) {
        this.id = id;
        this.outbound = new ArrayBlockingQueue<>(capacity);
    }

    public String id() {
        return id;
    }

    public boolean offer(String payload) {
        return !closed.get() && outbound.offer(payload);
    }

    /** Next payload, or {@code null} if none arrived within {@code timeout}. */
    public String poll(Duration timeout) throws InterruptedException {
        return outbound.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public int pending() {
        return outbound.size();
    }

    public void close() {
        if (closed.compareAndSet(false, true)) {
            outbound.clear();
        }
    }

    public boolean isClosed() {
        return closed.get();
    }
}
