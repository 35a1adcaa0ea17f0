package io.socketrelay.server.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Periodic ping/pong sweep over every open connection.
 *
 * <p>A connection that has not answered the probe of the previous tick is terminated and handed to
 * the eviction callback; every other connection is marked pending and probed again.
 */
public final class LivenessMonitor implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(LivenessMonitor.class);

    private final ConnectionRegistry registry;
    private final Consumer<Connection> onEvict;
    private final Duration interval;
    private ScheduledExecutorService scheduler;

    public LivenessMonitor(ConnectionRegistry registry, Consumer<Connection> onEvict, Duration interval) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.onEvict = Objects.requireNonNull(onEvict, "onEvict");
        this.interval = Objects.requireNonNull(interval, "interval");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive");
        }
    }

    public Duration interval() {
        return interval;
    }

    public synchronized void start() {
        if (scheduler != null) return;
        scheduler = RelayThreads.newScheduler("socket-relay-liveness");
        long millis = interval.toMillis();
        scheduler.scheduleAtFixedRate(this::sweep, millis, millis, TimeUnit.MILLISECONDS);
        log.info("Liveness monitor started, interval {}", interval);
    }

    /**
     * Runs one sweep.
     *
     * @return number of connections evicted
     */
    public int tick() {
        int evicted = 0;
        for (Connection connection : registry.openConnections()) {
            if (connection.probe()) continue;
            log.info("Terminating unresponsive connection {}", connection);
            connection.terminate();
            onEvict.accept(connection);
            evicted++;
        }
        return evicted;
    }

    private void sweep() {
        try {
            tick();
        } catch (RuntimeException e) {
            // an exception would cancel the schedule
            log.error("Liveness sweep failed", e);
        }
    }

    @Override
    public synchronized void close() {
        if (scheduler == null) return;
        scheduler.shutdownNow();
        scheduler = null;
        log.info("Liveness monitor stopped");
    }
}
