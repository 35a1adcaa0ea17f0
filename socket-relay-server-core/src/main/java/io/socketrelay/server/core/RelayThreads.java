package io.socketrelay.server.core;

import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Daemon thread pools for blocking store calls and the liveness schedule. Thread names are
 * {@code <name>-<n>}.
 */
public final class RelayThreads {
    private RelayThreads() {
    }

    /** Fixed pool that runs blocking {@code ChatStore} calls off the transport threads. */
    public static ExecutorService newStoreExecutor(String name, int threads) {
        if (threads < 1) throw new IllegalArgumentException("threads must be >= 1: " + threads);
        return Executors.newFixedThreadPool(threads, daemonThreads(name));
    }

    static ScheduledExecutorService newScheduler(String name) {
        return Executors.newSingleThreadScheduledExecutor(daemonThreads(name));
    }

    static ThreadFactory daemonThreads(String name) {
        Objects.requireNonNull(name, "name");
        AtomicInteger sequence = new AtomicInteger();
        return task -> {
            Thread thread = new Thread(task, name + "-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
