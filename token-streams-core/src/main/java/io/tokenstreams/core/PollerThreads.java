package io.tokenstreams.core;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;

/**
 * Thread factory for a stream's poller threads.
 */
final class PollerThreads implements ThreadFactory {
    private final String prefix;

    PollerThreads(String prefix) {
        this.prefix = Objects.requireNonNull(prefix, "prefix");
    }

    @Override
    public Thread newThread(Runnable runnable) {
        return newThread(runnable, "worker");
    }

    Thread newThread(Runnable runnable, String role) {
        Thread thread = new Thread(runnable);
        thread.setName(prefix + "-" + role);
        thread.setDaemon(true);
        return thread;
    }
}
