package com.intteq.reliable.subscriber.internal;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Threads owned by the subscriber: a scheduler for processing timeouts and retry waits, and an
 * executor for synchronous {@code @EventHandler} methods.
 */
@Slf4j
@Getter
public class SubscriberExecutors implements AutoCloseable {

    private static final int SCHEDULER_THREADS = 2;

    private final ScheduledExecutorService scheduler;
    private final ExecutorService handlerExecutor;

    public SubscriberExecutors() {
        this.scheduler = Executors.newScheduledThreadPool(SCHEDULER_THREADS, daemonFactory("rsub-scheduler-"));
        this.handlerExecutor = Executors.newCachedThreadPool(daemonFactory("rsub-handler-"));
    }

    private static CustomizableThreadFactory daemonFactory(String prefix) {
        CustomizableThreadFactory factory = new CustomizableThreadFactory(prefix);
        factory.setDaemon(true);
        return factory;
    }

    @Override
    public void close() {
        scheduler.shutdown();
        handlerExecutor.shutdown();
        try {
            if (!handlerExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Handler executor did not terminate in time, forcing shutdown");
                handlerExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            handlerExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
