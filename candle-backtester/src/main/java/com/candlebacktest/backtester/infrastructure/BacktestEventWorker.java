package com.candlebacktest.backtester.infrastructure;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Background worker that drains the event queue and hands each event to every subscriber.
 * A failing subscriber is logged and does not affect the others.
 */
@RequiredArgsConstructor
@Slf4j
public class BacktestEventWorker implements Runnable {

    private static final long POLL_TIMEOUT_MS = 500;

    private final BacktestEventQueue queue;
    private final List<BacktestEventSubscriber> subscribers;
    private final String workerName;

    private volatile boolean running = true;

    @Override
    public void run() {
        log.info("{} started and polling event queue", workerName);

        while (running) {
            try {
                BacktestEvent event = queue.poll(POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
                if (event != null) {
                    dispatch(event);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("{} interrupted", workerName);
                break;
            }
        }

        log.info("{} stopped", workerName);
    }

    void dispatch(BacktestEvent event) {
        MDC.put("runId", event.getRunId());
        try {
            for (BacktestEventSubscriber subscriber : subscribers) {
                try {
                    subscriber.onEvent(event);
                } catch (RuntimeException e) {
                    log.error("Subscriber {} failed on {} event: {}",
                            subscriber.getClass().getSimpleName(), event.getType(), e.getMessage(), e);
                }
            }
        } finally {
            MDC.remove("runId");
        }
    }

    /**
     * Gracefully stop the worker.
     */
    public void stop() {
        log.info("Stopping {}", workerName);
        running = false;
    }
}
