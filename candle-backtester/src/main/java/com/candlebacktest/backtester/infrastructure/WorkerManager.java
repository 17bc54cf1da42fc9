package com.candlebacktest.backtester.infrastructure;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Manages lifecycle of the event workers.
 * Starts workers on application startup and gracefully shuts them down.
 */
@Component
@Slf4j
public class WorkerManager {

    private final ExecutorService eventWorkerExecutorService;
    private final BacktestEventQueue eventQueue;
    private final List<BacktestEventSubscriber> subscribers;

    @Value("${backtest.events.worker-count:1}")
    private int workerCount;

    @Value("${backtest.events.enabled:true}")
    private boolean workersEnabled;

    private final List<BacktestEventWorker> workers = new ArrayList<>();

    public WorkerManager(@Qualifier("eventWorkerExecutorService") ExecutorService eventWorkerExecutorService,
                         BacktestEventQueue eventQueue,
                         List<BacktestEventSubscriber> subscribers) {
        this.eventWorkerExecutorService = eventWorkerExecutorService;
        this.eventQueue = eventQueue;
        this.subscribers = subscribers;
    }

    @PostConstruct
    public void startWorkers() {
        if (!workersEnabled) {
            log.info("Event workers are disabled");
            return;
        }

        log.info("Starting {} event workers for {} subscribers", workerCount, subscribers.size());

        for (int i = 0; i < workerCount; i++) {
            String workerName = "BacktestEventWorker-" + (i + 1);
            BacktestEventWorker worker = new BacktestEventWorker(eventQueue, subscribers, workerName);
            workers.add(worker);
            eventWorkerExecutorService.submit(worker);
            log.info("Started {}", workerName);
        }
    }

    @PreDestroy
    public void stopWorkers() {
        log.info("Stopping all event workers...");

        // Signal all workers to stop
        workers.forEach(BacktestEventWorker::stop);

        // Shutdown executor service
        eventWorkerExecutorService.shutdown();

        try {
            if (!eventWorkerExecutorService.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Event workers did not terminate gracefully, forcing shutdown");
                eventWorkerExecutorService.shutdownNow();
            } else {
                log.info("All event workers stopped gracefully");
            }
        } catch (InterruptedException e) {
            log.error("Interrupted while waiting for event workers to stop", e);
            eventWorkerExecutorService.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    int getRunningWorkers() {
        return workers.size();
    }
}
