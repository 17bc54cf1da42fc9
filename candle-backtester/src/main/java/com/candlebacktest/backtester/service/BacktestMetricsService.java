package com.candlebacktest.backtester.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Service for tracking backtest execution metrics.
 * Exposes metrics via Spring Boot Actuator for monitoring.
 */
@Service
@Slf4j
public class BacktestMetricsService {

    private final Counter runsCompletedCounter;
    private final Counter runsFailedCounter;
    private final Counter runsCancelledCounter;
    private final Counter tradesExecutedCounter;
    private final Counter ordersRejectedCounter;
    private final Counter eventsDroppedCounter;
    private final Timer executionTimer;

    public BacktestMetricsService(MeterRegistry meterRegistry) {
        this.runsCompletedCounter = Counter.builder("backtest.runs.completed")
                .description("Total number of backtest runs completed successfully")
                .register(meterRegistry);

        this.runsFailedCounter = Counter.builder("backtest.runs.failed")
                .description("Total number of backtest runs aborted by an error")
                .register(meterRegistry);

        this.runsCancelledCounter = Counter.builder("backtest.runs.cancelled")
                .description("Total number of backtest runs cancelled by the caller")
                .register(meterRegistry);

        this.tradesExecutedCounter = Counter.builder("backtest.trades.executed")
                .description("Total number of simulated fills")
                .register(meterRegistry);

        this.ordersRejectedCounter = Counter.builder("backtest.orders.rejected")
                .description("Total number of orders rejected or clamped by the portfolio simulator")
                .register(meterRegistry);

        this.eventsDroppedCounter = Counter.builder("backtest.events.dropped")
                .description("Total number of run events dropped because the event queue was full")
                .register(meterRegistry);

        this.executionTimer = Timer.builder("backtest.execution.time")
                .description("Backtest run execution time")
                .register(meterRegistry);

        log.info("BacktestMetricsService initialized with Micrometer metrics");
    }

    /**
     * Record a successful run with its execution time and volume.
     */
    public void recordRunCompleted(long executionTimeMs, int trades, int rejectedOrders) {
        runsCompletedCounter.increment();
        executionTimer.record(executionTimeMs, TimeUnit.MILLISECONDS);
        tradesExecutedCounter.increment(trades);
        ordersRejectedCounter.increment(rejectedOrders);
    }

    public void recordRunCancelled() {
        runsCancelledCounter.increment();
    }

    public void recordRunFailed() {
        runsFailedCounter.increment();
    }

    public void recordEventDropped() {
        eventsDroppedCounter.increment();
    }

    /**
     * Get current metrics summary (for logging purposes).
     */
    public String getMetricsSummary() {
        return String.format("Metrics: Completed=%d, Failed=%d, Cancelled=%d, Trades=%d, Rejected=%d, "
                        + "DroppedEvents=%d, AvgExecTime=%.2fs",
                (long) runsCompletedCounter.count(),
                (long) runsFailedCounter.count(),
                (long) runsCancelledCounter.count(),
                (long) tradesExecutedCounter.count(),
                (long) ordersRejectedCounter.count(),
                (long) eventsDroppedCounter.count(),
                executionTimer.mean(TimeUnit.SECONDS));
    }
}
