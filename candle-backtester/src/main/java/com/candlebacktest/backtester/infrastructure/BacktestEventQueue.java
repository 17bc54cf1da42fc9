package com.candlebacktest.backtester.infrastructure;

import com.candlebacktest.backtester.domain.BacktestListener;
import com.candlebacktest.backtester.domain.BacktestResult;
import com.candlebacktest.backtester.domain.Trade;
import com.candlebacktest.backtester.service.BacktestMetricsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded in-memory queue between running backtests and event subscribers.
 * Publishing never blocks: when the queue is full the event is dropped and counted.
 */
@Component
@Slf4j
public class BacktestEventQueue {

    private final BlockingQueue<BacktestEvent> queue;
    private final BacktestMetricsService metricsService;
    private final AtomicLong dropped = new AtomicLong();

    public BacktestEventQueue(@Value("${backtest.events.queue-capacity:1000}") int capacity,
                              BacktestMetricsService metricsService) {
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.metricsService = metricsService;
    }

    /**
     * Listener that publishes the events of one run to this queue.
     */
    public BacktestListener listenerFor(String runId) {
        return new BacktestListener() {
            @Override
            public void onTrade(Trade trade) {
                publish(BacktestEvent.trade(runId, trade));
            }

            @Override
            public void onReport(BacktestResult result) {
                publish(BacktestEvent.report(runId, result));
            }
        };
    }

    /**
     * @return false if the queue was full and the event was dropped
     */
    public boolean publish(BacktestEvent event) {
        if (queue.offer(event)) {
            return true;
        }
        long total = dropped.incrementAndGet();
        metricsService.recordEventDropped();
        log.warn("Event queue full, dropped {} event of run {} ({} dropped so far)",
                event.getType(), event.getRunId(), total);
        return false;
    }

    /**
     * Next event, waiting up to the given timeout; {@code null} if none arrived.
     */
    public BacktestEvent poll(long timeout, TimeUnit unit) throws InterruptedException {
        return queue.poll(timeout, unit);
    }

    public int size() {
        return queue.size();
    }

    public long getDroppedCount() {
        return dropped.get();
    }
}
