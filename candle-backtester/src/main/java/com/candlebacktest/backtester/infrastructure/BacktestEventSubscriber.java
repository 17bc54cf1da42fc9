package com.candlebacktest.backtester.infrastructure;

/**
 * Receives run events off the engine thread, from the {@link BacktestEventWorker}.
 */
public interface BacktestEventSubscriber {

    void onEvent(BacktestEvent event);
}
