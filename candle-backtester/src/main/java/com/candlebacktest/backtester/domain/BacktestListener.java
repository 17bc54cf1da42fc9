package com.candlebacktest.backtester.domain;

/**
 * Observer for events emitted by the engine during a run.
 * Callbacks run on the engine thread and should return quickly.
 */
public interface BacktestListener {

    BacktestListener NONE = new BacktestListener() {
    };

    default void onTrade(Trade trade) {
    }

    default void onReport(BacktestResult result) {
    }
}
