package com.candlebacktest.backtester.domain;

/**
 * Terminal state of a backtest run.
 */
public enum BacktestStatus {
    COMPLETED,
    CANCELLED
}
