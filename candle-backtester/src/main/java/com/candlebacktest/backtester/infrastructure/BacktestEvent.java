package com.candlebacktest.backtester.infrastructure;

import com.candlebacktest.backtester.domain.BacktestResult;
import com.candlebacktest.backtester.domain.Trade;
import lombok.Value;

/**
 * Event published by a run: either a trade or the final report.
 */
@Value
public class BacktestEvent {

    public enum Type {
        TRADE, REPORT
    }

    Type type;
    String runId;
    Trade trade;
    BacktestResult result;

    public static BacktestEvent trade(String runId, Trade trade) {
        return new BacktestEvent(Type.TRADE, runId, trade, null);
    }

    public static BacktestEvent report(String runId, BacktestResult result) {
        return new BacktestEvent(Type.REPORT, runId, null, result);
    }
}
