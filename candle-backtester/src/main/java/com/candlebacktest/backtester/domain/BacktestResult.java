package com.candlebacktest.backtester.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Result of a backtest run: ledger, equity curve, diagnostics and summary metrics.
 */
@Value
@Builder
public class BacktestResult {

    BacktestStatus status;
    String strategyName;
    int candlesProcessed;

    @Singular
    List<Trade> trades;

    @Singular("equitySample")
    List<EquitySample> equityCurve;

    @Singular
    List<Diagnostic> diagnostics;

    PerformanceSummary summary;

    public boolean isCancelled() {
        return status == BacktestStatus.CANCELLED;
    }
}
