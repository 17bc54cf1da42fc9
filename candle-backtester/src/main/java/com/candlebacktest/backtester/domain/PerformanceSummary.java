package com.candlebacktest.backtester.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Summary statistics computed once at the end of a run.
 * Ratios are fractions (0.2 means 20%).
 */
@Value
@Builder
public class PerformanceSummary {

    double initialBalance;
    double finalEquity;
    double totalReturn;
    double roi;
    double maxDrawdown;
    double winRate;

    /**
     * Gross profit over gross loss; positive infinity when there are profits and no losses.
     */
    double profitFactor;

    double sharpeRatio;
    double sortinoRatio;
    double calmarRatio;
    double volatility;
    int totalTrades;
    int buyTrades;
    int sellTrades;
    int profitableTrades;
    double totalProfit;
    double unrealizedPnl;
    double totalCommission;
    double totalSlippage;
    Long startTimestamp;
    Long endTimestamp;
}
