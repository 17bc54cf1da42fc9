package com.candlebacktest.backtester.controller.dto;

import com.candlebacktest.backtester.domain.BacktestResult;
import com.candlebacktest.backtester.domain.BacktestStatus;
import com.candlebacktest.backtester.domain.Diagnostic;
import com.candlebacktest.backtester.domain.EquitySample;
import com.candlebacktest.backtester.domain.PerformanceSummary;
import com.candlebacktest.backtester.domain.Trade;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Response DTO with the full ledger, equity curve, diagnostics and summary of a run.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BacktestResponse {

    private BacktestStatus status;
    private String strategyName;
    private int candlesProcessed;
    private List<Trade> trades;
    private List<EquitySample> equity;
    private List<Diagnostic> diagnostics;
    private Summary summary;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class Summary {
        private int totalTrades;
        private int profitableTrades;
        private double totalProfit;
        private double maxDrawdown;
        private double roi;
        private double winRate;

        /**
         * Serialized as the string "Infinity" when there are no losing trades.
         */
        private String profitFactor;

        private double sharpeRatio;
        private double sortinoRatio;
        private double calmarRatio;
        private double volatility;
        private double initialBalance;
        private double finalBalance;
        private double totalReturn;
        private double totalCommission;
        private Instant startDate;
        private Instant endDate;
    }

    public static BacktestResponse from(BacktestResult result) {
        PerformanceSummary s = result.getSummary();
        Summary summary = Summary.builder()
                .totalTrades(s.getTotalTrades())
                .profitableTrades(s.getProfitableTrades())
                .totalProfit(s.getTotalProfit())
                .maxDrawdown(s.getMaxDrawdown())
                .roi(s.getRoi())
                .winRate(s.getWinRate())
                .profitFactor(Double.isInfinite(s.getProfitFactor())
                        ? "Infinity"
                        : String.valueOf(s.getProfitFactor()))
                .sharpeRatio(s.getSharpeRatio())
                .sortinoRatio(s.getSortinoRatio())
                .calmarRatio(s.getCalmarRatio())
                .volatility(s.getVolatility())
                .initialBalance(s.getInitialBalance())
                .finalBalance(s.getFinalEquity())
                .totalReturn(s.getTotalReturn())
                .totalCommission(s.getTotalCommission())
                .startDate(s.getStartTimestamp() != null ? Instant.ofEpochMilli(s.getStartTimestamp()) : null)
                .endDate(s.getEndTimestamp() != null ? Instant.ofEpochMilli(s.getEndTimestamp()) : null)
                .build();

        return BacktestResponse.builder()
                .status(result.getStatus())
                .strategyName(result.getStrategyName())
                .candlesProcessed(result.getCandlesProcessed())
                .trades(result.getTrades())
                .equity(result.getEquityCurve())
                .diagnostics(result.getDiagnostics())
                .summary(summary)
                .build();
    }
}
