package com.candlebacktest.backtester.domain;

import com.candlebacktest.backtester.domain.indicator.IndicatorEngine;
import com.candlebacktest.backtester.domain.indicator.IndicatorKey;
import com.candlebacktest.backtester.domain.strategy.Strategy;
import com.candlebacktest.backtester.domain.strategy.StrategyConfig;
import com.candlebacktest.backtester.domain.strategy.StrategyRuntime;
import com.candlebacktest.backtester.exception.BacktestException;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

/**
 * Core backtesting engine that replays a candle series through a strategy and a simulated portfolio.
 *
 * <p>Each candle goes through the same steps: indicator update, strategy evaluation,
 * order execution at the close, equity sample. The engine holds no state between runs.
 */
@Slf4j
public class BacktestEngine {

    public BacktestResult run(CandleSeries series, Strategy strategy, BacktestConfig config) {
        return run(series, strategy, BacktestContext.of(config));
    }

    /**
     * Run a backtest with an explicit per-run context.
     *
     * @throws IllegalArgumentException if the configuration is invalid
     * @throws BacktestException        on a fatal failure during the run
     */
    public BacktestResult run(CandleSeries series, Strategy strategy, BacktestContext context) {
        if (series == null) {
            throw new IllegalArgumentException("Candle series is required");
        }
        if (strategy == null) {
            throw new IllegalArgumentException("Strategy is required");
        }
        BacktestConfig config = context.getConfig();
        config.validate();

        log.info("Starting backtest {} - Strategy: {}, Candles: {}",
                context.getRunId(), strategy.getName(), series.size());

        IndicatorEngine indicators = new IndicatorEngine(series);
        for (IndicatorKey key : config.getIndicators()) {
            indicators.register(key);
        }

        DiagnosticsSink diagnostics = context.getDiagnostics();
        Portfolio portfolio = Portfolio.builder()
                .initialBalance(config.getInitialBalance())
                .commissionRate(config.getCommissionRate())
                .minLotSize(config.getMinLotSize())
                .slippageModel(context.slippageModel())
                .diagnostics(diagnostics)
                .build();

        StrategyRuntime runtime = new StrategyRuntime(strategy, config.isStrictMode(), diagnostics);
        runtime.initialize(StrategyConfig.builder()
                .currency(config.getCurrency())
                .asset(config.getAsset())
                .parameters(config.getStrategyParameters())
                .build());

        BacktestResult.BacktestResultBuilder result = BacktestResult.builder()
                .strategyName(strategy.getName());
        BacktestStatus status = BacktestStatus.COMPLETED;
        int processed = 0;

        try {
            for (int i = 0; i < series.size(); i++) {
                if (context.getCancellationToken().isCancelled()) {
                    log.info("Backtest {} cancelled after {} of {} candles", context.getRunId(), i, series.size());
                    status = BacktestStatus.CANCELLED;
                    break;
                }

                Candle candle = series.get(i);
                indicators.update(i);
                Advice advice = runtime.evaluate(i, candle, series.history(i), indicators.facade());

                Optional<Trade> trade = portfolio.applyAdvice(i, advice, candle);
                if (trade.isPresent()) {
                    result.trade(trade.get());
                    context.getListener().onTrade(trade.get());
                }

                result.equitySample(new EquitySample(candle.getTimestamp(), portfolio.equity(candle.getClose()),
                        candle.getClose(), portfolio.getCash(), portfolio.getAssetQuantity()));
                processed++;
            }
        } catch (BacktestException e) {
            log.error("Backtest {} failed: {}", context.getRunId(), e.getMessage(), e);
            throw e;
        }

        BacktestResult interim = result.build();
        PerformanceSummary summary = summarize(series, processed, portfolio, interim, config);

        BacktestResult finished = result
                .status(status)
                .candlesProcessed(processed)
                .diagnostics(diagnostics.getDiagnostics())
                .summary(summary)
                .build();

        log.info("Backtest {} {} - Trades: {}, Final equity: {}, ROI: {}%, Max DD: {}%, Sharpe: {}, Diagnostics: {}",
                context.getRunId(), status, summary.getTotalTrades(), summary.getFinalEquity(),
                summary.getRoi() * 100, summary.getMaxDrawdown() * 100, summary.getSharpeRatio(),
                diagnostics.size());

        context.getListener().onReport(finished);
        return finished;
    }

    private PerformanceSummary summarize(CandleSeries series, int processed, Portfolio portfolio,
                                         BacktestResult result, BacktestConfig config) {
        List<EquitySample> curve = result.getEquityCurve();
        List<Trade> trades = result.getTrades();
        double initialBalance = config.getInitialBalance();

        double lastPrice = processed > 0 ? series.get(processed - 1).getClose() : 0;
        double finalEquity = processed > 0 ? portfolio.equity(lastPrice) : portfolio.getCash();

        int sells = 0;
        int profitable = 0;
        for (Trade trade : trades) {
            if (trade.isSell()) {
                sells++;
                if (trade.getRealizedPnl() > 0) {
                    profitable++;
                }
            }
        }

        List<Double> returns = PerformanceMetrics.calculateReturns(curve);
        double annualization = config.getAnnualizationFactor();
        double roi = PerformanceMetrics.calculateRoi(initialBalance, finalEquity);
        double maxDrawdown = PerformanceMetrics.calculateMaxDrawdown(initialBalance, curve);

        return PerformanceSummary.builder()
                .initialBalance(initialBalance)
                .finalEquity(finalEquity)
                .totalReturn(finalEquity - initialBalance)
                .roi(roi)
                .maxDrawdown(maxDrawdown)
                .winRate(PerformanceMetrics.calculateWinRate(trades))
                .profitFactor(PerformanceMetrics.calculateProfitFactor(trades))
                .sharpeRatio(PerformanceMetrics.calculateSharpeRatio(returns, annualization))
                .sortinoRatio(PerformanceMetrics.calculateSortinoRatio(returns, annualization))
                .calmarRatio(PerformanceMetrics.calculateCalmarRatio(roi, maxDrawdown))
                .volatility(PerformanceMetrics.calculateVolatility(returns, annualization))
                .totalTrades(trades.size())
                .buyTrades(trades.size() - sells)
                .sellTrades(sells)
                .profitableTrades(profitable)
                .totalProfit(portfolio.getRealizedPnl())
                .unrealizedPnl(processed > 0 ? portfolio.unrealizedPnl(lastPrice) : 0)
                .totalCommission(portfolio.getTotalCommission())
                .totalSlippage(portfolio.getTotalSlippage())
                .startTimestamp(processed > 0 ? series.first().getTimestamp() : null)
                .endTimestamp(processed > 0 ? series.get(processed - 1).getTimestamp() : null)
                .build();
    }
}
