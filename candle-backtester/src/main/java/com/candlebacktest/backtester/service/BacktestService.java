package com.candlebacktest.backtester.service;

import com.candlebacktest.backtester.domain.BacktestConfig;
import com.candlebacktest.backtester.domain.BacktestResult;
import com.candlebacktest.backtester.domain.CancellationToken;
import com.candlebacktest.backtester.domain.CandleSeries;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Service interface for running backtests.
 */
public interface BacktestService {

    /**
     * Run a backtest on the calling thread.
     *
     * @param series   the validated candle series
     * @param strategy strategy name and parameters
     * @param config   run configuration, usually started from {@link #configDefaults()}
     * @return the completed result
     */
    BacktestResult run(CandleSeries series, StrategyDefinition strategy, BacktestConfig config);

    /**
     * Submit an independent run to the backtest thread pool.
     * The future completes exceptionally with the run's {@code BacktestException} on failure.
     */
    CompletableFuture<BacktestResult> runAsync(CandleSeries series, StrategyDefinition strategy,
                                               BacktestConfig config, CancellationToken cancellationToken);

    /**
     * Configuration builder pre-filled with the application's defaults.
     */
    BacktestConfig.BacktestConfigBuilder configDefaults();

    List<String> availableStrategies();
}
