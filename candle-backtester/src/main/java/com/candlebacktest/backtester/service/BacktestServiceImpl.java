package com.candlebacktest.backtester.service;

import com.candlebacktest.backtester.domain.BacktestConfig;
import com.candlebacktest.backtester.domain.BacktestContext;
import com.candlebacktest.backtester.domain.BacktestEngine;
import com.candlebacktest.backtester.domain.BacktestResult;
import com.candlebacktest.backtester.domain.CancellationToken;
import com.candlebacktest.backtester.domain.CandleSeries;
import com.candlebacktest.backtester.domain.Diagnostic;
import com.candlebacktest.backtester.domain.strategy.Strategy;
import com.candlebacktest.backtester.infrastructure.BacktestEventQueue;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Implementation of BacktestService: resolves the strategy, runs the engine and records
 * metrics, with the run id in the logging context.
 */
@Service
@Slf4j
public class BacktestServiceImpl implements BacktestService {

    private final StrategyFactory strategyFactory;
    private final BacktestEventQueue eventQueue;
    private final BacktestMetricsService metricsService;
    private final ExecutorService backtestExecutorService;
    private final BacktestEngine engine = new BacktestEngine();

    @Value("${backtest.defaults.initial-balance:10000}")
    private double initialBalance = 10_000;

    @Value("${backtest.defaults.commission-rate:0.001}")
    private double commissionRate = 0.001;

    @Value("${backtest.defaults.slippage-rate:0}")
    private double slippageRate;

    @Value("${backtest.defaults.strict-mode:false}")
    private boolean strictMode;

    @Value("${backtest.defaults.annualization-factor:252}")
    private double annualizationFactor = 252;

    public BacktestServiceImpl(StrategyFactory strategyFactory,
                               BacktestEventQueue eventQueue,
                               BacktestMetricsService metricsService,
                               @Qualifier("backtestExecutorService") ExecutorService backtestExecutorService) {
        this.strategyFactory = strategyFactory;
        this.eventQueue = eventQueue;
        this.metricsService = metricsService;
        this.backtestExecutorService = backtestExecutorService;
    }

    @Override
    public BacktestResult run(CandleSeries series, StrategyDefinition strategy, BacktestConfig config) {
        return execute(newRunId(), series, strategy, config, new CancellationToken());
    }

    @Override
    public CompletableFuture<BacktestResult> runAsync(CandleSeries series, StrategyDefinition strategy,
                                                      BacktestConfig config, CancellationToken cancellationToken) {
        String runId = newRunId();
        log.info("Submitting backtest {} for strategy {}", runId, strategy.getName());
        CancellationToken token = cancellationToken != null ? cancellationToken : new CancellationToken();
        return CompletableFuture.supplyAsync(
                () -> execute(runId, series, strategy, config, token), backtestExecutorService);
    }

    @Override
    public BacktestConfig.BacktestConfigBuilder configDefaults() {
        return BacktestConfig.builder()
                .initialBalance(initialBalance)
                .commissionRate(commissionRate)
                .slippageRate(slippageRate)
                .strictMode(strictMode)
                .annualizationFactor(annualizationFactor);
    }

    @Override
    public List<String> availableStrategies() {
        return strategyFactory.availableStrategies();
    }

    private BacktestResult execute(String runId, CandleSeries series, StrategyDefinition definition,
                                   BacktestConfig config, CancellationToken token) {
        // Set MDC for structured logging
        MDC.put("runId", runId);
        long startTime = System.currentTimeMillis();
        try {
            Strategy strategy = strategyFactory.createStrategy(definition);
            Map<String, Object> parameters = definition.getParameters() != null
                    ? definition.getParameters()
                    : Collections.emptyMap();
            BacktestConfig effective = config.toBuilder()
                    .clearStrategyParameters()
                    .strategyParameters(parameters)
                    .build();

            BacktestContext context = BacktestContext.builder()
                    .runId(runId)
                    .config(effective)
                    .cancellationToken(token)
                    .listener(eventQueue.listenerFor(runId))
                    .build();

            BacktestResult result = engine.run(series, strategy, context);
            long executionTime = System.currentTimeMillis() - startTime;

            if (result.isCancelled()) {
                metricsService.recordRunCancelled();
            } else {
                metricsService.recordRunCompleted(executionTime, result.getTrades().size(), rejectedOrders(result));
            }
            log.info("Backtest {} finished in {}ms", runId, executionTime);
            return result;
        } catch (RuntimeException e) {
            metricsService.recordRunFailed();
            log.error("Backtest {} failed after {}ms: {}", runId,
                    System.currentTimeMillis() - startTime, e.getMessage());
            throw e;
        } finally {
            MDC.remove("runId");
        }
    }

    private static int rejectedOrders(BacktestResult result) {
        int rejected = 0;
        for (Diagnostic diagnostic : result.getDiagnostics()) {
            if (diagnostic.getType() != Diagnostic.Type.STRATEGY_EVALUATION_ERROR) {
                rejected++;
            }
        }
        return rejected;
    }

    private static String newRunId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
