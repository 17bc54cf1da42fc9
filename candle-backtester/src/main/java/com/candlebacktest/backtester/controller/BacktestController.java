package com.candlebacktest.backtester.controller;

import com.candlebacktest.backtester.controller.dto.BacktestRequest;
import com.candlebacktest.backtester.controller.dto.BacktestResponse;
import com.candlebacktest.backtester.domain.BacktestConfig;
import com.candlebacktest.backtester.domain.BacktestResult;
import com.candlebacktest.backtester.domain.CandleSeries;
import com.candlebacktest.backtester.service.BacktestService;
import com.candlebacktest.backtester.service.CsvCandleImporter;
import com.candlebacktest.backtester.service.StrategyDefinition;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

/**
 * REST controller for running backtests.
 */
@RestController
@RequestMapping("/backtests")
@RequiredArgsConstructor
@Slf4j
public class BacktestController {

    private final BacktestService backtestService;
    private final CsvCandleImporter csvCandleImporter;

    /**
     * Run a backtest synchronously over the CSV candles in the request.
     *
     * @param request the backtest request
     * @return trades, equity curve, diagnostics and summary of the run
     */
    @PostMapping
    public ResponseEntity<BacktestResponse> runBacktest(@Valid @RequestBody BacktestRequest request) {
        log.info("POST /backtests - Strategy: {}", request.getStrategyName());

        CsvCandleImporter.ImportResult imported = csvCandleImporter.importString(request.getCsv());
        CandleSeries series = CandleSeries.of(imported.getCandles())
                .between(startOfDay(request.getStartDate()), endOfDay(request.getEndDate()));

        BacktestResult result = backtestService.run(series,
                new StrategyDefinition(request.getStrategyName(), request.getParameters()),
                toConfig(request));

        return ResponseEntity.ok(BacktestResponse.from(result));
    }

    /**
     * List the names accepted as {@code strategyName}.
     */
    @GetMapping("/strategies")
    public ResponseEntity<List<String>> listStrategies() {
        return ResponseEntity.ok(backtestService.availableStrategies());
    }

    private BacktestConfig toConfig(BacktestRequest request) {
        BacktestConfig.BacktestConfigBuilder config = backtestService.configDefaults();
        if (request.getInitialBalance() != null) {
            config.initialBalance(request.getInitialBalance());
        }
        if (request.getCommissionRate() != null) {
            config.commissionRate(request.getCommissionRate());
        }
        if (request.getSlippageRate() != null) {
            config.slippageRate(request.getSlippageRate());
        }
        if (request.getMinLotSize() != null) {
            config.minLotSize(request.getMinLotSize());
        }
        if (request.getStrictMode() != null) {
            config.strictMode(request.getStrictMode());
        }
        if (request.getSeed() != null) {
            config.seed(request.getSeed());
        }
        return config.build();
    }

    private static Long startOfDay(LocalDate date) {
        return date == null ? null : date.atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli();
    }

    private static Long endOfDay(LocalDate date) {
        return date == null ? null : date.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli() - 1;
    }
}
