package com.candlebacktest.backtester.domain;

import lombok.Builder;
import lombok.Getter;

import java.util.Random;

/**
 * Per-run context threaded through the engine: configuration, seeded random source,
 * diagnostics, cancellation and event listener. Nothing here is shared between runs.
 */
@Getter
public class BacktestContext {

    private final String runId;
    private final BacktestConfig config;
    private final Random random;
    private final DiagnosticsSink diagnostics;
    private final CancellationToken cancellationToken;
    private final BacktestListener listener;

    @Builder
    public BacktestContext(String runId, BacktestConfig config, DiagnosticsSink diagnostics,
                           CancellationToken cancellationToken, BacktestListener listener) {
        this.runId = runId != null ? runId : "local";
        this.config = config != null ? config : BacktestConfig.defaults();
        this.random = new Random(this.config.getSeed());
        this.diagnostics = diagnostics != null ? diagnostics : new DiagnosticsSink();
        this.cancellationToken = cancellationToken != null ? cancellationToken : new CancellationToken();
        this.listener = listener != null ? listener : BacktestListener.NONE;
    }

    public static BacktestContext of(BacktestConfig config) {
        return BacktestContext.builder().config(config).build();
    }

    /**
     * Slippage model for this run, seeded from the config when randomized.
     */
    public SlippageModel slippageModel() {
        if (config.isRandomSlippage()) {
            return new RandomSlippage(config.getSlippageRate(), random);
        }
        return new FixedSlippage(config.getSlippageRate());
    }
}
