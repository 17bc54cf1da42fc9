package com.candlebacktest.backtester.domain.strategy;

import com.candlebacktest.backtester.domain.Advice;
import com.candlebacktest.backtester.domain.Candle;
import com.candlebacktest.backtester.domain.Diagnostic;
import com.candlebacktest.backtester.domain.DiagnosticsSink;
import com.candlebacktest.backtester.domain.indicator.IndicatorFacade;
import com.candlebacktest.backtester.exception.BacktestException;
import com.candlebacktest.backtester.exception.BacktestException.ErrorCode;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Drives a user strategy through the fixed per-candle protocol.
 *
 * <p>{@link #initialize} must be called once before the first {@link #evaluate}; evaluations
 * must arrive in candle order. Evaluation failures are recorded as diagnostics and treated
 * as no advice, unless strict mode is on.
 */
@Slf4j
public class StrategyRuntime {

    private final Strategy strategy;
    private final boolean strictMode;
    private final DiagnosticsSink diagnostics;

    private boolean initialized;
    private int lastIndex = -1;
    private int evaluationErrors;

    public StrategyRuntime(Strategy strategy, boolean strictMode, DiagnosticsSink diagnostics) {
        if (strategy == null) {
            throw new IllegalArgumentException("Strategy is required");
        }
        this.strategy = strategy;
        this.strictMode = strictMode;
        this.diagnostics = diagnostics != null ? diagnostics : new DiagnosticsSink();
    }

    /**
     * Initialize the strategy.
     *
     * @throws BacktestException with {@link ErrorCode#STRATEGY_INIT_ERROR} if the strategy throws
     */
    public void initialize(StrategyConfig config) {
        if (initialized) {
            throw new IllegalStateException("Strategy " + strategy.getName() + " is already initialized");
        }
        try {
            strategy.init(config);
        } catch (RuntimeException e) {
            log.error("Strategy {} failed to initialize: {}", strategy.getName(), e.getMessage(), e);
            throw new BacktestException(ErrorCode.STRATEGY_INIT_ERROR,
                    "Strategy " + strategy.getName() + " failed to initialize: " + e.getMessage(), e);
        }
        initialized = true;
        log.info("Initialized strategy {}", strategy.getName());
    }

    /**
     * Ask the strategy for advice on the candle at {@code index}.
     *
     * @return the advice, never {@code null}
     * @throws BacktestException with {@link ErrorCode#STRATEGY_EVALUATION_ERROR} in strict mode
     */
    public Advice evaluate(int index, Candle candle, List<Candle> history, IndicatorFacade indicators) {
        if (!initialized) {
            throw new IllegalStateException("Strategy " + strategy.getName() + " has not been initialized");
        }
        if (index <= lastIndex) {
            throw new IllegalStateException("Candle " + index + " evaluated out of order, last was " + lastIndex);
        }
        lastIndex = index;

        try {
            Advice advice = strategy.onCandle(candle, history, indicators);
            return advice != null ? advice : Advice.none();
        } catch (BacktestException e) {
            // raised by the engine itself (e.g. invalid input), never downgraded
            throw e;
        } catch (RuntimeException e) {
            if (strictMode) {
                throw new BacktestException(ErrorCode.STRATEGY_EVALUATION_ERROR,
                        "Strategy " + strategy.getName() + " failed: " + e.getMessage(),
                        index, candle.getTimestamp(), e);
            }
            evaluationErrors++;
            diagnostics.record(Diagnostic.Type.STRATEGY_EVALUATION_ERROR, index, candle.getTimestamp(),
                    e.getClass().getSimpleName() + ": " + e.getMessage());
            return Advice.none();
        }
    }

    public Strategy getStrategy() {
        return strategy;
    }

    public int getEvaluationErrors() {
        return evaluationErrors;
    }
}
