package com.candlebacktest.backtester.domain;

import com.candlebacktest.backtester.domain.indicator.IndicatorKey;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Configuration for a backtest run.
 */
@Value
@Builder(toBuilder = true)
public class BacktestConfig {

    @Builder.Default
    double initialBalance = 10_000;

    /**
     * Fraction of the notional charged on every fill, e.g. 0.001 for 0.1%.
     */
    @Builder.Default
    double commissionRate = 0.001;

    /**
     * Adverse price adjustment per fill, or the upper bound when {@link #randomSlippage} is set.
     */
    @Builder.Default
    double slippageRate = 0;

    @Builder.Default
    boolean randomSlippage = false;

    @Builder.Default
    long seed = 42L;

    @Builder.Default
    double minLotSize = 0;

    /**
     * Abort the run when the strategy throws during evaluation.
     */
    @Builder.Default
    boolean strictMode = false;

    @Builder.Default
    double annualizationFactor = 252;

    @Builder.Default
    String currency = "USD";

    @Builder.Default
    String asset = "BTC";

    @Singular
    List<IndicatorKey> indicators;

    @Singular
    Map<String, Object> strategyParameters;

    public static BacktestConfig defaults() {
        return BacktestConfig.builder().build();
    }

    /**
     * @throws IllegalArgumentException if any setting is out of range
     */
    public void validate() {
        if (!(initialBalance > 0) || Double.isInfinite(initialBalance)) {
            throw new IllegalArgumentException("Initial balance must be positive, got " + initialBalance);
        }
        if (!(commissionRate >= 0 && commissionRate < 1)) {
            throw new IllegalArgumentException("Commission rate must be within [0, 1), got " + commissionRate);
        }
        if (!(slippageRate >= 0 && slippageRate < 1)) {
            throw new IllegalArgumentException("Slippage rate must be within [0, 1), got " + slippageRate);
        }
        if (!(minLotSize >= 0)) {
            throw new IllegalArgumentException("Minimum lot size must not be negative, got " + minLotSize);
        }
        if (!(annualizationFactor > 0)) {
            throw new IllegalArgumentException("Annualization factor must be positive, got " + annualizationFactor);
        }
    }
}
