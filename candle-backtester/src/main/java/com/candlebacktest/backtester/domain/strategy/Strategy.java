package com.candlebacktest.backtester.domain.strategy;

import com.candlebacktest.backtester.domain.Advice;
import com.candlebacktest.backtester.domain.Candle;
import com.candlebacktest.backtester.domain.indicator.IndicatorFacade;

import java.util.List;

/**
 * Strategy interface for implementing trading strategies.
 * Strategies receive candles in chronological order and answer with trading advice.
 */
public interface Strategy {

    /**
     * Called exactly once before the first candle.
     *
     * @param config run-level settings and strategy parameters
     */
    default void init(StrategyConfig config) {
    }

    /**
     * Called for each candle in chronological order.
     *
     * @param candle     the current candle
     * @param history    candles up to and including the current one
     * @param indicators read-only indicator view computed up to the current candle
     * @return the advice for this candle; {@code null} is treated as no advice
     */
    Advice onCandle(Candle candle, List<Candle> history, IndicatorFacade indicators);

    /**
     * Get the strategy name.
     */
    String getName();
}
