package com.candlebacktest.backtester.domain.indicator;

import com.candlebacktest.backtester.domain.Candle;

import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Read-only indicator view handed to strategies.
 * Every value is computed from candles up to and including the current one.
 */
public interface IndicatorFacade {

    Candle currentCandle();

    /**
     * Candles seen so far, current candle last.
     */
    List<Candle> history();

    /**
     * The last {@code count} candles seen so far.
     */
    List<Candle> history(int count);

    List<Double> closes(int count);

    List<Double> volumes(int count);

    OptionalDouble sma(int period);

    OptionalDouble sma(int period, PriceType priceType);

    OptionalDouble ema(int period);

    OptionalDouble ema(int period, PriceType priceType);

    OptionalDouble dema(int period);

    OptionalDouble rsi(int period);

    /**
     * Average true range over the high, low and close of each candle.
     */
    OptionalDouble atr(int period);

    Optional<BollingerBands.Bands> bollingerBands(int period, double multiplier);

    default Optional<BollingerBands.Bands> bollingerBands(int period) {
        return bollingerBands(period, BollingerBands.DEFAULT_MULTIPLIER);
    }

    /**
     * Reading of an arbitrary indicator series.
     */
    OptionalDouble indicator(IndicatorKey key);

    /**
     * Reading of an indicator series as of the previous candle.
     */
    OptionalDouble previous(IndicatorKey key);

    boolean isBullishCrossover(IndicatorType type, int fastPeriod, int slowPeriod);

    boolean isBearishCrossover(IndicatorType type, int fastPeriod, int slowPeriod);

    boolean isPriceAboveMa(IndicatorType type, int period);

    boolean isPriceBelowMa(IndicatorType type, int period);

    boolean isOversold(int period, double threshold);

    boolean isOverbought(int period, double threshold);

    /**
     * Percentage change of the close against the previous candle, empty on the first candle.
     */
    OptionalDouble percentageChange();

    /**
     * Close change against the candle {@code periods} back, empty without enough history.
     */
    OptionalDouble priceChange(int periods);
}
