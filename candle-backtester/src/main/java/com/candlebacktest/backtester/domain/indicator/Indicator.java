package com.candlebacktest.backtester.domain.indicator;

import com.candlebacktest.backtester.domain.Candle;

import java.util.OptionalDouble;

/**
 * Streaming technical indicator.
 * Consumes one value per step and produces a reading once its warm-up period is complete.
 * An empty {@link OptionalDouble} means the indicator is not ready yet.
 */
public interface Indicator {

    /**
     * Feed the next value.
     *
     * @param value the next price, must be finite
     * @return the new reading, or empty while warming up
     * @throws IllegalArgumentException if the value is NaN or infinite
     */
    OptionalDouble update(double value);

    /**
     * Feed the next candle. Price-based indicators read the given price type;
     * range-based ones override this to use the whole candle.
     */
    default OptionalDouble update(Candle candle, PriceType priceType) {
        return update(candle.price(priceType));
    }

    /**
     * The latest reading, or empty while warming up.
     */
    OptionalDouble value();

    boolean isReady();

    int period();

    /**
     * Number of values fed so far.
     */
    int count();

    /**
     * Discard all accumulated state.
     */
    void reset();

    static int requirePositivePeriod(String name, int period) {
        if (period <= 0) {
            throw new IllegalArgumentException(name + " period must be greater than 0");
        }
        return period;
    }

    static double requireFinite(String name, double value) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException(name + " value must be a valid number, got " + value);
        }
        return value;
    }
}
