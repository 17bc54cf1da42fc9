package com.candlebacktest.backtester.domain.indicator;

import java.util.OptionalDouble;

/**
 * Exponential Moving Average.
 * Seeded with the SMA of the first {@code period} values, then
 * {@code ema = (value - emaPrev) * alpha + emaPrev} with {@code alpha = 2 / (period + 1)}.
 */
public class ExponentialMovingAverage implements Indicator {

    private final int period;
    private final double alpha;
    private double seedSum;
    private int count;
    private OptionalDouble current = OptionalDouble.empty();

    public ExponentialMovingAverage(int period) {
        this.period = Indicator.requirePositivePeriod("EMA", period);
        this.alpha = 2.0 / (period + 1.0);
    }

    @Override
    public OptionalDouble update(double value) {
        Indicator.requireFinite("EMA", value);
        count++;

        if (current.isPresent()) {
            double previous = current.getAsDouble();
            current = OptionalDouble.of((value - previous) * alpha + previous);
            return current;
        }

        seedSum += value;
        if (count == period) {
            current = OptionalDouble.of(seedSum / period);
        }
        return current;
    }

    @Override
    public OptionalDouble value() {
        return current;
    }

    @Override
    public boolean isReady() {
        return current.isPresent();
    }

    @Override
    public int period() {
        return period;
    }

    @Override
    public int count() {
        return count;
    }

    public double alpha() {
        return alpha;
    }

    @Override
    public void reset() {
        seedSum = 0;
        count = 0;
        current = OptionalDouble.empty();
    }

    @Override
    public String toString() {
        return "EMA(" + period + ")";
    }
}
