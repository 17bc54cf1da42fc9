package com.candlebacktest.backtester.domain.indicator;

import java.util.OptionalDouble;

/**
 * Double Exponential Moving Average: {@code 2 * EMA(value) - EMA(EMA(value))}.
 * Both averages use the same period and SMA seeding, so the first reading
 * arrives after {@code 2 * period - 1} values.
 */
public class DoubleExponentialMovingAverage implements Indicator {

    private final int period;
    private final ExponentialMovingAverage ema;
    private final ExponentialMovingAverage emaOfEma;
    private int count;
    private OptionalDouble current = OptionalDouble.empty();

    public DoubleExponentialMovingAverage(int period) {
        this.period = Indicator.requirePositivePeriod("DEMA", period);
        this.ema = new ExponentialMovingAverage(period);
        this.emaOfEma = new ExponentialMovingAverage(period);
    }

    @Override
    public OptionalDouble update(double value) {
        Indicator.requireFinite("DEMA", value);
        count++;

        OptionalDouble first = ema.update(value);
        if (first.isEmpty()) {
            return current;
        }
        OptionalDouble second = emaOfEma.update(first.getAsDouble());
        if (second.isPresent()) {
            current = OptionalDouble.of(2 * first.getAsDouble() - second.getAsDouble());
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

    @Override
    public void reset() {
        ema.reset();
        emaOfEma.reset();
        count = 0;
        current = OptionalDouble.empty();
    }

    @Override
    public String toString() {
        return "DEMA(" + period + ")";
    }
}
