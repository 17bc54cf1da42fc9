package com.candlebacktest.backtester.domain.indicator;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.OptionalDouble;

/**
 * Simple Moving Average.
 * Arithmetic mean of the last {@code period} values.
 */
public class SimpleMovingAverage implements Indicator {

    private final int period;
    private final Deque<Double> window;
    private OptionalDouble current = OptionalDouble.empty();
    private int count;

    public SimpleMovingAverage(int period) {
        this.period = Indicator.requirePositivePeriod("SMA", period);
        this.window = new ArrayDeque<>();
    }

    @Override
    public OptionalDouble update(double value) {
        Indicator.requireFinite("SMA", value);
        count++;

        window.addLast(value);
        if (window.size() > period) {
            window.removeFirst();
        }

        if (window.size() == period) {
            // Summed oldest to newest every step so the rounding order never changes
            double sum = 0;
            for (double v : window) {
                sum += v;
            }
            current = OptionalDouble.of(sum / period);
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
        window.clear();
        current = OptionalDouble.empty();
        count = 0;
    }

    @Override
    public String toString() {
        return "SMA(" + period + ")";
    }
}
