package com.candlebacktest.backtester.domain.indicator;

import lombok.Value;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Bollinger Bands: SMA middle band with upper and lower bands at {@code multiplier}
 * population standard deviations of the last {@code period} values.
 *
 * <p>The scalar reading is the middle band; {@link #bands()} carries all three.
 */
public class BollingerBands implements Indicator {

    public static final double DEFAULT_MULTIPLIER = 2.0;

    /**
     * One reading of the three bands.
     */
    @Value
    public static class Bands {
        double middle;
        double upper;
        double lower;

        /**
         * Band width relative to the middle band, as a percentage.
         */
        public OptionalDouble bandwidth() {
            if (middle == 0) {
                return OptionalDouble.empty();
            }
            return OptionalDouble.of((upper - lower) / middle * 100);
        }

        /**
         * Position of a price inside the bands: 0 at the lower band, 100 at the upper band.
         * Empty when the bands have collapsed onto each other.
         */
        public OptionalDouble percentB(double price) {
            if (upper == lower) {
                return OptionalDouble.empty();
            }
            return OptionalDouble.of((price - lower) / (upper - lower) * 100);
        }
    }

    private final int period;
    private final double multiplier;
    private final Deque<Double> window = new ArrayDeque<>();
    private int count;
    private Optional<Bands> bands = Optional.empty();

    public BollingerBands(int period) {
        this(period, DEFAULT_MULTIPLIER);
    }

    public BollingerBands(int period, double multiplier) {
        this.period = Indicator.requirePositivePeriod("Bollinger", period);
        this.multiplier = requireMultiplier(multiplier);
    }

    static double requireMultiplier(double multiplier) {
        if (!Double.isFinite(multiplier) || multiplier <= 0) {
            throw new IllegalArgumentException("Bollinger multiplier must be greater than 0, got " + multiplier);
        }
        return multiplier;
    }

    @Override
    public OptionalDouble update(double value) {
        Indicator.requireFinite("Bollinger", value);
        count++;

        window.addLast(value);
        if (window.size() > period) {
            window.removeFirst();
        }

        if (window.size() == period) {
            double sum = 0;
            for (double v : window) {
                sum += v;
            }
            double mean = sum / period;
            double squares = 0;
            for (double v : window) {
                squares += (v - mean) * (v - mean);
            }
            double deviation = Math.sqrt(squares / period);
            bands = Optional.of(new Bands(mean, mean + multiplier * deviation, mean - multiplier * deviation));
        }
        return value();
    }

    public Optional<Bands> bands() {
        return bands;
    }

    public double multiplier() {
        return multiplier;
    }

    @Override
    public OptionalDouble value() {
        return bands.map(b -> OptionalDouble.of(b.getMiddle())).orElse(OptionalDouble.empty());
    }

    @Override
    public boolean isReady() {
        return bands.isPresent();
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
        count = 0;
        bands = Optional.empty();
    }

    @Override
    public String toString() {
        return "BOLLINGER(" + period + ", " + multiplier + ")";
    }
}
