package com.candlebacktest.backtester.domain.indicator;

import java.util.OptionalDouble;

/**
 * Relative Strength Index with Wilder smoothing.
 *
 * <p>The first reading needs {@code period} price changes, i.e. {@code period + 1} values.
 * The seed averages are the simple means of the first {@code period} gains and losses;
 * afterwards {@code avg = (avgPrev * (period - 1) + current) / period}.
 * {@code RSI = 100 - 100 / (1 + avgGain / avgLoss)}, and 100 when there are no losses.
 */
public class RelativeStrengthIndex implements Indicator {

    private final int period;
    private int count;
    private double previousValue;
    private int changes;
    private double gainSum;
    private double lossSum;
    private double avgGain;
    private double avgLoss;
    private OptionalDouble current = OptionalDouble.empty();

    public RelativeStrengthIndex(int period) {
        this.period = Indicator.requirePositivePeriod("RSI", period);
    }

    @Override
    public OptionalDouble update(double value) {
        Indicator.requireFinite("RSI", value);
        count++;

        if (count == 1) {
            previousValue = value;
            return current;
        }

        double change = value - previousValue;
        previousValue = value;
        double gain = change > 0 ? change : 0;
        double loss = change < 0 ? -change : 0;
        changes++;

        if (changes < period) {
            gainSum += gain;
            lossSum += loss;
            return current;
        }

        if (changes == period) {
            avgGain = (gainSum + gain) / period;
            avgLoss = (lossSum + loss) / period;
        } else {
            avgGain = (avgGain * (period - 1) + gain) / period;
            avgLoss = (avgLoss * (period - 1) + loss) / period;
        }

        current = OptionalDouble.of(compute(avgGain, avgLoss));
        return current;
    }

    private static double compute(double avgGain, double avgLoss) {
        if (avgLoss == 0) {
            return 100.0;
        }
        double rsi = 100.0 - 100.0 / (1.0 + avgGain / avgLoss);
        return Math.max(0.0, Math.min(100.0, rsi));
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
        count = 0;
        previousValue = 0;
        changes = 0;
        gainSum = 0;
        lossSum = 0;
        avgGain = 0;
        avgLoss = 0;
        current = OptionalDouble.empty();
    }

    @Override
    public String toString() {
        return "RSI(" + period + ")";
    }
}
