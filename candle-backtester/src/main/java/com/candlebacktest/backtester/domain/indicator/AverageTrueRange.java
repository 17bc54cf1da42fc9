package com.candlebacktest.backtester.domain.indicator;

import com.candlebacktest.backtester.domain.Candle;

import java.util.OptionalDouble;

/**
 * Average True Range with Wilder smoothing.
 *
 * <p>True range is {@code max(high - low, |high - prevClose|, |low - prevClose|)}, so the first
 * candle only supplies a previous close. The first reading is the mean of the first {@code period}
 * true ranges ({@code period + 1} candles); afterwards {@code atr = (atrPrev * (period - 1) + tr) / period}.
 *
 * <p>Fed with bare values, each value is treated as a candle whose high, low and close are equal.
 */
public class AverageTrueRange implements Indicator {

    private final int period;
    private int count;
    private int ranges;
    private double previousClose;
    private double rangeSum;
    private OptionalDouble current = OptionalDouble.empty();

    public AverageTrueRange(int period) {
        this.period = Indicator.requirePositivePeriod("ATR", period);
    }

    @Override
    public OptionalDouble update(double value) {
        Indicator.requireFinite("ATR", value);
        return advance(value, value, value);
    }

    @Override
    public OptionalDouble update(Candle candle, PriceType priceType) {
        return advance(Indicator.requireFinite("ATR", candle.getHigh()),
                Indicator.requireFinite("ATR", candle.getLow()),
                Indicator.requireFinite("ATR", candle.getClose()));
    }

    private OptionalDouble advance(double high, double low, double close) {
        count++;
        if (count == 1) {
            previousClose = close;
            return current;
        }

        double trueRange = Math.max(high - low,
                Math.max(Math.abs(high - previousClose), Math.abs(low - previousClose)));
        previousClose = close;
        ranges++;

        if (ranges < period) {
            rangeSum += trueRange;
        } else if (ranges == period) {
            current = OptionalDouble.of((rangeSum + trueRange) / period);
        } else {
            current = OptionalDouble.of((current.getAsDouble() * (period - 1) + trueRange) / period);
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
        count = 0;
        ranges = 0;
        previousClose = 0;
        rangeSum = 0;
        current = OptionalDouble.empty();
    }

    @Override
    public String toString() {
        return "ATR(" + period + ")";
    }
}
