package com.candlebacktest.backtester.domain.indicator;

import lombok.Value;

/**
 * Identifies one tracked indicator series inside an {@link IndicatorEngine}.
 * The multiplier is only meaningful for Bollinger Bands and is zero for every other type.
 */
@Value
public class IndicatorKey {

    IndicatorType type;
    int period;
    PriceType priceType;
    double multiplier;

    public IndicatorKey(IndicatorType type, int period, PriceType priceType) {
        this(type, period, priceType, BollingerBands.DEFAULT_MULTIPLIER);
    }

    public IndicatorKey(IndicatorType type, int period, PriceType priceType, double multiplier) {
        if (type == null) {
            throw new IllegalArgumentException("Indicator type is required");
        }
        this.type = type;
        this.period = Indicator.requirePositivePeriod(type.name(), period);
        this.priceType = priceType != null ? priceType : PriceType.CLOSE;
        this.multiplier = type == IndicatorType.BOLLINGER ? BollingerBands.requireMultiplier(multiplier) : 0;
    }

    public static IndicatorKey of(IndicatorType type, int period) {
        return new IndicatorKey(type, period, PriceType.CLOSE);
    }

    public static IndicatorKey sma(int period) {
        return of(IndicatorType.SMA, period);
    }

    public static IndicatorKey ema(int period) {
        return of(IndicatorType.EMA, period);
    }

    public static IndicatorKey dema(int period) {
        return of(IndicatorType.DEMA, period);
    }

    public static IndicatorKey rsi(int period) {
        return of(IndicatorType.RSI, period);
    }

    public static IndicatorKey atr(int period) {
        return of(IndicatorType.ATR, period);
    }

    public static IndicatorKey bollinger(int period, double multiplier) {
        return new IndicatorKey(IndicatorType.BOLLINGER, period, PriceType.CLOSE, multiplier);
    }

    /**
     * Create a fresh indicator for this key.
     */
    public Indicator createIndicator() {
        return type.create(period, type == IndicatorType.BOLLINGER ? multiplier : BollingerBands.DEFAULT_MULTIPLIER);
    }

    @Override
    public String toString() {
        StringBuilder text = new StringBuilder(type.name()).append('(').append(period);
        if (type == IndicatorType.BOLLINGER) {
            text.append(", ").append(multiplier);
        }
        if (priceType != PriceType.CLOSE && type != IndicatorType.ATR) {
            text.append(", ").append(priceType);
        }
        return text.append(')').toString();
    }
}
