package com.candlebacktest.backtester.domain.indicator;

/**
 * Supported streaming indicator kinds.
 */
public enum IndicatorType {
    SMA,
    EMA,
    DEMA,
    RSI,
    ATR,
    BOLLINGER;

    /**
     * Whether this kind can be used in moving average crossovers and price/MA comparisons.
     */
    public boolean isMovingAverage() {
        return this == SMA || this == EMA || this == DEMA;
    }

    /**
     * Create a fresh indicator of this kind with its default band width.
     */
    public Indicator create(int period) {
        return create(period, BollingerBands.DEFAULT_MULTIPLIER);
    }

    /**
     * Create a fresh indicator of this kind. The multiplier only applies to Bollinger Bands.
     */
    public Indicator create(int period, double multiplier) {
        return switch (this) {
            case SMA -> new SimpleMovingAverage(period);
            case EMA -> new ExponentialMovingAverage(period);
            case DEMA -> new DoubleExponentialMovingAverage(period);
            case RSI -> new RelativeStrengthIndex(period);
            case ATR -> new AverageTrueRange(period);
            case BOLLINGER -> new BollingerBands(period, multiplier);
        };
    }
}
