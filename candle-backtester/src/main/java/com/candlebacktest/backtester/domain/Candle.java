package com.candlebacktest.backtester.domain;

import com.candlebacktest.backtester.domain.indicator.PriceType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * Represents a single OHLCV candle.
 * Timestamps are epoch milliseconds.
 */
@Value
@Builder
@AllArgsConstructor
public class Candle {

    long timestamp;
    double open;
    double high;
    double low;
    double close;
    double volume;

    /**
     * Get the price for the given price type.
     */
    public double price(PriceType priceType) {
        return switch (priceType) {
            case OPEN -> open;
            case HIGH -> high;
            case LOW -> low;
            case CLOSE -> close;
        };
    }

    /**
     * Whether this candle carries the same prices and volume as another one.
     */
    public boolean samePrices(Candle other) {
        return Double.compare(open, other.open) == 0
                && Double.compare(high, other.high) == 0
                && Double.compare(low, other.low) == 0
                && Double.compare(close, other.close) == 0
                && Double.compare(volume, other.volume) == 0;
    }
}
