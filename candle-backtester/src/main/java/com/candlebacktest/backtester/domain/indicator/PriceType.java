package com.candlebacktest.backtester.domain.indicator;

/**
 * Candle price an indicator is computed from.
 */
public enum PriceType {
    OPEN,
    HIGH,
    LOW,
    CLOSE
}
