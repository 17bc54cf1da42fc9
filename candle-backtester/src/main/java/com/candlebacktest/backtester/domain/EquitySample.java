package com.candlebacktest.backtester.domain;

import lombok.Value;

/**
 * Mark-to-market portfolio value after one candle.
 */
@Value
public class EquitySample {

    long timestamp;
    double equity;
    double price;
    double cash;
    double position;
}
