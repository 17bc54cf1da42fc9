package com.candlebacktest.backtester.domain;

import lombok.Value;

/**
 * Non-fatal event recorded during a run, kept on the result for auditing.
 */
@Value
public class Diagnostic {

    public enum Type {
        STRATEGY_EVALUATION_ERROR,
        INSUFFICIENT_FUNDS,
        INSUFFICIENT_POSITION,
        ORDER_BELOW_MIN_LOT,
        INVALID_PRICE
    }

    Type type;
    int candleIndex;
    long timestamp;
    String message;
}
