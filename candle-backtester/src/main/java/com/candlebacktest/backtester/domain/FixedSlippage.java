package com.candlebacktest.backtester.domain;

/**
 * Constant slippage rate on every fill.
 */
public class FixedSlippage implements SlippageModel {

    private final double rate;

    public FixedSlippage(double rate) {
        if (!(rate >= 0 && rate < 1)) {
            throw new IllegalArgumentException("Slippage rate must be within [0, 1), got " + rate);
        }
        this.rate = rate;
    }

    @Override
    public double rate(Trade.Side side, Candle candle) {
        return rate;
    }

    @Override
    public String toString() {
        return "FixedSlippage(" + rate + ")";
    }
}
