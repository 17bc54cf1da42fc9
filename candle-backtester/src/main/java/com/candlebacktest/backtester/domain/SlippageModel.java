package com.candlebacktest.backtester.domain;

/**
 * Decides the slippage rate applied to a fill.
 * The rate always moves the fill price against the trader.
 */
public interface SlippageModel {

    /**
     * Slippage rate in {@code [0, 1)} for a fill on the given side.
     */
    double rate(Trade.Side side, Candle candle);

    static SlippageModel none() {
        return new FixedSlippage(0.0);
    }
}
