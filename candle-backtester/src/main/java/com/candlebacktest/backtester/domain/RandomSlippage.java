package com.candlebacktest.backtester.domain;

import java.util.Random;

/**
 * Slippage rate drawn uniformly from {@code [0, maxRate]} for every fill.
 * The random source is seeded per run so results stay reproducible.
 */
public class RandomSlippage implements SlippageModel {

    private final double maxRate;
    private final Random random;

    public RandomSlippage(double maxRate, Random random) {
        if (!(maxRate >= 0 && maxRate < 1)) {
            throw new IllegalArgumentException("Slippage rate must be within [0, 1), got " + maxRate);
        }
        if (random == null) {
            throw new IllegalArgumentException("A seeded random source is required");
        }
        this.maxRate = maxRate;
        this.random = random;
    }

    @Override
    public double rate(Trade.Side side, Candle candle) {
        return random.nextDouble() * maxRate;
    }

    @Override
    public String toString() {
        return "RandomSlippage(" + maxRate + ")";
    }
}
