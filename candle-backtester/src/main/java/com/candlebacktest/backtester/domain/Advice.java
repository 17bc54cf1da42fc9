package com.candlebacktest.backtester.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Trading intent emitted by a strategy for the current candle.
 * Consumed immediately by the portfolio simulator and never stored.
 */
@Getter
@EqualsAndHashCode
public final class Advice {

    public enum Action {
        NONE, BUY, SELL
    }

    private static final Advice NONE = new Advice(Action.NONE, null, null, 0.0);

    private final Action action;
    private final OrderSize size;
    private final String reason;
    private final double confidence;

    private Advice(Action action, OrderSize size, String reason, double confidence) {
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be within [0, 1], got " + confidence);
        }
        this.action = action;
        this.size = size;
        this.reason = reason;
        this.confidence = confidence;
    }

    public static Advice none() {
        return NONE;
    }

    public static Advice buyAll() {
        return new Advice(Action.BUY, OrderSize.all(), null, 1.0);
    }

    public static Advice buy(double units) {
        return new Advice(Action.BUY, OrderSize.units(units), null, 1.0);
    }

    public static Advice sellAll() {
        return new Advice(Action.SELL, OrderSize.all(), null, 1.0);
    }

    public static Advice sell(double units) {
        return new Advice(Action.SELL, OrderSize.units(units), null, 1.0);
    }

    public Advice withReason(String reason) {
        if (isNone()) {
            return this;
        }
        return new Advice(action, size, reason, confidence);
    }

    public Advice withConfidence(double confidence) {
        if (isNone()) {
            return this;
        }
        return new Advice(action, size, reason, confidence);
    }

    public boolean isNone() {
        return action == Action.NONE;
    }

    @Override
    public String toString() {
        if (isNone()) {
            return "Advice[none]";
        }
        return "Advice[" + action + " " + size + (reason != null ? ", " + reason : "") + "]";
    }
}
