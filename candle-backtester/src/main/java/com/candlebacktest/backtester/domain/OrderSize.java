package com.candlebacktest.backtester.domain;

import lombok.EqualsAndHashCode;

/**
 * Size of an order: either everything available or a fixed asset quantity.
 */
@EqualsAndHashCode
public final class OrderSize {

    private static final OrderSize ALL = new OrderSize(true, 0);

    private final boolean all;
    private final double units;

    private OrderSize(boolean all, double units) {
        this.all = all;
        this.units = units;
    }

    public static OrderSize all() {
        return ALL;
    }

    public static OrderSize units(double units) {
        if (!Double.isFinite(units) || units <= 0) {
            throw new IllegalArgumentException("Order size must be a positive number, got " + units);
        }
        return new OrderSize(false, units);
    }

    public boolean isAll() {
        return all;
    }

    /**
     * Asset quantity requested; only meaningful when {@link #isAll()} is false.
     */
    public double getUnits() {
        return units;
    }

    @Override
    public String toString() {
        return all ? "all" : String.valueOf(units);
    }
}
