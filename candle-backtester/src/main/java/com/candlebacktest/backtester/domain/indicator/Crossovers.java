package com.candlebacktest.backtester.domain.indicator;

import java.util.OptionalDouble;

/**
 * Stateless crossover checks between the previous and current readings of two series.
 * Any reading that is not ready means no crossover.
 */
public final class Crossovers {

    private Crossovers() {
    }

    /**
     * Fast series crosses above the slow one: {@code prevFast <= prevSlow && fast > slow}.
     */
    public static boolean isBullish(OptionalDouble prevFast, OptionalDouble prevSlow,
                                    OptionalDouble fast, OptionalDouble slow) {
        if (!allPresent(prevFast, prevSlow, fast, slow)) {
            return false;
        }
        return prevFast.getAsDouble() <= prevSlow.getAsDouble()
                && fast.getAsDouble() > slow.getAsDouble();
    }

    /**
     * Fast series crosses below the slow one: {@code prevFast >= prevSlow && fast < slow}.
     */
    public static boolean isBearish(OptionalDouble prevFast, OptionalDouble prevSlow,
                                    OptionalDouble fast, OptionalDouble slow) {
        if (!allPresent(prevFast, prevSlow, fast, slow)) {
            return false;
        }
        return prevFast.getAsDouble() >= prevSlow.getAsDouble()
                && fast.getAsDouble() < slow.getAsDouble();
    }

    private static boolean allPresent(OptionalDouble... readings) {
        for (OptionalDouble reading : readings) {
            if (reading == null || reading.isEmpty()) {
                return false;
            }
        }
        return true;
    }
}
