package com.candlebacktest.backtester.domain;

import lombok.Value;

/**
 * Snapshot of the simulated account: cash plus a single asset position.
 */
@Value
public class Position {

    double cash;
    double assetQuantity;

    /**
     * Cost basis of the open position, {@code null} when flat.
     */
    Double entryPrice;

    public boolean isFlat() {
        return assetQuantity == 0;
    }
}
