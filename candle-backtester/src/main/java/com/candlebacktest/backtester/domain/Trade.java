package com.candlebacktest.backtester.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

/**
 * Represents one executed fill in the trade ledger.
 */
@Value
@Builder
public class Trade {

    int sequence;
    int candleIndex;
    long timestamp;
    Side side;
    double price;
    double quantity;
    double notional;
    double commission;
    double slippage;

    /**
     * Realized profit or loss, only set on sells.
     */
    Double realizedPnl;

    double cashAfter;
    double positionAfter;
    String reason;

    public enum Side {
        BUY, SELL
    }

    @JsonIgnore
    public boolean isSell() {
        return side == Side.SELL;
    }

    /**
     * Total cash moved by the trade, commission included.
     */
    public double getTotalValue() {
        return side == Side.BUY ? notional + commission : notional - commission;
    }
}
