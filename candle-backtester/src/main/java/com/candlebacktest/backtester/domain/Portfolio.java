package com.candlebacktest.backtester.domain;

import com.candlebacktest.backtester.exception.BacktestException;
import com.candlebacktest.backtester.exception.BacktestException.ErrorCode;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Simulated single-asset account.
 * Turns advice into fills at the candle close, charging commission and adverse slippage,
 * and keeps the trade ledger.
 */
@Slf4j
public class Portfolio {

    /**
     * Relative tolerance under which a cash or quantity residue counts as zero.
     */
    static final double DUST = 1e-9;

    @Getter
    private final double initialBalance;
    @Getter
    private final double commissionRate;
    @Getter
    private final double minLotSize;
    private final SlippageModel slippageModel;
    private final DiagnosticsSink diagnostics;

    @Getter
    private double cash;
    @Getter
    private double assetQuantity;
    @Getter
    private Double entryPrice;

    private final List<Trade> trades = new ArrayList<>();

    @Getter
    private double totalCommission;
    @Getter
    private double totalSlippage;
    @Getter
    private double realizedPnl;

    @Builder
    public Portfolio(double initialBalance, double commissionRate, double minLotSize,
                     SlippageModel slippageModel, DiagnosticsSink diagnostics) {
        if (!(initialBalance > 0) || Double.isInfinite(initialBalance)) {
            throw new IllegalArgumentException("Initial balance must be positive, got " + initialBalance);
        }
        if (!(commissionRate >= 0 && commissionRate < 1)) {
            throw new IllegalArgumentException("Commission rate must be within [0, 1), got " + commissionRate);
        }
        if (!(minLotSize >= 0)) {
            throw new IllegalArgumentException("Minimum lot size must not be negative, got " + minLotSize);
        }
        this.initialBalance = initialBalance;
        this.commissionRate = commissionRate;
        this.minLotSize = minLotSize;
        this.slippageModel = slippageModel != null ? slippageModel : SlippageModel.none();
        this.diagnostics = diagnostics != null ? diagnostics : new DiagnosticsSink();
        this.cash = initialBalance;
    }

    /**
     * Apply one advice against the close of the given candle.
     *
     * @return the executed trade, or empty when nothing was filled
     * @throws BacktestException with {@link ErrorCode#INVARIANT_VIOLATION} if the books break
     */
    public Optional<Trade> applyAdvice(int candleIndex, Advice advice, Candle candle) {
        if (advice == null || advice.isNone()) {
            return Optional.empty();
        }
        if (!(candle.getClose() > 0)) {
            diagnostics.record(Diagnostic.Type.INVALID_PRICE, candleIndex, candle.getTimestamp(),
                    "Cannot fill " + advice.getAction() + " at non-positive price " + candle.getClose());
            return Optional.empty();
        }

        Optional<Trade> trade = advice.getAction() == Advice.Action.BUY
                ? buy(candleIndex, advice, candle)
                : sell(candleIndex, advice, candle);

        checkInvariants(candleIndex, candle);
        return trade;
    }

    private Optional<Trade> buy(int candleIndex, Advice advice, Candle candle) {
        if (cash <= 0) {
            log.debug("Buy at candle {} skipped: no cash available", candleIndex);
            return Optional.empty();
        }

        double slippageRate = slippageModel.rate(Trade.Side.BUY, candle);
        double fillPrice = candle.getClose() * (1 + slippageRate);

        double quantity;
        if (advice.getSize().isAll()) {
            quantity = cash * (1 - commissionRate) / fillPrice;
        } else {
            quantity = advice.getSize().getUnits();
        }
        quantity = roundToLot(quantity);

        if (quantity <= 0) {
            diagnostics.record(Diagnostic.Type.ORDER_BELOW_MIN_LOT, candleIndex, candle.getTimestamp(),
                    "Buy quantity rounds to zero under minimum lot size " + minLotSize);
            return Optional.empty();
        }

        double notional = quantity * fillPrice;
        double commission = notional * commissionRate;
        double required = notional + commission;

        if (!advice.getSize().isAll() && required > cash) {
            diagnostics.record(Diagnostic.Type.INSUFFICIENT_FUNDS, candleIndex, candle.getTimestamp(),
                    String.format("Insufficient balance. Available: %.8f, Required: %.8f", cash, required));
            return Optional.empty();
        }

        double previousQuantity = assetQuantity;
        cash -= required;
        if (Math.abs(cash) <= DUST * Math.max(1.0, notional)) {
            cash = 0;
        }
        assetQuantity += quantity;
        entryPrice = previousQuantity == 0
                ? fillPrice
                : (entryPrice * previousQuantity + fillPrice * quantity) / assetQuantity;

        double slippageCost = quantity * (fillPrice - candle.getClose());
        totalCommission += commission;
        totalSlippage += slippageCost;

        Trade trade = Trade.builder()
                .sequence(trades.size() + 1)
                .candleIndex(candleIndex)
                .timestamp(candle.getTimestamp())
                .side(Trade.Side.BUY)
                .price(fillPrice)
                .quantity(quantity)
                .notional(notional)
                .commission(commission)
                .slippage(slippageCost)
                .cashAfter(cash)
                .positionAfter(assetQuantity)
                .reason(advice.getReason())
                .build();
        trades.add(trade);

        log.debug("BUY {} at {} (candle {}), commission {}, cash left {}",
                quantity, fillPrice, candleIndex, commission, cash);
        return Optional.of(trade);
    }

    private Optional<Trade> sell(int candleIndex, Advice advice, Candle candle) {
        if (assetQuantity <= 0) {
            log.debug("Sell at candle {} skipped: no position", candleIndex);
            return Optional.empty();
        }

        boolean liquidate = advice.getSize().isAll();
        double quantity = assetQuantity;
        if (!liquidate) {
            double requested = advice.getSize().getUnits();
            if (requested > assetQuantity) {
                diagnostics.record(Diagnostic.Type.INSUFFICIENT_POSITION, candleIndex, candle.getTimestamp(),
                        String.format("Requested %.8f but only %.8f held, selling the full position",
                                requested, assetQuantity));
                liquidate = true;
            } else {
                quantity = requested;
            }
        }

        double slippageRate = slippageModel.rate(Trade.Side.SELL, candle);
        double fillPrice = candle.getClose() * (1 - slippageRate);
        double notional = quantity * fillPrice;
        double commission = notional * commissionRate;
        double proceeds = notional - commission;
        double pnl = proceeds - quantity * entryPrice;

        assetQuantity -= quantity;
        if (liquidate || Math.abs(assetQuantity) <= DUST * quantity) {
            assetQuantity = 0;
        }
        cash += proceeds;
        if (assetQuantity == 0) {
            entryPrice = null;
        }

        double slippageCost = quantity * (candle.getClose() - fillPrice);
        totalCommission += commission;
        totalSlippage += slippageCost;
        realizedPnl += pnl;

        Trade trade = Trade.builder()
                .sequence(trades.size() + 1)
                .candleIndex(candleIndex)
                .timestamp(candle.getTimestamp())
                .side(Trade.Side.SELL)
                .price(fillPrice)
                .quantity(quantity)
                .notional(notional)
                .commission(commission)
                .slippage(slippageCost)
                .realizedPnl(pnl)
                .cashAfter(cash)
                .positionAfter(assetQuantity)
                .reason(advice.getReason())
                .build();
        trades.add(trade);

        log.debug("SELL {} at {} (candle {}), commission {}, realized P&L {}",
                quantity, fillPrice, candleIndex, commission, pnl);
        return Optional.of(trade);
    }

    private double roundToLot(double quantity) {
        if (minLotSize <= 0) {
            return quantity;
        }
        return Math.floor(quantity / minLotSize) * minLotSize;
    }

    private void checkInvariants(int candleIndex, Candle candle) {
        if (!(cash >= 0) || !(assetQuantity >= 0)) {
            throw new BacktestException(ErrorCode.INVARIANT_VIOLATION,
                    "Portfolio invariant broken: cash=" + cash + ", assetQuantity=" + assetQuantity,
                    candleIndex, candle.getTimestamp());
        }
    }

    /**
     * Cash plus the position marked at the given price.
     */
    public double equity(double price) {
        return cash + assetQuantity * price;
    }

    /**
     * Mark-to-market profit of the open position against its cost basis.
     */
    public double unrealizedPnl(double price) {
        if (entryPrice == null || assetQuantity == 0) {
            return 0;
        }
        return assetQuantity * (price - entryPrice);
    }

    public Position snapshot() {
        return new Position(cash, assetQuantity, entryPrice);
    }

    public List<Trade> getTrades() {
        return Collections.unmodifiableList(trades);
    }
}
