package com.candlebacktest.backtester.domain.strategy;

import com.candlebacktest.backtester.domain.Advice;
import com.candlebacktest.backtester.domain.Candle;
import com.candlebacktest.backtester.domain.indicator.IndicatorFacade;
import com.candlebacktest.backtester.domain.indicator.IndicatorType;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.OptionalDouble;

/**
 * SMA crossover with an RSI filter and fixed stop-loss / take-profit exits.
 *
 * <p>Enters long when the fast SMA crosses above the slow SMA, RSI is below the overbought
 * threshold and the close is above the slow SMA. Exits on stop-loss, take-profit, a bearish
 * crossover or an overbought RSI, whichever comes first.
 *
 * <p>Parameters: {@code fastPeriod} (10), {@code slowPeriod} (20), {@code rsiPeriod} (14),
 * {@code rsiOverbought} (70), {@code rsiOversold} (30), {@code stopLossPercent} (5),
 * {@code takeProfitPercent} (10).
 */
@Slf4j
public class SmaRsiStrategy extends PhasedStrategy {

    @Getter
    private int fastPeriod = 10;
    @Getter
    private int slowPeriod = 20;
    @Getter
    private int rsiPeriod = 14;
    private double rsiOverbought = 70;
    private double rsiOversold = 30;
    private double stopLossPercent = 5;
    private double takeProfitPercent = 10;

    private boolean inPosition;
    private Double entryPrice;

    // readings refreshed by update()
    private int historySize;
    private OptionalDouble fast = OptionalDouble.empty();
    private OptionalDouble slow = OptionalDouble.empty();
    private OptionalDouble rsi = OptionalDouble.empty();

    @Override
    public void init(StrategyConfig config) {
        fastPeriod = config.intParameter("fastPeriod", fastPeriod);
        slowPeriod = config.intParameter("slowPeriod", slowPeriod);
        rsiPeriod = config.intParameter("rsiPeriod", rsiPeriod);
        rsiOverbought = config.doubleParameter("rsiOverbought", rsiOverbought);
        rsiOversold = config.doubleParameter("rsiOversold", rsiOversold);
        stopLossPercent = config.doubleParameter("stopLossPercent", stopLossPercent);
        takeProfitPercent = config.doubleParameter("takeProfitPercent", takeProfitPercent);

        if (fastPeriod <= 0 || rsiPeriod <= 0) {
            throw new IllegalArgumentException("Periods must be greater than 0");
        }
        if (fastPeriod >= slowPeriod) {
            throw new IllegalArgumentException("Fast period must be less than slow period");
        }
        if (rsiOversold >= rsiOverbought) {
            throw new IllegalArgumentException("RSI oversold threshold must be below the overbought threshold");
        }

        inPosition = false;
        entryPrice = null;
        log.info("Initialized {} for {}/{}: fast SMA={}, slow SMA={}, RSI={}",
                getName(), config.getAsset(), config.getCurrency(), fastPeriod, slowPeriod, rsiPeriod);
    }

    @Override
    protected void update(Candle candle, List<Candle> history, IndicatorFacade indicators) {
        historySize = history.size();
        fast = indicators.sma(fastPeriod);
        slow = indicators.sma(slowPeriod);
        rsi = indicators.rsi(rsiPeriod);
    }

    @Override
    protected Advice check(Candle candle, IndicatorFacade indicators) {
        if (historySize < Math.max(slowPeriod, rsiPeriod)) {
            return Advice.none();
        }
        if (fast.isEmpty() || slow.isEmpty() || rsi.isEmpty()) {
            return Advice.none();
        }

        double price = candle.getClose();
        double rsiValue = rsi.getAsDouble();

        if (inPosition) {
            Advice riskExit = checkRiskManagement(price);
            if (!riskExit.isNone()) {
                return riskExit;
            }
            return checkExit(indicators, rsiValue);
        }
        return checkEntry(indicators, price, rsiValue);
    }

    private Advice checkEntry(IndicatorFacade indicators, double price, double rsiValue) {
        if (!indicators.isBullishCrossover(IndicatorType.SMA, fastPeriod, slowPeriod)) {
            return Advice.none();
        }
        if (rsiValue >= rsiOverbought || price <= slow.getAsDouble()) {
            return Advice.none();
        }
        inPosition = true;
        entryPrice = price;
        return Advice.buyAll()
                .withReason(String.format("Bullish SMA crossover (%.2f > %.2f), RSI: %.2f",
                        fast.getAsDouble(), slow.getAsDouble(), rsiValue))
                .withConfidence(confidence(indicators, rsiValue));
    }

    private Advice checkExit(IndicatorFacade indicators, double rsiValue) {
        boolean bearish = indicators.isBearishCrossover(IndicatorType.SMA, fastPeriod, slowPeriod);
        boolean overbought = rsiValue > rsiOverbought;
        if (!bearish && !overbought) {
            return Advice.none();
        }
        String reason = bearish
                ? String.format("Bearish SMA crossover (%.2f < %.2f)", fast.getAsDouble(), slow.getAsDouble())
                : String.format("RSI overbought (%.2f > %.0f)", rsiValue, rsiOverbought);
        flatten();
        return Advice.sellAll()
                .withReason(reason)
                .withConfidence(confidence(indicators, rsiValue));
    }

    private Advice checkRiskManagement(double price) {
        if (entryPrice == null) {
            return Advice.none();
        }
        double change = (price - entryPrice) / entryPrice * 100;
        if (change <= -stopLossPercent) {
            flatten();
            return Advice.sellAll().withReason(String.format("Stop loss triggered (%.2f%%)", change));
        }
        if (change >= takeProfitPercent) {
            flatten();
            return Advice.sellAll().withReason(String.format("Take profit triggered (%.2f%%)", change));
        }
        return Advice.none();
    }

    double confidence(IndicatorFacade indicators, double rsiValue) {
        double confidence = 0.5;
        if (rsiValue > rsiOversold && rsiValue < rsiOverbought) {
            confidence += 0.2;
        }
        OptionalDouble change = indicators.percentageChange();
        if (change.isPresent() && Math.abs(change.getAsDouble()) > 1) {
            confidence += 0.1;
        }
        Candle current = indicators.currentCandle();
        if (current.getVolume() > 0) {
            List<Double> volumes = indicators.volumes(10);
            double average = volumes.stream().mapToDouble(Double::doubleValue).average().orElse(0);
            if (current.getVolume() > average * 1.5) {
                confidence += 0.1;
            }
        }
        return Math.min(confidence, 1.0);
    }

    private void flatten() {
        inPosition = false;
        entryPrice = null;
    }

    public boolean isInPosition() {
        return inPosition;
    }

    @Override
    public String getName() {
        return "SmaRsi";
    }
}
