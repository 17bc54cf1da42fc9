package com.candlebacktest.backtester.domain.strategy;

import com.candlebacktest.backtester.domain.Advice;
import com.candlebacktest.backtester.domain.Candle;
import com.candlebacktest.backtester.domain.indicator.IndicatorFacade;
import com.candlebacktest.backtester.domain.indicator.IndicatorType;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Moving Average Crossover Strategy.
 * Buys when the fast MA crosses above the slow MA, sells when it crosses below.
 */
@Slf4j
public class MovingAverageCrossoverStrategy implements Strategy {

    private final IndicatorType type;
    private final int shortPeriod;
    private final int longPeriod;

    private boolean inPosition = false;

    public MovingAverageCrossoverStrategy(int shortPeriod, int longPeriod) {
        this(IndicatorType.SMA, shortPeriod, longPeriod);
    }

    public MovingAverageCrossoverStrategy(IndicatorType type, int shortPeriod, int longPeriod) {
        if (type == null || !type.isMovingAverage()) {
            throw new IllegalArgumentException("Crossover needs a moving average type, got " + type);
        }
        if (shortPeriod <= 0) {
            throw new IllegalArgumentException("Short period must be greater than 0");
        }
        if (shortPeriod >= longPeriod) {
            throw new IllegalArgumentException("Short period must be less than long period");
        }
        this.type = type;
        this.shortPeriod = shortPeriod;
        this.longPeriod = longPeriod;
    }

    @Override
    public void init(StrategyConfig config) {
        inPosition = false;
    }

    @Override
    public Advice onCandle(Candle candle, List<Candle> history, IndicatorFacade indicators) {
        // Golden cross - buy signal
        if (!inPosition && indicators.isBullishCrossover(type, shortPeriod, longPeriod)) {
            inPosition = true;
            log.debug("MA Crossover: BUY at {} on {}", candle.getClose(), candle.getTimestamp());
            return Advice.buyAll().withReason(type + " golden cross " + shortPeriod + "/" + longPeriod);
        }

        // Death cross - sell signal
        if (inPosition && indicators.isBearishCrossover(type, shortPeriod, longPeriod)) {
            inPosition = false;
            log.debug("MA Crossover: SELL at {} on {}", candle.getClose(), candle.getTimestamp());
            return Advice.sellAll().withReason(type + " death cross " + shortPeriod + "/" + longPeriod);
        }

        return Advice.none();
    }

    @Override
    public String getName() {
        return "MovingAverageCrossover(" + (type == IndicatorType.SMA ? "" : type + ",")
                + shortPeriod + "," + longPeriod + ")";
    }
}
