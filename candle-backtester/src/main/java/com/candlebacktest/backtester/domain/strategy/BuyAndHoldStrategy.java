package com.candlebacktest.backtester.domain.strategy;

import com.candlebacktest.backtester.domain.Advice;
import com.candlebacktest.backtester.domain.Candle;
import com.candlebacktest.backtester.domain.indicator.IndicatorFacade;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Simple buy-and-hold strategy.
 * Spends all cash on the first candle and holds until the end.
 */
@Slf4j
public class BuyAndHoldStrategy implements Strategy {

    private boolean hasBought = false;

    @Override
    public void init(StrategyConfig config) {
        hasBought = false;
    }

    @Override
    public Advice onCandle(Candle candle, List<Candle> history, IndicatorFacade indicators) {
        if (hasBought) {
            return Advice.none();
        }
        hasBought = true;
        log.debug("Buy and Hold: buying at {} on {}", candle.getClose(), candle.getTimestamp());
        return Advice.buyAll().withReason("Buy and hold entry");
    }

    @Override
    public String getName() {
        return "BuyAndHold";
    }
}
