package com.candlebacktest.backtester.domain.strategy;

import com.candlebacktest.backtester.domain.Advice;
import com.candlebacktest.backtester.domain.Candle;
import com.candlebacktest.backtester.domain.indicator.IndicatorFacade;

import java.util.List;

/**
 * Never trades. Useful as a baseline.
 */
public class NoOpStrategy implements Strategy {

    @Override
    public Advice onCandle(Candle candle, List<Candle> history, IndicatorFacade indicators) {
        return Advice.none();
    }

    @Override
    public String getName() {
        return "NoOp";
    }
}
