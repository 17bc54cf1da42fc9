package com.candlebacktest.backtester.domain.strategy;

import com.candlebacktest.backtester.domain.Advice;
import com.candlebacktest.backtester.domain.Candle;
import com.candlebacktest.backtester.domain.indicator.IndicatorFacade;

import java.util.List;

/**
 * Base class for strategies split into an {@code update} phase that refreshes internal
 * state and a {@code check} phase that decides the advice.
 */
public abstract class PhasedStrategy implements Strategy {

    @Override
    public final Advice onCandle(Candle candle, List<Candle> history, IndicatorFacade indicators) {
        update(candle, history, indicators);
        return check(candle, indicators);
    }

    protected abstract void update(Candle candle, List<Candle> history, IndicatorFacade indicators);

    protected abstract Advice check(Candle candle, IndicatorFacade indicators);
}
