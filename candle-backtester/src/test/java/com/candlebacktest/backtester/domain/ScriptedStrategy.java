package com.candlebacktest.backtester.domain;

import com.candlebacktest.backtester.domain.indicator.IndicatorFacade;
import com.candlebacktest.backtester.domain.strategy.Strategy;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Test strategy that replays fixed advice keyed by candle index.
 */
public class ScriptedStrategy implements Strategy {

    private final Map<Integer, Advice> script = new HashMap<>();

    public ScriptedStrategy at(int index, Advice advice) {
        script.put(index, advice);
        return this;
    }

    @Override
    public Advice onCandle(Candle candle, List<Candle> history, IndicatorFacade indicators) {
        return script.getOrDefault(history.size() - 1, Advice.none());
    }

    @Override
    public String getName() {
        return "Scripted";
    }
}
