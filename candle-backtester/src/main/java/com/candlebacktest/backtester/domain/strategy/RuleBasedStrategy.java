package com.candlebacktest.backtester.domain.strategy;

import com.candlebacktest.backtester.domain.Advice;
import com.candlebacktest.backtester.domain.Candle;
import com.candlebacktest.backtester.domain.indicator.IndicatorFacade;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Interprets a {@link RuleSet} against the indicator facade.
 * Rules can only read indicators, so user-supplied definitions never run code.
 */
@Slf4j
public class RuleBasedStrategy implements Strategy {

    private final RuleSet rules;

    private boolean inPosition;
    private Double entryPrice;

    public RuleBasedStrategy(RuleSet rules) {
        if (rules == null) {
            throw new IllegalArgumentException("Rule set is required");
        }
        this.rules = rules;
    }

    @Override
    public void init(StrategyConfig config) {
        rules.validate();
        inPosition = false;
        entryPrice = null;
        log.info("Initialized rule set {} with {} entry and {} exit conditions", getName(),
                rules.getEntry().size(), rules.getExit() == null ? 0 : rules.getExit().size());
    }

    @Override
    public Advice onCandle(Candle candle, List<Candle> history, IndicatorFacade indicators) {
        if (!inPosition) {
            for (RuleCondition condition : rules.getEntry()) {
                if (!condition.isSatisfied(indicators)) {
                    return Advice.none();
                }
            }
            inPosition = true;
            entryPrice = candle.getClose();
            return Advice.buyAll().withReason("Entry rules met " + rules.getEntry());
        }

        double change = (candle.getClose() - entryPrice) / entryPrice * 100;
        if (rules.getStopLossPercent() != null && change <= -rules.getStopLossPercent()) {
            return exit(String.format("Stop loss triggered (%.2f%%)", change));
        }
        if (rules.getTakeProfitPercent() != null && change >= rules.getTakeProfitPercent()) {
            return exit(String.format("Take profit triggered (%.2f%%)", change));
        }
        if (rules.getExit() != null) {
            for (RuleCondition condition : rules.getExit()) {
                if (condition.isSatisfied(indicators)) {
                    return exit("Exit rule met " + condition);
                }
            }
        }
        return Advice.none();
    }

    private Advice exit(String reason) {
        inPosition = false;
        entryPrice = null;
        return Advice.sellAll().withReason(reason);
    }

    public RuleSet getRules() {
        return rules;
    }

    @Override
    public String getName() {
        return rules.getName() != null ? rules.getName() : "Rules";
    }
}
