package com.candlebacktest.backtester.domain.strategy;

import com.candlebacktest.backtester.domain.indicator.IndicatorFacade;
import com.candlebacktest.backtester.domain.indicator.IndicatorType;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One declarative condition of a {@link RuleSet}, evaluated read-only against the indicator facade.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RuleCondition {

    public enum Type {
        CROSSOVER_UP,
        CROSSOVER_DOWN,
        RSI_BELOW,
        RSI_ABOVE,
        PRICE_ABOVE_MA,
        PRICE_BELOW_MA
    }

    private Type type;

    /**
     * Moving average type for crossover and price/MA conditions.
     */
    @Builder.Default
    private IndicatorType indicator = IndicatorType.SMA;

    private Integer period;
    private Integer fastPeriod;
    private Integer slowPeriod;
    private Double threshold;

    public void validate() {
        if (type == null) {
            throw new IllegalArgumentException("Rule condition type is required");
        }
        switch (type) {
            case CROSSOVER_UP, CROSSOVER_DOWN -> {
                requireMovingAverage();
                requirePositive("fastPeriod", fastPeriod);
                requirePositive("slowPeriod", slowPeriod);
                if (fastPeriod >= slowPeriod) {
                    throw new IllegalArgumentException(type + ": fastPeriod must be less than slowPeriod");
                }
            }
            case RSI_BELOW, RSI_ABOVE -> {
                requirePositive("period", period);
                if (threshold == null || threshold < 0 || threshold > 100) {
                    throw new IllegalArgumentException(type + ": threshold must be within [0, 100]");
                }
            }
            case PRICE_ABOVE_MA, PRICE_BELOW_MA -> {
                requireMovingAverage();
                requirePositive("period", period);
            }
        }
    }

    public boolean isSatisfied(IndicatorFacade indicators) {
        return switch (type) {
            case CROSSOVER_UP -> indicators.isBullishCrossover(indicator, fastPeriod, slowPeriod);
            case CROSSOVER_DOWN -> indicators.isBearishCrossover(indicator, fastPeriod, slowPeriod);
            case RSI_BELOW -> indicators.isOversold(period, threshold);
            case RSI_ABOVE -> indicators.isOverbought(period, threshold);
            case PRICE_ABOVE_MA -> indicators.isPriceAboveMa(indicator, period);
            case PRICE_BELOW_MA -> indicators.isPriceBelowMa(indicator, period);
        };
    }

    private void requireMovingAverage() {
        if (indicator == null || !indicator.isMovingAverage()) {
            throw new IllegalArgumentException(type + ": indicator must be SMA, EMA or DEMA, got " + indicator);
        }
    }

    private void requirePositive(String name, Integer value) {
        if (value == null || value <= 0) {
            throw new IllegalArgumentException(type + ": " + name + " must be greater than 0");
        }
    }

    @Override
    public String toString() {
        return switch (type) {
            case CROSSOVER_UP, CROSSOVER_DOWN -> type + "(" + indicator + " " + fastPeriod + "/" + slowPeriod + ")";
            case RSI_BELOW, RSI_ABOVE -> type + "(" + period + ", " + threshold + ")";
            case PRICE_ABOVE_MA, PRICE_BELOW_MA -> type + "(" + indicator + " " + period + ")";
        };
    }
}
