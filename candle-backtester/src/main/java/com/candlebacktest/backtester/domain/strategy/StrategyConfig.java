package com.candlebacktest.backtester.domain.strategy;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Settings handed to {@link Strategy#init(StrategyConfig)}.
 */
@Value
@Builder
public class StrategyConfig {

    @Builder.Default
    String currency = "USD";

    @Builder.Default
    String asset = "BTC";

    @Singular
    Map<String, Object> parameters;

    public int intParameter(String name, int defaultValue) {
        Object value = parameters.get(name);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value instanceof String && !((String) value).isBlank()) {
            return Integer.parseInt(((String) value).trim());
        }
        return defaultValue;
    }

    public double doubleParameter(String name, double defaultValue) {
        Object value = parameters.get(name);
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof String && !((String) value).isBlank()) {
            return Double.parseDouble(((String) value).trim());
        }
        return defaultValue;
    }
}
