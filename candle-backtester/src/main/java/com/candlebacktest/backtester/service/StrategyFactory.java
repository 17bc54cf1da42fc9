package com.candlebacktest.backtester.service;

import com.candlebacktest.backtester.domain.indicator.IndicatorType;
import com.candlebacktest.backtester.domain.strategy.BuyAndHoldStrategy;
import com.candlebacktest.backtester.domain.strategy.MovingAverageCrossoverStrategy;
import com.candlebacktest.backtester.domain.strategy.NoOpStrategy;
import com.candlebacktest.backtester.domain.strategy.RuleBasedStrategy;
import com.candlebacktest.backtester.domain.strategy.RuleSet;
import com.candlebacktest.backtester.domain.strategy.SmaRsiStrategy;
import com.candlebacktest.backtester.domain.strategy.Strategy;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Factory for creating strategy instances based on name and parameters.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StrategyFactory {

    public static final String BUY_AND_HOLD = "buy_and_hold";
    public static final String MA_CROSSOVER = "ma_crossover";
    public static final String SMA_RSI = "sma_rsi";
    public static final String NOOP = "noop";
    public static final String RULES = "rules";

    private static final List<String> AVAILABLE = List.of(BUY_AND_HOLD, MA_CROSSOVER, SMA_RSI, NOOP, RULES);

    private final ObjectMapper objectMapper;

    public List<String> availableStrategies() {
        return AVAILABLE;
    }

    /**
     * Create a strategy instance from name and parameters.
     *
     * @throws IllegalArgumentException for an unknown name or unusable parameters
     */
    public Strategy createStrategy(String strategyName, Map<String, Object> parameters) {
        if (strategyName == null || strategyName.isBlank()) {
            throw new IllegalArgumentException("Strategy name is required");
        }
        Map<String, Object> params = parameters != null ? parameters : Collections.emptyMap();
        log.info("Creating strategy: {} with parameters: {}", strategyName, params);

        return switch (strategyName.toLowerCase()) {
            case "buyandhold", BUY_AND_HOLD -> new BuyAndHoldStrategy();

            case "movingaveragecrossover", MA_CROSSOVER -> {
                int shortPeriod = intParam(params, "shortPeriod", 10);
                int longPeriod = intParam(params, "longPeriod", 50);
                IndicatorType type = IndicatorType.valueOf(
                        String.valueOf(params.getOrDefault("type", "SMA")).toUpperCase());
                yield new MovingAverageCrossoverStrategy(type, shortPeriod, longPeriod);
            }

            // parameters reach this one through StrategyConfig at init
            case "smarsi", SMA_RSI -> new SmaRsiStrategy();

            case NOOP -> new NoOpStrategy();

            case "rulebased", RULES -> new RuleBasedStrategy(objectMapper.convertValue(params, RuleSet.class));

            default -> throw new IllegalArgumentException(
                    "Unknown strategy: " + strategyName + ". Available: " + AVAILABLE);
        };
    }

    public Strategy createStrategy(StrategyDefinition definition) {
        return createStrategy(definition.getName(), definition.getParameters());
    }

    /**
     * Parse a strategy definition of the form {@code {"name": "...", "parameters": {...}}}.
     */
    public StrategyDefinition parseDefinition(String json) {
        try {
            StrategyDefinition definition = objectMapper.readValue(json, StrategyDefinition.class);
            if (definition.getName() == null || definition.getName().isBlank()) {
                throw new IllegalArgumentException("Strategy definition has no name");
            }
            return definition;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to parse strategy definition: " + e.getOriginalMessage(), e);
        }
    }

    private static int intParam(Map<String, Object> params, String name, int defaultValue) {
        Object value = params.get(name);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value instanceof String) {
            return Integer.parseInt((String) value);
        }
        return defaultValue;
    }
}
