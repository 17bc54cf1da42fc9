package com.candlebacktest.backtester.service;

import com.candlebacktest.backtester.domain.strategy.BuyAndHoldStrategy;
import com.candlebacktest.backtester.domain.strategy.MovingAverageCrossoverStrategy;
import com.candlebacktest.backtester.domain.strategy.NoOpStrategy;
import com.candlebacktest.backtester.domain.strategy.RuleBasedStrategy;
import com.candlebacktest.backtester.domain.strategy.RuleCondition;
import com.candlebacktest.backtester.domain.strategy.SmaRsiStrategy;
import com.candlebacktest.backtester.domain.strategy.Strategy;
import com.candlebacktest.backtester.domain.indicator.IndicatorType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for StrategyFactory.
 */
class StrategyFactoryTest {

    private StrategyFactory factory;

    @BeforeEach
    void setUp() {
        factory = new StrategyFactory(new ObjectMapper());
    }

    @Test
    void testBuiltInStrategies() {
        assertInstanceOf(BuyAndHoldStrategy.class, factory.createStrategy("buy_and_hold", null));
        assertInstanceOf(BuyAndHoldStrategy.class, factory.createStrategy("BuyAndHold", Map.of()));
        assertInstanceOf(SmaRsiStrategy.class, factory.createStrategy("sma_rsi", Map.of()));
        assertInstanceOf(NoOpStrategy.class, factory.createStrategy("noop", Map.of()));
    }

    @Test
    void testMaCrossover_UsesParameters() {
        // Act
        Strategy strategy = factory.createStrategy("ma_crossover",
                Map.of("shortPeriod", 5, "longPeriod", "20", "type", "ema"));

        // Assert
        assertInstanceOf(MovingAverageCrossoverStrategy.class, strategy);
        assertEquals("MovingAverageCrossover(EMA,5,20)", strategy.getName());
    }

    @Test
    void testMaCrossover_Defaults() {
        assertEquals("MovingAverageCrossover(10,50)", factory.createStrategy("ma_crossover", Map.of()).getName());
    }

    @Test
    void testMaCrossover_InvalidPeriodsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> factory.createStrategy("ma_crossover", Map.of("shortPeriod", 50, "longPeriod", 10)));
    }

    @Test
    void testUnknownStrategy_Rejected() {
        // Act
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> factory.createStrategy("martingale", Map.of()));

        // Assert
        assertTrue(e.getMessage().contains("Unknown strategy: martingale"));
    }

    @Test
    void testBlankName_Rejected() {
        assertThrows(IllegalArgumentException.class, () -> factory.createStrategy(" ", Map.of()));
    }

    @Test
    void testRulesDefinitionFromFile() throws Exception {
        // Arrange
        String json = Files.readString(
                Paths.get(getClass().getResource("/fixtures/rules-strategy.json").toURI()), StandardCharsets.UTF_8);

        // Act
        StrategyDefinition definition = factory.parseDefinition(json);
        Strategy strategy = factory.createStrategy(definition);

        // Assert
        assertEquals("rules", definition.getName());
        RuleBasedStrategy rules = assertInstanceOf(RuleBasedStrategy.class, strategy);
        assertEquals("ema-trend", rules.getName());
        List<RuleCondition> entry = rules.getRules().getEntry();
        assertEquals(1, entry.size());
        assertEquals(RuleCondition.Type.CROSSOVER_UP, entry.get(0).getType());
        assertEquals(IndicatorType.EMA, entry.get(0).getIndicator());
        assertEquals(8, (int) entry.get(0).getSlowPeriod());
        assertEquals(5.0, (double) rules.getRules().getStopLossPercent());
    }

    @Test
    void testParseDefinition_Invalid() {
        assertThrows(IllegalArgumentException.class, () -> factory.parseDefinition("{not json"));
        assertThrows(IllegalArgumentException.class, () -> factory.parseDefinition("{\"parameters\": {}}"));
    }

    @Test
    void testAvailableStrategies() {
        assertEquals(List.of("buy_and_hold", "ma_crossover", "sma_rsi", "noop", "rules"),
                factory.availableStrategies());
    }
}
