package com.candlebacktest.backtester.domain.indicator;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for BollingerBands.
 */
class BollingerBandsTest {

    @Test
    void testWarmUp_BandsEmptyUntilPeriodValues() {
        // Arrange
        BollingerBands bollinger = new BollingerBands(3);

        // Act & Assert
        assertTrue(bollinger.update(1).isEmpty());
        assertTrue(bollinger.update(2).isEmpty());
        assertTrue(bollinger.bands().isEmpty());
        assertFalse(bollinger.isReady());
        assertEquals(2.0, bollinger.update(3).getAsDouble(), 1e-12);
        assertTrue(bollinger.isReady());
    }

    @Test
    void testBands_PopulationDeviation() {
        // Arrange
        BollingerBands bollinger = new BollingerBands(4, 2.0);

        // Act - mean 5, deviation 2
        bollinger.update(3);
        bollinger.update(3);
        bollinger.update(7);
        bollinger.update(7);
        BollingerBands.Bands bands = bollinger.bands().get();

        // Assert
        assertEquals(5.0, bands.getMiddle(), 1e-12);
        assertEquals(9.0, bands.getUpper(), 1e-12);
        assertEquals(1.0, bands.getLower(), 1e-12);
        assertEquals(160.0, bands.bandwidth().getAsDouble(), 1e-12);
        assertEquals(75.0, bands.percentB(7).getAsDouble(), 1e-12);
    }

    @Test
    void testSlidingWindow() {
        // Arrange
        BollingerBands bollinger = new BollingerBands(2, 1.0);
        bollinger.update(100);
        bollinger.update(100);

        // Act
        bollinger.update(104);
        Optional<BollingerBands.Bands> bands = bollinger.bands();

        // Assert - window 100, 104
        assertEquals(102.0, bands.get().getMiddle(), 1e-12);
        assertEquals(104.0, bands.get().getUpper(), 1e-12);
        assertEquals(100.0, bands.get().getLower(), 1e-12);
    }

    @Test
    void testFlatInput_CollapsedBands() {
        // Arrange
        BollingerBands bollinger = new BollingerBands(2);

        // Act
        bollinger.update(50);
        bollinger.update(50);
        BollingerBands.Bands bands = bollinger.bands().get();

        // Assert
        assertEquals(bands.getUpper(), bands.getLower());
        assertTrue(bands.percentB(50).isEmpty());
        assertEquals(0.0, bands.bandwidth().getAsDouble());
    }

    @Test
    void testReset_ClearsState() {
        // Arrange
        BollingerBands bollinger = new BollingerBands(1);
        bollinger.update(5);

        // Act
        bollinger.reset();

        // Assert
        assertTrue(bollinger.bands().isEmpty());
        assertEquals(0, bollinger.count());
    }

    @Test
    void testInvalidArguments_Throw() {
        assertThrows(IllegalArgumentException.class, () -> new BollingerBands(0));
        assertThrows(IllegalArgumentException.class, () -> new BollingerBands(20, 0));
        assertThrows(IllegalArgumentException.class, () -> new BollingerBands(20, Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> IndicatorKey.bollinger(20, -1));
    }

    @Test
    void testKey_MultiplierOnlyCountsForBollinger() {
        assertEquals(IndicatorKey.bollinger(20, 2.0), new IndicatorKey(IndicatorType.BOLLINGER, 20, PriceType.CLOSE));
        assertNotEquals(IndicatorKey.bollinger(20, 2.0), IndicatorKey.bollinger(20, 2.5));
        assertEquals(IndicatorKey.sma(5), new IndicatorKey(IndicatorType.SMA, 5, PriceType.CLOSE, 3.0));
        assertEquals("BOLLINGER(20, 2.5)", IndicatorKey.bollinger(20, 2.5).toString());
    }
}
