package com.candlebacktest.backtester.domain.indicator;

import com.candlebacktest.backtester.domain.Candle;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for AverageTrueRange.
 */
class AverageTrueRangeTest {

    private static Candle candle(double high, double low, double close) {
        return Candle.builder().timestamp(0).open(close).high(high).low(low).close(close).volume(1).build();
    }

    @Test
    void testWarmUp_FirstReadingAfterPeriodPlusOneCandles() {
        // Arrange
        AverageTrueRange atr = new AverageTrueRange(2);

        // Act & Assert
        assertTrue(atr.update(candle(10, 8, 9), PriceType.CLOSE).isEmpty());
        assertTrue(atr.update(candle(11, 9, 10), PriceType.CLOSE).isEmpty());
        assertEquals(2.5, atr.update(candle(13, 10, 12), PriceType.CLOSE).getAsDouble(), 1e-12);
        assertTrue(atr.isReady());
    }

    @Test
    void testWilderSmoothing() {
        // Arrange
        AverageTrueRange atr = new AverageTrueRange(2);
        atr.update(candle(10, 8, 9), PriceType.CLOSE);
        atr.update(candle(11, 9, 10), PriceType.CLOSE);
        atr.update(candle(13, 10, 12), PriceType.CLOSE);

        // Act - true range 1
        double value = atr.update(candle(12, 11, 11.5), PriceType.CLOSE).getAsDouble();

        // Assert
        assertEquals(1.75, value, 1e-12);
    }

    @Test
    void testGap_UsesPreviousClose() {
        // Arrange
        AverageTrueRange atr = new AverageTrueRange(1);
        atr.update(candle(12, 11, 12), PriceType.CLOSE);

        // Act - gap up: range 2 but 8 above the previous close
        double value = atr.update(candle(20, 18, 19), PriceType.CLOSE).getAsDouble();

        // Assert
        assertEquals(8.0, value, 1e-12);
    }

    @Test
    void testBareValues_UseCloseToCloseMoves() {
        // Arrange
        AverageTrueRange atr = new AverageTrueRange(2);
        atr.update(100);
        atr.update(103);

        // Act
        double value = atr.update(102).getAsDouble();

        // Assert
        assertEquals(2.0, value, 1e-12);
    }

    @Test
    void testReset_ClearsState() {
        // Arrange
        AverageTrueRange atr = new AverageTrueRange(1);
        atr.update(100);
        atr.update(101);

        // Act
        atr.reset();

        // Assert
        assertFalse(atr.isReady());
        assertEquals(0, atr.count());
        assertTrue(atr.update(50).isEmpty());
    }

    @Test
    void testInvalidInput_Throws() {
        assertThrows(IllegalArgumentException.class, () -> new AverageTrueRange(-1));
        assertThrows(IllegalArgumentException.class,
                () -> new AverageTrueRange(2).update(candle(Double.NaN, 1, 1), PriceType.CLOSE));
    }
}
