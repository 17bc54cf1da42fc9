package com.candlebacktest.backtester.domain;

import com.candlebacktest.backtester.exception.BacktestException;
import com.candlebacktest.backtester.exception.BacktestException.ErrorCode;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for CandleSeries validation.
 */
class CandleSeriesTest {

    @Test
    void testValidSeries() {
        CandleSeries series = TestCandles.series(1, 2, 3);

        assertEquals(3, series.size());
        assertEquals(1.0, series.first().getClose());
        assertEquals(3.0, series.last().getClose());
    }

    @Test
    void testEmptySeries_Invalid() {
        BacktestException e = assertThrows(BacktestException.class, () -> CandleSeries.of(List.of()));

        assertEquals(ErrorCode.INVALID_SERIES, e.getErrorCode());
        assertEquals(-1, e.getCandleIndex());
    }

    @Test
    void testNonMonotonicTimestamps_Invalid() {
        // Arrange
        List<Candle> candles = new ArrayList<>(TestCandles.fromCloses(1, 2, 3));
        candles.set(2, TestCandles.candle(0, 3));

        // Act
        BacktestException e = assertThrows(BacktestException.class, () -> CandleSeries.of(candles));

        // Assert
        assertEquals(ErrorCode.INVALID_SERIES, e.getErrorCode());
        assertEquals(2, e.getCandleIndex());
    }

    @Test
    void testExactDuplicate_Collapsed() {
        // Arrange
        List<Candle> candles = new ArrayList<>(TestCandles.fromCloses(1, 2));
        candles.add(TestCandles.candle(1, 2));

        // Act
        CandleSeries series = CandleSeries.of(candles);

        // Assert
        assertEquals(2, series.size());
    }

    @Test
    void testDuplicateTimestampWithDifferentPrices_Invalid() {
        List<Candle> candles = new ArrayList<>(TestCandles.fromCloses(1, 2));
        candles.add(TestCandles.candle(1, 5));

        BacktestException e = assertThrows(BacktestException.class, () -> CandleSeries.of(candles));
        assertEquals(ErrorCode.INVALID_SERIES, e.getErrorCode());
    }

    @Test
    void testLowAboveHigh_Invalid() {
        Candle broken = Candle.builder()
                .timestamp(TestCandles.START).open(10).high(9).low(11).close(10).volume(1)
                .build();

        assertThrows(BacktestException.class, () -> CandleSeries.of(List.of(broken)));
    }

    @Test
    void testNegativeVolume_Invalid() {
        assertThrows(BacktestException.class, () -> CandleSeries.of(List.of(TestCandles.candle(0, 10, -1))));
    }

    @Test
    void testBetween_FiltersInclusive() {
        // Arrange
        CandleSeries series = TestCandles.series(1, 2, 3, 4, 5);

        // Act
        CandleSeries window = series.between(TestCandles.START + TestCandles.DAY,
                TestCandles.START + 3 * TestCandles.DAY);

        // Assert
        assertEquals(3, window.size());
        assertEquals(2.0, window.first().getClose());
        assertEquals(4.0, window.last().getClose());
    }

    @Test
    void testBetween_NothingLeft_Invalid() {
        CandleSeries series = TestCandles.series(1, 2, 3);

        assertThrows(BacktestException.class, () -> series.between(TestCandles.START + 100 * TestCandles.DAY, null));
    }

    @Test
    void testHistory_IsPrefix() {
        CandleSeries series = TestCandles.series(1, 2, 3, 4);

        List<Candle> history = series.history(1);

        assertEquals(2, history.size());
        assertEquals(2.0, history.get(1).getClose());
    }
}
