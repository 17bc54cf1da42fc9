package com.candlebacktest.backtester.domain;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Candle fixtures for tests.
 */
public final class TestCandles {

    public static final long START = 1_704_067_200_000L;
    public static final long DAY = 86_400_000L;

    private TestCandles() {
    }

    public static Candle candle(int index, double close) {
        return candle(index, close, 1000);
    }

    public static Candle candle(int index, double close, double volume) {
        return Candle.builder()
                .timestamp(START + index * DAY)
                .open(close)
                .high(close)
                .low(close)
                .close(close)
                .volume(volume)
                .build();
    }

    public static List<Candle> fromCloses(double... closes) {
        List<Candle> candles = new ArrayList<>();
        for (int i = 0; i < closes.length; i++) {
            candles.add(candle(i, closes[i]));
        }
        return candles;
    }

    public static CandleSeries series(double... closes) {
        return CandleSeries.of(fromCloses(closes));
    }

    public static CandleSeries flat(int size, double price) {
        double[] closes = new double[size];
        Arrays.fill(closes, price);
        return series(closes);
    }
}
