package com.candlebacktest.backtester.domain.indicator;

import com.candlebacktest.backtester.domain.Candle;
import com.candlebacktest.backtester.domain.CandleSeries;
import com.candlebacktest.backtester.exception.BacktestException;
import com.candlebacktest.backtester.exception.BacktestException.ErrorCode;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Owns every indicator of one backtest run and advances them one candle at a time.
 *
 * <p>Indicators can be registered up front or requested lazily by a strategy; a lazily
 * requested indicator is caught up by replaying the candles seen so far. Strategies only
 * ever see the {@link #facade()}, which cannot advance the engine and never exposes a
 * candle past the current one.
 */
@Slf4j
public class IndicatorEngine {

    private final CandleSeries series;
    private final Map<IndicatorKey, Tracked> tracked = new LinkedHashMap<>();
    private final IndicatorFacade facade = new Facade();
    private int currentIndex = -1;

    public IndicatorEngine(CandleSeries series) {
        this.series = series;
    }

    /**
     * Track an indicator from the next update on (or caught up, if the run already started).
     */
    public void register(IndicatorKey key) {
        track(key);
    }

    public Set<IndicatorKey> registered() {
        return Collections.unmodifiableSet(tracked.keySet());
    }

    /**
     * Advance every tracked indicator with the candle at {@code index}.
     *
     * @throws BacktestException with {@link ErrorCode#INVALID_INPUT} if the candle carries
     *                           a non-finite price or volume
     */
    public void update(int index) {
        if (index != currentIndex + 1) {
            throw new IllegalStateException("Candles must be fed in order: expected index "
                    + (currentIndex + 1) + " but got " + index);
        }
        Candle candle = series.get(index);
        requireFiniteValues(index, candle);
        currentIndex = index;

        for (Tracked indicator : tracked.values()) {
            indicator.advance(index, candle);
        }
    }

    public int currentIndex() {
        return currentIndex;
    }

    /**
     * Current reading of a tracked indicator.
     */
    public OptionalDouble value(IndicatorKey key) {
        return track(key).current;
    }

    public OptionalDouble previousValue(IndicatorKey key) {
        return track(key).previous;
    }

    /**
     * Current band reading of a tracked Bollinger Bands series.
     */
    public Optional<BollingerBands.Bands> bands(IndicatorKey key) {
        if (key.getType() != IndicatorType.BOLLINGER) {
            throw new IllegalArgumentException("Bands are only available for Bollinger keys, got " + key);
        }
        return ((BollingerBands) track(key).indicator).bands();
    }

    public IndicatorFacade facade() {
        return facade;
    }

    private Tracked track(IndicatorKey key) {
        Tracked existing = tracked.get(key);
        if (existing != null) {
            return existing;
        }

        Tracked created = new Tracked(key.createIndicator(), key.getPriceType());
        for (int i = 0; i <= currentIndex; i++) {
            created.advance(i, series.get(i));
        }
        tracked.put(key, created);
        log.debug("Tracking {} from candle {}", key, Math.max(currentIndex, 0));
        return created;
    }

    private static void requireFiniteValues(int index, Candle candle) {
        if (!Double.isFinite(candle.getOpen()) || !Double.isFinite(candle.getHigh())
                || !Double.isFinite(candle.getLow()) || !Double.isFinite(candle.getClose())) {
            throw new BacktestException(ErrorCode.INVALID_INPUT,
                    "Candle contains a non-numeric price", index, candle.getTimestamp());
        }
        if (!Double.isFinite(candle.getVolume())) {
            throw new BacktestException(ErrorCode.INVALID_INPUT,
                    "Candle contains a non-numeric volume", index, candle.getTimestamp());
        }
    }

    private Candle current() {
        if (currentIndex < 0) {
            throw new IllegalStateException("No candle has been processed yet");
        }
        return series.get(currentIndex);
    }

    private static final class Tracked {
        private final Indicator indicator;
        private final PriceType priceType;
        private OptionalDouble previous = OptionalDouble.empty();
        private OptionalDouble current = OptionalDouble.empty();

        private Tracked(Indicator indicator, PriceType priceType) {
            this.indicator = indicator;
            this.priceType = priceType;
        }

        private void advance(int index, Candle candle) {
            previous = current;
            try {
                current = indicator.update(candle, priceType);
            } catch (IllegalArgumentException e) {
                throw new BacktestException(ErrorCode.INVALID_INPUT, e.getMessage(),
                        index, candle.getTimestamp(), e);
            }
        }
    }

    private final class Facade implements IndicatorFacade {

        @Override
        public Candle currentCandle() {
            return current();
        }

        @Override
        public List<Candle> history() {
            return series.history(currentIndex);
        }

        @Override
        public List<Candle> history(int count) {
            List<Candle> all = history();
            int from = Math.max(0, all.size() - Math.max(count, 0));
            return all.subList(from, all.size());
        }

        @Override
        public List<Double> closes(int count) {
            List<Double> closes = new ArrayList<>();
            for (Candle candle : history(count)) {
                closes.add(candle.getClose());
            }
            return closes;
        }

        @Override
        public List<Double> volumes(int count) {
            List<Double> volumes = new ArrayList<>();
            for (Candle candle : history(count)) {
                volumes.add(candle.getVolume());
            }
            return volumes;
        }

        @Override
        public OptionalDouble sma(int period) {
            return value(IndicatorKey.sma(period));
        }

        @Override
        public OptionalDouble sma(int period, PriceType priceType) {
            return value(new IndicatorKey(IndicatorType.SMA, period, priceType));
        }

        @Override
        public OptionalDouble ema(int period) {
            return value(IndicatorKey.ema(period));
        }

        @Override
        public OptionalDouble ema(int period, PriceType priceType) {
            return value(new IndicatorKey(IndicatorType.EMA, period, priceType));
        }

        @Override
        public OptionalDouble dema(int period) {
            return value(IndicatorKey.dema(period));
        }

        @Override
        public OptionalDouble rsi(int period) {
            return value(IndicatorKey.rsi(period));
        }

        @Override
        public OptionalDouble atr(int period) {
            return value(IndicatorKey.atr(period));
        }

        @Override
        public Optional<BollingerBands.Bands> bollingerBands(int period, double multiplier) {
            return bands(IndicatorKey.bollinger(period, multiplier));
        }

        @Override
        public OptionalDouble indicator(IndicatorKey key) {
            return value(key);
        }

        @Override
        public OptionalDouble previous(IndicatorKey key) {
            return previousValue(key);
        }

        @Override
        public boolean isBullishCrossover(IndicatorType type, int fastPeriod, int slowPeriod) {
            Tracked fast = track(IndicatorKey.of(type, fastPeriod));
            Tracked slow = track(IndicatorKey.of(type, slowPeriod));
            return Crossovers.isBullish(fast.previous, slow.previous, fast.current, slow.current);
        }

        @Override
        public boolean isBearishCrossover(IndicatorType type, int fastPeriod, int slowPeriod) {
            Tracked fast = track(IndicatorKey.of(type, fastPeriod));
            Tracked slow = track(IndicatorKey.of(type, slowPeriod));
            return Crossovers.isBearish(fast.previous, slow.previous, fast.current, slow.current);
        }

        @Override
        public boolean isPriceAboveMa(IndicatorType type, int period) {
            OptionalDouble ma = value(IndicatorKey.of(type, period));
            return ma.isPresent() && current().getClose() > ma.getAsDouble();
        }

        @Override
        public boolean isPriceBelowMa(IndicatorType type, int period) {
            OptionalDouble ma = value(IndicatorKey.of(type, period));
            return ma.isPresent() && current().getClose() < ma.getAsDouble();
        }

        @Override
        public boolean isOversold(int period, double threshold) {
            OptionalDouble rsi = rsi(period);
            return rsi.isPresent() && rsi.getAsDouble() < threshold;
        }

        @Override
        public boolean isOverbought(int period, double threshold) {
            OptionalDouble rsi = rsi(period);
            return rsi.isPresent() && rsi.getAsDouble() > threshold;
        }

        @Override
        public OptionalDouble percentageChange() {
            if (currentIndex < 1) {
                return OptionalDouble.empty();
            }
            double previous = series.get(currentIndex - 1).getClose();
            if (previous == 0) {
                return OptionalDouble.empty();
            }
            return OptionalDouble.of((current().getClose() - previous) / previous * 100);
        }

        @Override
        public OptionalDouble priceChange(int periods) {
            if (periods <= 0 || currentIndex < periods) {
                return OptionalDouble.empty();
            }
            return OptionalDouble.of(current().getClose() - series.get(currentIndex - periods).getClose());
        }
    }
}
