package com.candlebacktest.backtester.domain;

import com.candlebacktest.backtester.exception.BacktestException;
import com.candlebacktest.backtester.exception.BacktestException.ErrorCode;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Immutable, validated and chronologically ordered sequence of candles.
 * Shared input of one backtest run.
 */
@Slf4j
public final class CandleSeries implements Iterable<Candle> {

    private final List<Candle> candles;

    private CandleSeries(List<Candle> candles) {
        this.candles = Collections.unmodifiableList(candles);
    }

    /**
     * Validate and wrap a list of candles.
     * Exact duplicates are collapsed; a repeated timestamp with different prices is invalid.
     *
     * @throws BacktestException with {@link ErrorCode#INVALID_SERIES} on malformed input
     */
    public static CandleSeries of(List<Candle> candles) {
        if (candles == null || candles.isEmpty()) {
            throw new BacktestException(ErrorCode.INVALID_SERIES, "Candle series is empty");
        }

        List<Candle> accepted = new ArrayList<>(candles.size());
        for (int i = 0; i < candles.size(); i++) {
            Candle candle = candles.get(i);
            if (candle == null) {
                throw new BacktestException(ErrorCode.INVALID_SERIES, "Candle is null", i, null);
            }
            validateShape(candle, i);

            if (!accepted.isEmpty()) {
                Candle previous = accepted.get(accepted.size() - 1);
                if (candle.getTimestamp() < previous.getTimestamp()) {
                    throw new BacktestException(ErrorCode.INVALID_SERIES,
                            "Timestamps are not monotonic: " + candle.getTimestamp()
                                    + " follows " + previous.getTimestamp(),
                            i, candle.getTimestamp());
                }
                if (candle.getTimestamp() == previous.getTimestamp()) {
                    if (!candle.samePrices(previous)) {
                        throw new BacktestException(ErrorCode.INVALID_SERIES,
                                "Duplicate timestamp with differing prices", i, candle.getTimestamp());
                    }
                    log.debug("Dropping duplicate candle at index {} (timestamp {})", i, candle.getTimestamp());
                    continue;
                }
            }
            accepted.add(candle);
        }

        return new CandleSeries(accepted);
    }

    // NaN prices are not rejected here, the indicator engine reports them as invalid input
    private static void validateShape(Candle candle, int index) {
        double low = candle.getLow();
        double high = candle.getHigh();
        if (low > high || low > candle.getOpen() || low > candle.getClose()
                || high < candle.getOpen() || high < candle.getClose()) {
            throw new BacktestException(ErrorCode.INVALID_SERIES,
                    "Candle violates low <= open, close <= high", index, candle.getTimestamp());
        }
        if (candle.getVolume() < 0) {
            throw new BacktestException(ErrorCode.INVALID_SERIES,
                    "Candle volume is negative", index, candle.getTimestamp());
        }
    }

    public int size() {
        return candles.size();
    }

    public Candle get(int index) {
        return candles.get(index);
    }

    public Candle first() {
        return candles.get(0);
    }

    public Candle last() {
        return candles.get(candles.size() - 1);
    }

    /**
     * Read-only view of the candles up to and including {@code index}.
     */
    public List<Candle> history(int index) {
        return candles.subList(0, index + 1);
    }

    public List<Candle> asList() {
        return candles;
    }

    /**
     * Candles whose timestamps fall inside {@code [fromInclusive, toInclusive]}.
     * A {@code null} bound is open.
     *
     * @throws BacktestException with {@link ErrorCode#INVALID_SERIES} if nothing remains
     */
    public CandleSeries between(Long fromInclusive, Long toInclusive) {
        if (fromInclusive == null && toInclusive == null) {
            return this;
        }
        List<Candle> filtered = new ArrayList<>();
        for (Candle candle : candles) {
            if (fromInclusive != null && candle.getTimestamp() < fromInclusive) {
                continue;
            }
            if (toInclusive != null && candle.getTimestamp() > toInclusive) {
                continue;
            }
            filtered.add(candle);
        }
        if (filtered.isEmpty()) {
            throw new BacktestException(ErrorCode.INVALID_SERIES, "No candles in specified date range");
        }
        return new CandleSeries(filtered);
    }

    @Override
    public Iterator<Candle> iterator() {
        return candles.iterator();
    }
}
