package com.candlebacktest.backtester.exception;

/**
 * Fatal backtest failure.
 * Carries a structured error code plus the candle index and timestamp at which the
 * run stopped, so callers can report where a series or strategy went wrong.
 */
public class BacktestException extends RuntimeException {

    public enum ErrorCode {
        INVALID_SERIES,
        STRATEGY_INIT_ERROR,
        STRATEGY_EVALUATION_ERROR,
        INVALID_INPUT,
        INVARIANT_VIOLATION
    }

    private final ErrorCode errorCode;
    private final int candleIndex;
    private final Long timestamp;

    public BacktestException(ErrorCode errorCode, String message) {
        this(errorCode, message, -1, null, null);
    }

    public BacktestException(ErrorCode errorCode, String message, Throwable cause) {
        this(errorCode, message, -1, null, cause);
    }

    public BacktestException(ErrorCode errorCode, String message, int candleIndex, Long timestamp) {
        this(errorCode, message, candleIndex, timestamp, null);
    }

    public BacktestException(ErrorCode errorCode, String message, int candleIndex, Long timestamp,
                             Throwable cause) {
        super(describe(message, candleIndex, timestamp), cause);
        this.errorCode = errorCode;
        this.candleIndex = candleIndex;
        this.timestamp = timestamp;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * Index of the candle being processed, or -1 when the failure happened before the loop.
     */
    public int getCandleIndex() {
        return candleIndex;
    }

    public Long getTimestamp() {
        return timestamp;
    }

    private static String describe(String message, int candleIndex, Long timestamp) {
        if (candleIndex < 0) {
            return message;
        }
        return message + " (candle " + candleIndex + ", timestamp " + timestamp + ")";
    }
}
