package com.candlebacktest.backtester.cli;

/**
 * Command-line entry point. Runs one backtest without starting the Spring context.
 *
 * <pre>
 * backtest --data candles.csv --strategy sma_rsi [--initial-balance 10000] [--commission-rate 0.001]
 *          [--slippage-rate 0] [--strict] [--seed 42] [--start 2024-01-01] [--end 2024-12-31]
 *          [--output result.json]
 * </pre>
 */
public final class BacktestCli {

    private BacktestCli() {
    }

    public static void main(String[] args) {
        // logs go to stderr so stdout carries only the JSON result
        if (System.getProperty("logback.configurationFile") == null) {
            System.setProperty("logback.configurationFile", "logback-cli.xml");
        }
        System.exit(new BacktestCommand().run(args, System.out, System.err));
    }
}
