package com.candlebacktest.backtester.domain;

import java.util.ArrayList;
import java.util.List;

/**
 * Calculator for backtest performance metrics.
 */
public final class PerformanceMetrics {

    private PerformanceMetrics() {
    }

    /**
     * Return on investment as a fraction of the initial balance.
     */
    public static double calculateRoi(double initialBalance, double finalEquity) {
        if (initialBalance == 0) {
            return 0;
        }
        return (finalEquity - initialBalance) / initialBalance;
    }

    /**
     * Largest peak-to-trough decline as a positive fraction.
     * The running peak starts at the initial balance.
     */
    public static double calculateMaxDrawdown(double initialBalance, List<EquitySample> equityCurve) {
        double peak = initialBalance;
        double maxDrawdown = 0;

        for (EquitySample sample : equityCurve) {
            double equity = sample.getEquity();
            if (equity > peak) {
                peak = equity;
            }
            if (peak > 0) {
                double drawdown = (peak - equity) / peak;
                if (drawdown > maxDrawdown) {
                    maxDrawdown = drawdown;
                }
            }
        }
        return maxDrawdown;
    }

    /**
     * Fraction of sell trades with a positive realized P&L, 0 when nothing was sold.
     */
    public static double calculateWinRate(List<Trade> trades) {
        int sells = 0;
        int winners = 0;
        for (Trade trade : trades) {
            if (trade.isSell()) {
                sells++;
                if (trade.getRealizedPnl() > 0) {
                    winners++;
                }
            }
        }
        return sells == 0 ? 0 : (double) winners / sells;
    }

    /**
     * Gross profit divided by the absolute gross loss of sell trades.
     * Positive infinity when there are profits but no losses, 0 when there are no profits.
     */
    public static double calculateProfitFactor(List<Trade> trades) {
        double grossProfit = 0;
        double grossLoss = 0;
        for (Trade trade : trades) {
            if (!trade.isSell()) {
                continue;
            }
            double pnl = trade.getRealizedPnl();
            if (pnl > 0) {
                grossProfit += pnl;
            } else if (pnl < 0) {
                grossLoss += -pnl;
            }
        }
        if (grossProfit == 0) {
            return 0;
        }
        if (grossLoss == 0) {
            return Double.POSITIVE_INFINITY;
        }
        return grossProfit / grossLoss;
    }

    /**
     * Per-sample returns of the equity curve. Pairs whose previous equity is not positive are skipped.
     */
    public static List<Double> calculateReturns(List<EquitySample> equityCurve) {
        List<Double> returns = new ArrayList<>();
        for (int i = 1; i < equityCurve.size(); i++) {
            double previous = equityCurve.get(i - 1).getEquity();
            double current = equityCurve.get(i).getEquity();
            if (previous > 0) {
                returns.add((current - previous) / previous);
            }
        }
        return returns;
    }

    /**
     * Mean over population standard deviation of returns, scaled by the square root of
     * the annualization factor. 0 with fewer than two returns or no variance.
     */
    public static double calculateSharpeRatio(List<Double> returns, double annualizationFactor) {
        if (returns.size() < 2) {
            return 0;
        }
        double mean = mean(returns);
        double stdDev = Math.sqrt(variance(returns, mean));
        if (stdDev == 0) {
            return 0;
        }
        return mean / stdDev * Math.sqrt(annualizationFactor);
    }

    /**
     * Like the Sharpe ratio but only penalizing negative returns.
     * 0 with fewer than two returns or no downside.
     */
    public static double calculateSortinoRatio(List<Double> returns, double annualizationFactor) {
        if (returns.size() < 2) {
            return 0;
        }
        double mean = mean(returns);
        double downsideSquares = 0;
        for (double r : returns) {
            if (r < 0) {
                downsideSquares += r * r;
            }
        }
        double downsideDeviation = Math.sqrt(downsideSquares / returns.size());
        if (downsideDeviation == 0) {
            return 0;
        }
        return mean / downsideDeviation * Math.sqrt(annualizationFactor);
    }

    /**
     * Annualized population standard deviation of returns.
     */
    public static double calculateVolatility(List<Double> returns, double annualizationFactor) {
        if (returns.size() < 2) {
            return 0;
        }
        return Math.sqrt(variance(returns, mean(returns))) * Math.sqrt(annualizationFactor);
    }

    /**
     * Return over maximum drawdown, 0 when there was no drawdown.
     */
    public static double calculateCalmarRatio(double roi, double maxDrawdown) {
        if (maxDrawdown <= 0) {
            return 0;
        }
        return roi / maxDrawdown;
    }

    private static double mean(List<Double> values) {
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.size();
    }

    private static double variance(List<Double> values, double mean) {
        double sumSquaredDiff = 0;
        for (double v : values) {
            double diff = v - mean;
            sumSquaredDiff += diff * diff;
        }
        return sumSquaredDiff / values.size();
    }
}
