package com.triplebarrier.backtest.metrics;

import com.triplebarrier.backtest.engine.SimulationResult;
import com.triplebarrier.backtest.model.BacktestReport;
import com.triplebarrier.backtest.model.EquityCurve;
import com.triplebarrier.backtest.model.EquitySample;
import com.triplebarrier.backtest.model.Metric;
import com.triplebarrier.backtest.model.Trade;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reduces a trade log and equity curve to a {@link BacktestReport}.
 * Ratios that would divide by zero come back as explicit sentinels.
 */
public class MetricsCalculator {

    private static final double ZERO_VARIANCE = 1e-12;

    /**
     * Report for a simulation run, including the per-symbol breakdown
     * @param result simulation output
     * @return report
     */
    public BacktestReport calculate(SimulationResult result) {
        BacktestReport overall = summarize(result.getTrades(), result.getEquityCurve(), result.getThreshold())
            .toBuilder()
            .skippedCount(result.getSkippedRows().size())
            .build();

        Map<String, List<Trade>> bySymbol = new TreeMap<>();
        for (Trade trade : result.getTrades()) {
            bySymbol.computeIfAbsent(trade.getSymbol(), k -> new ArrayList<>()).add(trade);
        }

        Map<String, BacktestReport> perSymbol = new LinkedHashMap<>();
        for (Map.Entry<String, List<Trade>> entry : bySymbol.entrySet()) {
            EquityCurve symbolCurve = replay(entry.getValue(), result.getEquityCurve().getInitialEquity());
            perSymbol.put(entry.getKey(), summarize(entry.getValue(), symbolCurve, result.getThreshold()));
        }

        return overall.toBuilder()
            .perSymbol(Collections.unmodifiableMap(perSymbol))
            .build();
    }

    /**
     * Scalar metrics of a trade subset
     * @param trades trades in execution order
     * @param curve equity path of those trades
     * @param threshold threshold the trades were taken at
     * @return report without per-symbol breakdown
     */
    public BacktestReport summarize(List<Trade> trades, EquityCurve curve, double threshold) {
        int total = trades.size();
        int wins = (int) trades.stream().filter(Trade::isWinner).count();
        double initial = curve.getInitialEquity();
        double finalEquity = curve.getFinalEquity();
        double totalPnl = trades.stream().mapToDouble(Trade::getPnl).sum();

        return BacktestReport.builder()
            .threshold(threshold)
            .noTrades(total == 0)
            .tradeCount(total)
            .winCount(wins)
            .lossCount(total - wins)
            .winRate(winRate(trades))
            .profitFactor(profitFactor(trades))
            .averageWin(average(trades, true))
            .averageLoss(average(trades, false))
            .averageR(averageR(trades))
            .maxDrawdown(maxDrawdown(curve))
            .sharpe(sharpe(trades))
            .initialEquity(initial)
            .finalEquity(finalEquity)
            .totalPnl(totalPnl)
            .totalReturn((finalEquity - initial) / initial)
            .build();
    }

    /**
     * Get win rate (wins / trades)
     * @return win rate, 0 when there are no trades (the report flags that case)
     */
    public static Metric winRate(List<Trade> trades) {
        if (trades.isEmpty()) return Metric.of(0.0);
        long wins = trades.stream().filter(Trade::isWinner).count();
        return Metric.of((double) wins / trades.size());
    }

    /**
     * Get profit factor (gross winning R / gross losing R)
     * @return profit factor; +inf when nothing was lost, undefined when there are no trades
     */
    public static Metric profitFactor(List<Trade> trades) {
        if (trades.isEmpty()) return Metric.undefined("no trades");

        double grossProfit = trades.stream()
            .mapToDouble(Trade::getRMultiple)
            .filter(r -> r > 0)
            .sum();

        double grossLoss = Math.abs(trades.stream()
            .mapToDouble(Trade::getRMultiple)
            .filter(r -> r < 0)
            .sum());

        if (grossLoss == 0) {
            return grossProfit > 0 ? Metric.infinite() : Metric.undefined("no profit and no loss");
        }
        return Metric.of(grossProfit / grossLoss);
    }

    /**
     * Get average winning P&amp;L, or average absolute losing P&amp;L
     * @param winners true for winners, false for losers
     * @return average, undefined when the subset is empty
     */
    public static Metric average(List<Trade> trades, boolean winners) {
        double[] pnl = trades.stream()
            .filter(t -> t.isWinner() == winners)
            .mapToDouble(t -> Math.abs(t.getPnl()))
            .toArray();
        if (pnl.length == 0) {
            return Metric.undefined(winners ? "no winning trades" : "no losing trades");
        }
        double sum = 0;
        for (double p : pnl) sum += p;
        return Metric.of(sum / pnl.length);
    }

    /**
     * Get mean R-multiple
     * @return average R, undefined when there are no trades
     */
    public static Metric averageR(List<Trade> trades) {
        if (trades.isEmpty()) return Metric.undefined("no trades");
        return Metric.of(trades.stream().mapToDouble(Trade::getRMultiple).average().orElse(0.0));
    }

    /**
     * Get maximum drawdown as (trough - peak) / peak, tracked with a running peak seeded by the
     * initial equity
     * @return max drawdown, 0 on a non-decreasing curve, never positive
     */
    public static double maxDrawdown(EquityCurve curve) {
        double peak = curve.getInitialEquity();
        double maxDD = 0;

        for (EquitySample sample : curve.getSamples()) {
            double equity = sample.getEquity();
            if (equity > peak) {
                peak = equity;
            }
            double dd = (equity - peak) / peak;
            if (dd < maxDD) {
                maxDD = dd;
            }
        }

        return maxDD;
    }

    /**
     * Get Sharpe-like ratio: mean(R) / sample stdev(R)
     * @return ratio, undefined with fewer than 2 trades or zero variance
     */
    public static Metric sharpe(List<Trade> trades) {
        if (trades.size() < 2) return Metric.undefined("fewer than 2 trades");

        double[] returns = trades.stream()
            .mapToDouble(Trade::getRMultiple)
            .toArray();

        double mean = 0;
        for (double r : returns) mean += r;
        mean /= returns.length;

        double variance = 0;
        for (double r : returns) {
            variance += Math.pow(r - mean, 2);
        }
        variance /= returns.length - 1;

        double stdDev = Math.sqrt(variance);
        if (stdDev < ZERO_VARIANCE) return Metric.undefined("zero variance");

        return Metric.of(mean / stdDev);
    }

    /**
     * Equity path of a trade subset on its own, starting from the initial equity
     */
    private static EquityCurve replay(List<Trade> trades, double initialEquity) {
        List<EquitySample> samples = new ArrayList<>(trades.size());
        double equity = initialEquity;
        for (Trade trade : trades) {
            equity += trade.getPnl();
            samples.add(new EquitySample(trade.getId(), trade.getTimestamp(), trade.getSymbol(), equity));
        }
        return new EquityCurve(initialEquity, samples);
    }
}
