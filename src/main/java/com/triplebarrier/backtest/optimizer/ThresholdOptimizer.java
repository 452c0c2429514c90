package com.triplebarrier.backtest.optimizer;

import com.triplebarrier.backtest.config.Config;
import com.triplebarrier.backtest.engine.SimulationResult;
import com.triplebarrier.backtest.engine.TradeSimulator;
import com.triplebarrier.backtest.metrics.MetricsCalculator;
import com.triplebarrier.backtest.model.BacktestReport;
import com.triplebarrier.backtest.model.Metric;
import com.triplebarrier.backtest.model.ScoredRow;
import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.stream.Collectors;

/**
 * Confidence threshold sweep.
 * Each candidate gets its own simulation and report; runs share no mutable state and may execute
 * in parallel. The best candidate maximises the objective, ties broken by trade count (descending),
 * then by the lower threshold.
 */
@Slf4j
public class ThresholdOptimizer {

    private final Config config;
    private final TradeSimulator simulator;
    private final MetricsCalculator metrics;

    public ThresholdOptimizer(Config config) {
        this.config = config;
        this.simulator = new TradeSimulator(config);
        this.metrics = new MetricsCalculator();
    }

    /**
     * Sweep the configured candidates with the configured objective
     * @param rows scored rows
     * @return sweep table and best threshold
     */
    public OptimizationResult optimize(List<ScoredRow> rows) {
        return optimize(rows, config.getCandidateThresholds(), config.getObjective());
    }

    /**
     * Sweep candidate thresholds
     * @param rows scored rows
     * @param candidates thresholds in the order the table should list them
     * @param objective ranking objective
     * @return sweep table and best threshold
     */
    public OptimizationResult optimize(List<ScoredRow> rows, List<Double> candidates, Config.Objective objective) {
        log.info("Sweeping {} thresholds over {} rows (objective: {})", candidates.size(), rows.size(), objective);

        List<ThresholdResult> results = runSweep(rows, candidates);

        for (ThresholdResult result : results) {
            BacktestReport report = result.getReport();
            if (report.isNoTrades()) {
                log.info("  threshold {}: no trades", result.getThreshold());
            } else {
                log.info("  threshold {}: {} trades, win rate {}, PF {}, avg R {}",
                    result.getThreshold(), report.getTradeCount(), report.getWinRate(),
                    report.getProfitFactor(), report.getAverageR());
            }
        }

        ThresholdResult best = results.stream()
            .filter(r -> !r.getReport().isNoTrades())
            .min(ranking(objective))
            .orElse(null);

        if (best != null) {
            log.info("Best threshold: {} ({} = {})", best.getThreshold(), objective,
                objectiveValue(best.getReport(), objective));
        } else {
            log.warn("No candidate threshold produced any trade");
        }

        return new OptimizationResult(objective, results, best);
    }

    private List<ThresholdResult> runSweep(List<ScoredRow> rows, List<Double> candidates) {
        int parallelism = Math.min(config.getParallelism(), candidates.size());
        if (parallelism <= 1) {
            return candidates.stream()
                .map(threshold -> evaluate(rows, threshold))
                .collect(Collectors.toList());
        }

        ForkJoinPool pool = new ForkJoinPool(parallelism);
        try {
            return pool.submit(() -> candidates.parallelStream()
                .map(threshold -> evaluate(rows, threshold))
                .collect(Collectors.toList())).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Threshold sweep interrupted", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Threshold sweep failed", e.getCause());
        } finally {
            pool.shutdown();
        }
    }

    private ThresholdResult evaluate(List<ScoredRow> rows, double threshold) {
        SimulationResult simulation = simulator.simulate(rows, threshold);
        return new ThresholdResult(threshold, metrics.calculate(simulation), simulation);
    }

    /**
     * Comparator placing the better result first
     */
    static Comparator<ThresholdResult> ranking(Config.Objective objective) {
        return Comparator
            .comparingDouble((ThresholdResult r) -> objectiveValue(r.getReport(), objective).rankValue()).reversed()
            .thenComparing(Comparator.comparingInt((ThresholdResult r) -> r.getReport().getTradeCount()).reversed())
            .thenComparingDouble(ThresholdResult::getThreshold);
    }

    static Metric objectiveValue(BacktestReport report, Config.Objective objective) {
        switch (objective) {
            case WIN_RATE:
                return report.getWinRate();
            case AVERAGE_R:
                return report.getAverageR();
            case TOTAL_RETURN:
                return Metric.of(report.getTotalReturn());
            case SHARPE:
                return report.getSharpe();
            case PROFIT_FACTOR:
            default:
                return report.getProfitFactor();
        }
    }
}
