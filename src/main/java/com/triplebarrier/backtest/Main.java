package com.triplebarrier.backtest;

import com.triplebarrier.backtest.confidence.ConfidenceScorer;
import com.triplebarrier.backtest.confidence.PrecomputedConfidenceSource;
import com.triplebarrier.backtest.config.Config;
import com.triplebarrier.backtest.engine.SimulationResult;
import com.triplebarrier.backtest.engine.TradeSimulator;
import com.triplebarrier.backtest.metrics.MetricsCalculator;
import com.triplebarrier.backtest.model.BacktestReport;
import com.triplebarrier.backtest.model.LabeledRow;
import com.triplebarrier.backtest.model.PriceBar;
import com.triplebarrier.backtest.model.ScoredRow;
import com.triplebarrier.backtest.optimizer.OptimizationResult;
import com.triplebarrier.backtest.optimizer.ThresholdOptimizer;
import com.triplebarrier.backtest.optimizer.ThresholdResult;
import com.triplebarrier.backtest.pipeline.LabelStatistics;
import com.triplebarrier.backtest.pipeline.LabelingPipeline;
import com.triplebarrier.backtest.util.CsvBarLoader;
import com.triplebarrier.backtest.util.CsvConfidenceLoader;
import com.triplebarrier.backtest.util.CsvResultWriter;
import com.triplebarrier.backtest.util.JsonReportWriter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

/**
 * Main entry point: label the configured bar file, then backtest and sweep thresholds when a
 * confidence file is configured.
 */
@Slf4j
public class Main {

    public static void main(String[] args) {
        log.info("========================================");
        log.info("  TRIPLE BARRIER BACKTEST");
        log.info("========================================");

        try {
            Config config = Config.fromEnv();
            new Main().run(config);

            log.info("========================================");
            log.info("  ALL STAGES COMPLETED");
            log.info("========================================");
            log.info("Output directory: {}", config.getOutputDir());
        } catch (Exception e) {
            log.error("Fatal error in main execution", e);
            System.exit(1);
        }
    }

    /**
     * Run every stage for a config
     * @param config run configuration
     * @throws IOException if an input cannot be read or an output cannot be written
     */
    void run(Config config) throws IOException {
        Path outputDir = Paths.get(config.getOutputDir());
        CsvResultWriter csvWriter = new CsvResultWriter();

        Map<String, List<PriceBar>> bars = new CsvBarLoader().load(Paths.get(config.getBarsFile()));
        if (bars.isEmpty()) {
            log.error("No bars available to process");
            log.info("Expected header: symbol,timestamp,open,high,low,close,atr,adx,sma_fast,sma_slow,bb_width");
            return;
        }

        List<LabeledRow> rows = new LabelingPipeline(config).run(bars);
        LabelStatistics.of(rows).logDistribution();
        csvWriter.writeLabeledRows(rows, outputDir.resolve("labeled_rows.csv"));

        if (!config.hasConfidenceFile()) {
            log.info("No confidence file configured, skipping backtest");
            return;
        }

        PrecomputedConfidenceSource scores = new CsvConfidenceLoader().load(Paths.get(config.getConfidenceFile()));
        List<ScoredRow> scored = new ConfidenceScorer(scores).score(rows);

        SimulationResult simulation = new TradeSimulator(config).simulate(scored);
        BacktestReport report = new MetricsCalculator().calculate(simulation);
        printReport(report);

        csvWriter.writeTrades(simulation.getTrades(), outputDir.resolve("trades.csv"));
        csvWriter.writeEquityCurve(simulation.getEquityCurve().getSamples(), outputDir.resolve("equity_curve.csv"));
        csvWriter.writeSkippedRows(simulation.getSkippedRows(), outputDir.resolve("skipped_rows.csv"));
        JsonReportWriter jsonWriter = new JsonReportWriter();
        jsonWriter.writeReport(report, outputDir.resolve("report.json"));

        OptimizationResult optimization = new ThresholdOptimizer(config).optimize(scored);
        printSweep(optimization);
        csvWriter.writeSweep(optimization.getResults(), outputDir.resolve("threshold_sweep.csv"));
        jsonWriter.writeOptimization(optimization, outputDir.resolve("optimization.json"));
    }

    /**
     * Print backtest summary and per-symbol table
     */
    private static void printReport(BacktestReport report) {
        System.out.println("\n╔═══════════════════════════════════════════════════════════════════════════════╗");
        System.out.printf("║ BACKTEST RESULTS  (threshold %.2f)%-44s║%n", report.getThreshold(), "");
        System.out.println("╠═══════════════════════════════════════════════════════════════════════════════╣");
        if (report.isNoTrades()) {
            System.out.printf("║ %-77s ║%n", "No trades");
        } else {
            System.out.printf("║ Trades: %-6d Wins: %-6d Losses: %-6d Skipped: %-6d %23s║%n",
                report.getTradeCount(), report.getWinCount(), report.getLossCount(), report.getSkippedCount(), "");
            System.out.printf("║ Win rate: %-10s Profit factor: %-10s Avg R: %-10s %16s║%n",
                report.getWinRate(), report.getProfitFactor(), report.getAverageR(), "");
            System.out.printf("║ Max DD: %+8.2f%%  Sharpe: %-10s Return: %+8.2f%%  Final: %12.2f %5s║%n",
                report.getMaxDrawdown() * 100, report.getSharpe(), report.getTotalReturn() * 100,
                report.getFinalEquity(), "");
        }
        System.out.println("╠══════════╦═══════╦═══════════╦═══════════╦═══════════╦═══════════╦════════════╣");
        System.out.println("║  Symbol  ║ Trades║  Win rate ║  PF       ║  Avg R    ║  Max DD   ║   P&L      ║");
        System.out.println("╠══════════╬═══════╬═══════════╬═══════════╬═══════════╬═══════════╬════════════╣");
        for (Map.Entry<String, BacktestReport> entry : report.getPerSymbol().entrySet()) {
            BacktestReport r = entry.getValue();
            System.out.printf("║ %-8s ║ %5d ║ %9s ║ %9s ║ %9s ║ %8.2f%% ║ %10.2f ║%n",
                truncate(entry.getKey(), 8), r.getTradeCount(), r.getWinRate(), r.getProfitFactor(),
                r.getAverageR(), r.getMaxDrawdown() * 100, r.getTotalPnl());
        }
        System.out.println("╚══════════╩═══════╩═══════════╩═══════════╩═══════════╩═══════════╩════════════╝");
    }

    /**
     * Print threshold sweep table
     */
    private static void printSweep(OptimizationResult optimization) {
        System.out.println("\n╔═══════════╦═══════╦═══════════╦═══════════╦═══════════╦═══════════╦════════════╗");
        System.out.println("║ Threshold ║ Trades║  Win rate ║  PF       ║  Avg R    ║  Max DD   ║  Return    ║");
        System.out.println("╠═══════════╬═══════╬═══════════╬═══════════╬═══════════╬═══════════╬════════════╣");
        for (ThresholdResult result : optimization.getResults()) {
            BacktestReport r = result.getReport();
            if (r.isNoTrades()) {
                System.out.printf("║ %9.2f ║ %5s ║ %-63s ║%n", result.getThreshold(), "0", "no trades");
                continue;
            }
            System.out.printf("║ %9.2f ║ %5d ║ %9s ║ %9s ║ %9s ║ %8.2f%% ║ %+9.2f%% ║%n",
                result.getThreshold(), r.getTradeCount(), r.getWinRate(), r.getProfitFactor(),
                r.getAverageR(), r.getMaxDrawdown() * 100, r.getTotalReturn() * 100);
        }
        System.out.println("╚═══════════╩═══════╩═══════════╩═══════════╩═══════════╩═══════════╩════════════╝");
        System.out.println(optimization.getBestThreshold()
            .map(t -> String.format("Best threshold (%s): %.2f", optimization.getObjective(), t))
            .orElse("No threshold produced trades"));
    }

    /**
     * Truncate string to max length
     */
    private static String truncate(String str, int maxLen) {
        if (str.length() <= maxLen) return str;
        return str.substring(0, maxLen);
    }
}
