package com.triplebarrier.backtest.util;

import com.triplebarrier.backtest.model.BacktestReport;
import com.triplebarrier.backtest.model.EquitySample;
import com.triplebarrier.backtest.model.Label;
import com.triplebarrier.backtest.model.LabeledRow;
import com.triplebarrier.backtest.model.Metric;
import com.triplebarrier.backtest.model.RegimeTag;
import com.triplebarrier.backtest.model.SkippedRow;
import com.triplebarrier.backtest.model.Trade;
import com.triplebarrier.backtest.optimizer.ThresholdResult;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import java.io.IOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes labeled rows, trade log, equity curve, skipped rows and sweep table as CSV
 */
@Slf4j
public class CsvResultWriter {

    static final String[] LABELED_ROW_HEADER = {
        "symbol", "timestamp", "origin_index", "close", "atr", "adx",
        "vol_ratio", "vol_regime", "trend_regime", "fast_slope", "slow_slope", "slope_sign",
        "bb_width_atr", "market_state", "consolidation_days",
        "label", "resolution", "tp_mult", "sl_mult", "horizon",
        "long_tp", "long_sl", "short_tp", "short_sl", "decided_at_index"
    };

    static final String[] TRADE_HEADER = {
        "id", "symbol", "timestamp", "direction", "confidence", "entry", "take_profit", "stop_loss",
        "label", "outcome", "r_multiple", "risk", "position_size", "pnl", "equity"
    };

    static final String[] EQUITY_HEADER = {"trade_id", "timestamp", "symbol", "equity"};

    static final String[] SKIPPED_HEADER = {"symbol", "timestamp", "confidence", "reason"};

    static final String[] SWEEP_HEADER = {
        "threshold", "no_trades", "trades", "wins", "losses", "win_rate", "profit_factor",
        "avg_win", "avg_loss", "avg_r", "max_drawdown", "sharpe", "total_return", "final_equity"
    };

    public Path writeLabeledRows(List<LabeledRow> rows, Path path) throws IOException {
        try (CSVPrinter printer = open(path, LABELED_ROW_HEADER)) {
            writeLabeledRows(rows, printer);
        }
        log.info("Wrote {} labeled rows to {}", rows.size(), path);
        return path;
    }

    public void writeLabeledRows(List<LabeledRow> rows, CSVPrinter printer) throws IOException {
        for (LabeledRow row : rows) {
            RegimeTag regime = row.getRegime();
            Label label = row.getLabel();
            printer.printRecord(
                row.getSymbol(),
                Timestamps.format(row.getTimestamp()),
                label.getOriginIndex(),
                row.getBar().getClose(),
                label.getAtr(),
                regime.getAdx(),
                regime.getVolRatio(),
                regime.getVolatilityClass(),
                regime.getTrendClass(),
                regime.getFastSlope(),
                regime.getSlowSlope(),
                regime.getSlopeSign(),
                regime.getBbWidthAtr(),
                regime.getMarketState(),
                regime.getConsolidationDays(),
                label.getOutcome().getValue(),
                label.getResolution(),
                label.getTpMultiple(),
                label.getSlMultiple(),
                label.getHorizon(),
                label.getLongTakeProfit(),
                label.getLongStopLoss(),
                label.getShortTakeProfit(),
                label.getShortStopLoss(),
                label.getDecidedAtIndex());
        }
    }

    public Path writeTrades(List<Trade> trades, Path path) throws IOException {
        try (CSVPrinter printer = open(path, TRADE_HEADER)) {
            for (Trade t : trades) {
                printer.printRecord(
                    t.getId(),
                    t.getSymbol(),
                    Timestamps.format(t.getTimestamp()),
                    t.getDirection(),
                    t.getConfidence(),
                    t.getEntryPrice(),
                    t.getTakeProfit(),
                    t.getStopLoss(),
                    t.getLabelOutcome().getValue(),
                    t.getResult(),
                    t.getRMultiple(),
                    t.getRiskAmount(),
                    t.getPositionSize(),
                    t.getPnl(),
                    t.getEquityAfter());
            }
        }
        log.info("Wrote {} trades to {}", trades.size(), path);
        return path;
    }

    public Path writeEquityCurve(List<EquitySample> samples, Path path) throws IOException {
        try (CSVPrinter printer = open(path, EQUITY_HEADER)) {
            for (EquitySample s : samples) {
                printer.printRecord(s.getTradeId(), Timestamps.format(s.getTimestamp()), s.getSymbol(), s.getEquity());
            }
        }
        return path;
    }

    public Path writeSkippedRows(List<SkippedRow> skipped, Path path) throws IOException {
        try (CSVPrinter printer = open(path, SKIPPED_HEADER)) {
            for (SkippedRow s : skipped) {
                printer.printRecord(s.getSymbol(), Timestamps.format(s.getTimestamp()), s.getConfidence(), s.getReason());
            }
        }
        return path;
    }

    public Path writeSweep(List<ThresholdResult> results, Path path) throws IOException {
        try (CSVPrinter printer = open(path, SWEEP_HEADER)) {
            for (ThresholdResult result : results) {
                BacktestReport r = result.getReport();
                printer.printRecord(
                    result.getThreshold(),
                    r.isNoTrades(),
                    r.getTradeCount(),
                    r.getWinCount(),
                    r.getLossCount(),
                    cell(r.getWinRate()),
                    cell(r.getProfitFactor()),
                    cell(r.getAverageWin()),
                    cell(r.getAverageLoss()),
                    cell(r.getAverageR()),
                    r.getMaxDrawdown(),
                    cell(r.getSharpe()),
                    r.getTotalReturn(),
                    r.getFinalEquity());
            }
        }
        log.info("Wrote threshold sweep ({} rows) to {}", results.size(), path);
        return path;
    }

    /**
     * Full-precision value, or the sentinel text for +inf and undefined metrics
     */
    private static Object cell(Metric metric) {
        return metric.isDefined() ? metric.getValue() : metric.toString();
    }

    private static CSVPrinter open(Path path, String[] header) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        Writer writer = Files.newBufferedWriter(path);
        return new CSVPrinter(writer, CSVFormat.DEFAULT.builder().setHeader(header).build());
    }
}
