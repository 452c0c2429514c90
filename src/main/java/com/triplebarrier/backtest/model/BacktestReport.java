package com.triplebarrier.backtest.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Summary of one simulation run (or of one symbol's slice of it).
 */
@Value
@Builder(toBuilder = true)
public class BacktestReport {

    /**
     * Confidence threshold the run used
     */
    double threshold;

    /**
     * True when the run opened no trade; ratio metrics are then undefined
     */
    boolean noTrades;

    int tradeCount;

    int winCount;

    int lossCount;

    /**
     * Rows rejected with a recorded skip reason
     */
    int skippedCount;

    Metric winRate;

    /**
     * Gross winning R / gross losing R
     */
    Metric profitFactor;

    /**
     * Mean P&L of winning trades
     */
    Metric averageWin;

    /**
     * Mean absolute P&L of losing trades
     */
    Metric averageLoss;

    Metric averageR;

    /**
     * Deepest (trough - peak) / peak seen on the equity path, always <= 0
     */
    double maxDrawdown;

    /**
     * mean(R) / stdev(R)
     */
    Metric sharpe;

    double initialEquity;

    double finalEquity;

    double totalPnl;

    /**
     * (final - initial) / initial
     */
    double totalReturn;

    /**
     * Per-symbol reports, sorted by symbol; empty on per-symbol reports themselves
     */
    @Builder.Default
    Map<String, BacktestReport> perSymbol = Map.of();
}
