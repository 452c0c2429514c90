package com.triplebarrier.backtest.engine;

import com.triplebarrier.backtest.model.EquityCurve;
import com.triplebarrier.backtest.model.SkippedRow;
import com.triplebarrier.backtest.model.Trade;
import lombok.Value;

import java.util.List;

/**
 * Output of one simulation run
 */
@Value
public class SimulationResult {

    double threshold;

    /**
     * Trades in execution (timestamp) order
     */
    List<Trade> trades;

    EquityCurve equityCurve;

    List<SkippedRow> skippedRows;

    public SimulationResult(double threshold, List<Trade> trades, EquityCurve equityCurve, List<SkippedRow> skippedRows) {
        this.threshold = threshold;
        this.trades = List.copyOf(trades);
        this.equityCurve = equityCurve;
        this.skippedRows = List.copyOf(skippedRows);
    }
}
