package com.triplebarrier.backtest.optimizer;

import com.triplebarrier.backtest.engine.SimulationResult;
import com.triplebarrier.backtest.model.BacktestReport;
import lombok.Value;

/**
 * One row of the threshold sweep
 */
@Value
public class ThresholdResult {
    double threshold;
    BacktestReport report;
    transient SimulationResult simulation;
}
