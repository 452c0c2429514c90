package com.triplebarrier.backtest.optimizer;

import com.triplebarrier.backtest.config.Config;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Threshold sweep table, in candidate order, plus the best candidate
 */
@Value
public class OptimizationResult {

    Config.Objective objective;

    List<ThresholdResult> results;

    /**
     * Best row, or null when every candidate produced no trades
     */
    ThresholdResult best;

    public Optional<ThresholdResult> getBestResult() {
        return Optional.ofNullable(best);
    }

    public Optional<Double> getBestThreshold() {
        return getBestResult().map(ThresholdResult::getThreshold);
    }
}
