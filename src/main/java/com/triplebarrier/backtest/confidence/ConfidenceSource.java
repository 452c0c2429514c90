package com.triplebarrier.backtest.confidence;

import com.triplebarrier.backtest.model.LabeledRow;

/**
 * Supplies the probability of a long win for a labeled row.
 * Returning NaN means "no score"; the simulator skips such rows with a recorded reason.
 */
@FunctionalInterface
public interface ConfidenceSource {

    double confidenceFor(LabeledRow row);
}
