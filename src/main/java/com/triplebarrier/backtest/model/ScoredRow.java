package com.triplebarrier.backtest.model;

import lombok.Value;

/**
 * Labeled row paired with the externally supplied probability of a long win.
 * The confidence is carried as-is; validation happens in the simulator.
 */
@Value
public class ScoredRow {

    LabeledRow row;
    double confidence;

    public String getSymbol() {
        return row.getSymbol();
    }

    public long getTimestamp() {
        return row.getTimestamp();
    }

    public Label getLabel() {
        return row.getLabel();
    }
}
