package com.triplebarrier.backtest.model;

import lombok.Value;

/**
 * Row the simulator refused to act on, with the reason
 */
@Value
public class SkippedRow {

    public enum Reason {
        CONFIDENCE_NOT_A_NUMBER,
        CONFIDENCE_OUT_OF_RANGE,
        NEUTRAL_EXCLUDED
    }

    String symbol;
    long timestamp;
    double confidence;
    Reason reason;
}
