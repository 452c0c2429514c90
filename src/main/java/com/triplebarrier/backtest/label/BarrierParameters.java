package com.triplebarrier.backtest.label;

import lombok.Value;

/**
 * Barrier multiples and horizon chosen for one origin bar
 */
@Value
public class BarrierParameters {
    double tpMultiple;
    double slMultiple;
    int horizon;
}
