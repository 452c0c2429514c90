package com.triplebarrier.backtest.model;

import lombok.Value;

/**
 * Origin bar enriched with its regime tag and label, as handed to dataset assembly and the simulator.
 */
@Value
public class LabeledRow {

    PriceBar bar;
    RegimeTag regime;
    Label label;

    public String getSymbol() {
        return bar.getSymbol();
    }

    public long getTimestamp() {
        return bar.getTimestamp();
    }
}
