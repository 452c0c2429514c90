package com.triplebarrier.backtest.model;

import lombok.Value;

import java.util.List;

/**
 * Ordered equity samples of the single shared account, starting from the initial equity.
 */
@Value
public class EquityCurve {

    double initialEquity;

    List<EquitySample> samples;

    public EquityCurve(double initialEquity, List<EquitySample> samples) {
        this.initialEquity = initialEquity;
        this.samples = List.copyOf(samples);
    }

    /**
     * Get equity after the last trade
     * @return final equity, or initial equity when no trade was taken
     */
    public double getFinalEquity() {
        return samples.isEmpty() ? initialEquity : samples.get(samples.size() - 1).getEquity();
    }

    public boolean isEmpty() {
        return samples.isEmpty();
    }
}
