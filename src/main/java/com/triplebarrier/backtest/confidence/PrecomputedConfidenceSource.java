package com.triplebarrier.backtest.confidence;

import com.triplebarrier.backtest.model.LabeledRow;

import java.util.HashMap;
import java.util.Map;

/**
 * Scores produced offline by the model collaborator, keyed by (symbol, timestamp).
 * Rows without a score get NaN.
 */
public class PrecomputedConfidenceSource implements ConfidenceSource {

    private final Map<String, Map<Long, Double>> scores = new HashMap<>();

    /**
     * Register a score; a later score for the same key replaces the earlier one
     * @param symbol trading symbol
     * @param timestamp bar timestamp in millis
     * @param confidence probability of a long win (stored unvalidated)
     */
    public void put(String symbol, long timestamp, double confidence) {
        scores.computeIfAbsent(symbol, k -> new HashMap<>()).put(timestamp, confidence);
    }

    public int size() {
        return scores.values().stream().mapToInt(Map::size).sum();
    }

    @Override
    public double confidenceFor(LabeledRow row) {
        Map<Long, Double> bySymbol = scores.get(row.getSymbol());
        if (bySymbol == null) {
            return Double.NaN;
        }
        Double score = bySymbol.get(row.getTimestamp());
        return score != null ? score : Double.NaN;
    }
}
