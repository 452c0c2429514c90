package com.triplebarrier.backtest.confidence;

import com.triplebarrier.backtest.model.LabeledRow;
import com.triplebarrier.backtest.model.ScoredRow;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Pairs labeled rows with their confidence
 */
@Slf4j
public class ConfidenceScorer {

    private final ConfidenceSource source;

    public ConfidenceScorer(ConfidenceSource source) {
        this.source = source;
    }

    /**
     * Score rows, keeping their order
     * @param rows labeled rows
     * @return scored rows, one per input row
     */
    public List<ScoredRow> score(List<LabeledRow> rows) {
        List<ScoredRow> scored = new ArrayList<>(rows.size());
        int missing = 0;
        for (LabeledRow row : rows) {
            double confidence = source.confidenceFor(row);
            if (Double.isNaN(confidence)) {
                missing++;
            }
            scored.add(new ScoredRow(row, confidence));
        }
        if (missing > 0) {
            log.warn("{} of {} rows have no confidence score", missing, rows.size());
        }
        return scored;
    }
}
