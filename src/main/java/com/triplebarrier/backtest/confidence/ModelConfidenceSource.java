package com.triplebarrier.backtest.confidence;

import com.triplebarrier.backtest.model.LabeledRow;

/**
 * Scores rows by feeding their feature vector to an injected model
 */
public class ModelConfidenceSource implements ConfidenceSource {

    private final ConfidenceModel model;

    public ModelConfidenceSource(ConfidenceModel model) {
        this.model = model;
    }

    @Override
    public double confidenceFor(LabeledRow row) {
        return model.predictLongProbability(FeatureVector.of(row));
    }
}
