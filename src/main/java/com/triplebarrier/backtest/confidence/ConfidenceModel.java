package com.triplebarrier.backtest.confidence;

/**
 * Trained statistical model seen from the backtest: given a feature vector, return the probability
 * that the long side wins. How the model was trained is irrelevant here.
 */
@FunctionalInterface
public interface ConfidenceModel {

    /**
     * @param features feature vector laid out as {@link FeatureVector#NAMES}
     * @return probability of a long win, expected in [0,1]
     */
    double predictLongProbability(double[] features);
}
