package com.triplebarrier.backtest.confidence;

import com.triplebarrier.backtest.model.LabeledRow;
import com.triplebarrier.backtest.model.RegimeTag;

import java.util.List;

/**
 * Regime-derived feature vector of a labeled row, in a fixed column order.
 */
public final class FeatureVector {

    public static final List<String> NAMES = List.of(
        "vol_ratio",
        "adx",
        "fast_slope",
        "slow_slope",
        "bb_width_atr",
        "consolidation_days",
        "market_state"
    );

    private FeatureVector() {
    }

    /**
     * Build the feature vector of a row
     * @param row labeled row
     * @return values aligned with {@link #NAMES}
     */
    public static double[] of(LabeledRow row) {
        RegimeTag regime = row.getRegime();
        return new double[] {
            regime.getVolRatio(),
            regime.getAdx(),
            regime.getFastSlope(),
            regime.getSlowSlope(),
            regime.getBbWidthAtr(),
            regime.getConsolidationDays(),
            regime.getMarketState() == null ? Double.NaN : regime.getMarketState().ordinal()
        };
    }
}
