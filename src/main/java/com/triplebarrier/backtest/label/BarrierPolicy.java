package com.triplebarrier.backtest.label;

import com.triplebarrier.backtest.config.Config;

/**
 * Regime-conditioned barrier selection. A pure function of (vol ratio, ADX) for a given config.
 *
 * <pre>
 * TP multiple: ADX >= 30 -> 2.5, else vol ratio &lt; 0.8 -> 1.5, else 1.8
 * SL multiple: always 1.0
 * Horizon:     vol ratio > 1.5 -> round(0.5 x max), vol ratio &lt; 0.8 -> round(1.3 x max), else max
 * </pre>
 * An extended low-volatility horizon is capped at the forward bars available, but never below max.
 */
public class BarrierPolicy {

    private final Config config;

    public BarrierPolicy(Config config) {
        this.config = config;
    }

    /**
     * Select parameters for an origin bar
     * @param volRatio ATR / rolling mean ATR of the origin bar
     * @param adx ADX of the origin bar
     * @return multiples and horizon
     */
    public BarrierParameters select(double volRatio, double adx) {
        return new BarrierParameters(takeProfitMultiple(volRatio, adx), config.getSlMultiple(), horizon(volRatio));
    }

    /**
     * Select parameters for an origin bar with a limited number of forward bars
     * @param volRatio ATR / rolling mean ATR of the origin bar
     * @param adx ADX of the origin bar
     * @param availableBars forward bars after the origin
     * @return multiples and horizon; the horizon may still exceed availableBars when even the
     *         default horizon does not fit
     */
    public BarrierParameters select(double volRatio, double adx, int availableBars) {
        BarrierParameters params = select(volRatio, adx);
        int horizon = params.getHorizon();
        if (horizon <= availableBars || horizon <= config.getMaxHorizon()) {
            return params;
        }
        return new BarrierParameters(params.getTpMultiple(), params.getSlMultiple(),
            Math.max(availableBars, config.getMaxHorizon()));
    }

    double takeProfitMultiple(double volRatio, double adx) {
        if (adx >= config.getStrongTrendAdx()) {
            return config.getTrendTpMultiple();
        } else if (volRatio < config.getLowVolBound()) {
            return config.getLowVolTpMultiple();
        } else {
            return config.getBaseTpMultiple();
        }
    }

    int horizon(double volRatio) {
        int max = config.getMaxHorizon();
        if (volRatio > config.getHighVolBound()) {
            return Math.max(config.getMinHorizon(), (int) Math.round(max * config.getExtremeVolHorizonFactor()));
        } else if (volRatio < config.getLowVolBound()) {
            return Math.max(config.getMinHorizon(), (int) Math.round(max * config.getLowVolHorizonFactor()));
        } else {
            return max;
        }
    }
}
