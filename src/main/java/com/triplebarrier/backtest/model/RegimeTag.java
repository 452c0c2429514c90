package com.triplebarrier.backtest.model;

import lombok.Builder;
import lombok.Value;

/**
 * Volatility / trend regime of a bar, derived only from the bar and its trailing window.
 * An indeterminate tag marks a bar whose history is too short; such bars are never labeled.
 */
@Value
@Builder
public class RegimeTag {

    public enum VolatilityClass {
        LOW, MID, HIGH, EXTREME
    }

    public enum TrendClass {
        NONE, WEAK, STRONG, VERY_STRONG;

        public boolean isStrongOrAbove() {
            return this == STRONG || this == VERY_STRONG;
        }
    }

    public enum MarketState {
        RANGING, TRENDING, BREAKOUT, CONSOLIDATING
    }

    boolean determinate;

    /**
     * Why the tag is indeterminate (null when determinate)
     */
    String reason;

    /**
     * ATR / rolling mean ATR
     */
    double volRatio;

    VolatilityClass volatilityClass;

    double adx;

    TrendClass trendClass;

    /**
     * Fast SMA change over its lookback, in ATR units
     */
    double fastSlope;

    /**
     * Slow SMA change over its lookback, in ATR units
     */
    double slowSlope;

    /**
     * Sign of the fast slope: -1, 0 or +1
     */
    int slopeSign;

    /**
     * Bollinger width in ATR units
     */
    double bbWidthAtr;

    MarketState marketState;

    /**
     * Bars since the last breakout
     */
    int consolidationDays;

    /**
     * Tag for a bar that cannot be classified
     * @param reason cause, for logging
     * @param consolidationDays running counter at this bar
     * @return indeterminate tag
     */
    public static RegimeTag indeterminate(String reason, int consolidationDays) {
        return RegimeTag.builder()
            .determinate(false)
            .reason(reason)
            .volRatio(Double.NaN)
            .adx(Double.NaN)
            .fastSlope(Double.NaN)
            .slowSlope(Double.NaN)
            .bbWidthAtr(Double.NaN)
            .consolidationDays(consolidationDays)
            .build();
    }
}
