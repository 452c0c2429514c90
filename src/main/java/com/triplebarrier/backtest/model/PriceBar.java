package com.triplebarrier.backtest.model;

import lombok.Builder;
import lombok.Value;

/**
 * A single daily bar of one symbol with its precomputed indicator values.
 * Immutable once produced by the indicator collaborator.
 */
@Value
@Builder(toBuilder = true)
public class PriceBar {

    /**
     * Trading symbol (e.g. EURUSD)
     */
    String symbol;

    /**
     * Bar timestamp in milliseconds since epoch, strictly increasing per symbol
     */
    long timestamp;

    /**
     * Opening price
     */
    double open;

    /**
     * Highest price
     */
    double high;

    /**
     * Lowest price
     */
    double low;

    /**
     * Closing price
     */
    double close;

    /**
     * Average True Range ending at this bar
     */
    double atr;

    /**
     * Average Directional Index ending at this bar
     */
    double adx;

    /**
     * Fast simple moving average of close (20 bars upstream)
     */
    double smaFast;

    /**
     * Slow simple moving average of close (50 bars upstream)
     */
    double smaSlow;

    /**
     * Bollinger band width (upper - lower) in price units
     */
    double bbWidth;

    /**
     * Check if the bar's high reaches a price level
     * @param level price level
     * @return true if high >= level
     */
    public boolean reachesAbove(double level) {
        return high >= level;
    }

    /**
     * Check if the bar's low reaches a price level
     * @param level price level
     * @return true if low <= level
     */
    public boolean reachesBelow(double level) {
        return low <= level;
    }
}
