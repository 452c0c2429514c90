package com.triplebarrier.backtest.pipeline;

import com.triplebarrier.backtest.model.PriceBar;

import java.util.List;
import java.util.Map;

/**
 * Fails fast on series the labeler cannot trust
 */
public final class SeriesValidator {

    private SeriesValidator() {
    }

    /**
     * Validate every symbol series
     * @param seriesBySymbol bars keyed by symbol
     * @throws InvalidSeriesException on the first violation
     */
    public static void validateAll(Map<String, List<PriceBar>> seriesBySymbol) {
        for (Map.Entry<String, List<PriceBar>> entry : seriesBySymbol.entrySet()) {
            validate(entry.getKey(), entry.getValue());
        }
    }

    /**
     * Validate one symbol series: single symbol, strictly increasing timestamps, finite OHLC
     * @param symbol expected symbol
     * @param series bars in file order
     * @throws InvalidSeriesException on the first violation
     */
    public static void validate(String symbol, List<PriceBar> series) {
        long previous = Long.MIN_VALUE;
        for (int i = 0; i < series.size(); i++) {
            PriceBar bar = series.get(i);
            if (!symbol.equals(bar.getSymbol())) {
                throw new InvalidSeriesException(symbol, "bar " + i + " belongs to " + bar.getSymbol());
            }
            if (i > 0 && bar.getTimestamp() == previous) {
                throw new InvalidSeriesException(symbol, "duplicate timestamp " + bar.getTimestamp() + " at bar " + i);
            }
            if (i > 0 && bar.getTimestamp() < previous) {
                throw new InvalidSeriesException(symbol,
                    "timestamp " + bar.getTimestamp() + " at bar " + i + " precedes " + previous);
            }
            if (!Double.isFinite(bar.getOpen()) || !Double.isFinite(bar.getHigh())
                || !Double.isFinite(bar.getLow()) || !Double.isFinite(bar.getClose())) {
                throw new InvalidSeriesException(symbol, "non-finite price at bar " + i);
            }
            if (bar.getHigh() < bar.getLow()) {
                throw new InvalidSeriesException(symbol, "high below low at bar " + i);
            }
            previous = bar.getTimestamp();
        }
    }
}
