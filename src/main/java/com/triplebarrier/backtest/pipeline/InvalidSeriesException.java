package com.triplebarrier.backtest.pipeline;

/**
 * Input series failed validation; nothing was computed
 */
public class InvalidSeriesException extends IllegalArgumentException {

    private final String symbol;

    public InvalidSeriesException(String symbol, String message) {
        super(symbol + ": " + message);
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
