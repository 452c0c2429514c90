package com.triplebarrier.backtest.model;

import lombok.Builder;
import lombok.Value;

/**
 * A simulated trade. Opened and closed in one step because the outcome is already known from the label.
 */
@Value
@Builder
public class Trade {

    /**
     * Realized result
     */
    public enum Result {
        WIN, LOSS
    }

    /**
     * Sequence number in the trade log, starting at 1
     */
    int id;

    String symbol;

    /**
     * Open timestamp (origin bar)
     */
    long timestamp;

    /**
     * Origin bar index inside the symbol series
     */
    int originIndex;

    Direction direction;

    /**
     * Probability of a long win supplied by the model
     */
    double confidence;

    double entryPrice;

    double takeProfit;

    double stopLoss;

    /**
     * Label outcome the trade was settled against
     */
    Label.Outcome labelOutcome;

    Result result;

    /**
     * Realized R-multiple (+TP/SL on a win, -1 on a loss)
     */
    double rMultiple;

    /**
     * Equity put at risk (risk fraction x equity before trade)
     */
    double riskAmount;

    /**
     * Units of the asset: risk amount / stop distance
     */
    double positionSize;

    /**
     * Profit/Loss in account currency
     */
    double pnl;

    double equityBefore;

    double equityAfter;

    public boolean isWinner() {
        return result == Result.WIN;
    }
}
