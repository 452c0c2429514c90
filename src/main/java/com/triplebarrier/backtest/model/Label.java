package com.triplebarrier.backtest.model;

import lombok.Builder;
import lombok.Value;

/**
 * Triple-barrier outcome of one origin bar, with the barrier metadata actually used.
 * Created once per eligible bar and never mutated.
 */
@Value
@Builder
public class Label {

    /**
     * Index value for a barrier that was never touched inside the horizon
     */
    public static final int NOT_TOUCHED = -1;

    /**
     * Labeled outcome
     */
    public enum Outcome {
        LONG_WIN(1), SHORT_WIN(-1), NEUTRAL(0);

        private final int value;

        Outcome(int value) {
            this.value = value;
        }

        public int getValue() {
            return value;
        }

        /**
         * Check if this outcome is the winning side for a direction
         * @param direction trade direction
         * @return true if the direction's take profit was reached first
         */
        public boolean favours(Direction direction) {
            return direction == Direction.LONG ? this == LONG_WIN : this == SHORT_WIN;
        }
    }

    /**
     * How the outcome was reached
     */
    public enum Resolution {
        LONG_TAKE_PROFIT,
        SHORT_TAKE_PROFIT,
        /** neither side reached take profit before its stop */
        NO_WINNER,
        /** both sides qualified as winners; resolved to neutral */
        BOTH_SIDES_WON
    }

    String symbol;

    /**
     * Index of the origin bar inside its symbol series
     */
    int originIndex;

    long originTimestamp;

    Outcome outcome;

    Resolution resolution;

    /**
     * Entry price (origin close)
     */
    double entryPrice;

    /**
     * ATR of the origin bar used to place the barriers
     */
    double atr;

    double tpMultiple;

    double slMultiple;

    /**
     * Forward bars scanned
     */
    int horizon;

    double longTakeProfit;
    double longStopLoss;
    double shortTakeProfit;
    double shortStopLoss;

    /**
     * First series index touching each barrier, or NOT_TOUCHED
     */
    int longTpIndex;
    int longSlIndex;
    int shortTpIndex;
    int shortSlIndex;

    /**
     * Series index where the outcome was decided; horizon end when nothing decided it
     */
    int decidedAtIndex;

    /**
     * Check if a barrier decided the label before the horizon expired
     * @return false for NO_WINNER labels
     */
    public boolean isDecided() {
        return resolution != Resolution.NO_WINNER;
    }

    /**
     * Reward-to-risk ratio implied by the multiples
     * @return tpMultiple / slMultiple
     */
    public double getRewardRiskRatio() {
        return tpMultiple / slMultiple;
    }

    /**
     * Take-profit price for a direction
     * @param direction trade direction
     * @return TP level
     */
    public double takeProfitFor(Direction direction) {
        return direction == Direction.LONG ? longTakeProfit : shortTakeProfit;
    }

    /**
     * Stop-loss price for a direction
     * @param direction trade direction
     * @return SL level
     */
    public double stopLossFor(Direction direction) {
        return direction == Direction.LONG ? longStopLoss : shortStopLoss;
    }
}
