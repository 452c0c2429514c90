package com.triplebarrier.backtest.engine;

import com.triplebarrier.backtest.config.Config;
import com.triplebarrier.backtest.model.Direction;
import com.triplebarrier.backtest.model.EquityCurve;
import com.triplebarrier.backtest.model.EquitySample;
import com.triplebarrier.backtest.model.Label;
import com.triplebarrier.backtest.model.ScoredRow;
import com.triplebarrier.backtest.model.SkippedRow;
import com.triplebarrier.backtest.model.Trade;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Confidence-gated trade simulation over precomputed labels.
 *
 * <p>All symbols' rows are merged into one chronological stream and folded in order over a single
 * account. A row trades when max(confidence, 1 - confidence) clears the threshold, long when
 * confidence &gt;= 0.5, short otherwise. The label settles the trade without re-walking prices:
 * the favoured side realizes +TP/SL R, anything else (opposite win or neutral) is a -1 R stop-out.
 * Each trade risks a fixed fraction of the equity left by the previous trade.
 */
@Slf4j
public class TradeSimulator {

    private final Config config;

    /**
     * Create simulator
     * @param config run configuration (risk fraction, initial equity, neutral handling)
     */
    public TradeSimulator(Config config) {
        this.config = config;
    }

    /**
     * Run the simulation at the configured confidence threshold
     * @param rows scored rows of any symbols, any order
     * @return trade log, equity curve and skipped rows
     */
    public SimulationResult simulate(List<ScoredRow> rows) {
        return simulate(rows, config.getConfidenceThreshold());
    }

    /**
     * Run the simulation
     * @param rows scored rows of any symbols, any order
     * @param threshold minimum distance-adjusted confidence, max(c, 1-c)
     * @return trade log, equity curve and skipped rows
     */
    public SimulationResult simulate(List<ScoredRow> rows, double threshold) {
        log.debug("Simulating {} rows at threshold {}", rows.size(), threshold);

        List<ScoredRow> stream = ChronologicalMerger.merge(rows);
        List<Trade> trades = new ArrayList<>();
        List<EquitySample> samples = new ArrayList<>();
        List<SkippedRow> skipped = new ArrayList<>();

        double equity = config.getInitialEquity();
        for (ScoredRow row : stream) {
            SkippedRow.Reason reason = rejectionReason(row);
            if (reason != null) {
                skipped.add(new SkippedRow(row.getSymbol(), row.getTimestamp(), row.getConfidence(), reason));
                continue;
            }

            double confidence = row.getConfidence();
            if (Math.max(confidence, 1.0 - confidence) < threshold) {
                continue;
            }

            Trade trade = settle(trades.size() + 1, row, equity);
            trades.add(trade);
            equity = trade.getEquityAfter();
            samples.add(new EquitySample(trade.getId(), trade.getTimestamp(), trade.getSymbol(), equity));

            log.debug("Trade #{} {} {} conf={} -> {} {}R | Equity: {}",
                trade.getId(), trade.getSymbol(), trade.getDirection(), confidence,
                trade.getResult(), trade.getRMultiple(), equity);
        }

        if (!skipped.isEmpty()) {
            log.warn("Skipped {} rows at threshold {} (invalid confidence or excluded)", skipped.size(), threshold);
        }
        log.debug("Threshold {}: {} trades, final equity {}", threshold, trades.size(), equity);

        return new SimulationResult(threshold, trades, new EquityCurve(config.getInitialEquity(), samples), skipped);
    }

    private SkippedRow.Reason rejectionReason(ScoredRow row) {
        double confidence = row.getConfidence();
        if (Double.isNaN(confidence)) {
            return SkippedRow.Reason.CONFIDENCE_NOT_A_NUMBER;
        }
        if (confidence < 0.0 || confidence > 1.0) {
            return SkippedRow.Reason.CONFIDENCE_OUT_OF_RANGE;
        }
        if (config.isExcludeNeutralLabels() && row.getLabel().getOutcome() == Label.Outcome.NEUTRAL) {
            return SkippedRow.Reason.NEUTRAL_EXCLUDED;
        }
        return null;
    }

    /**
     * Open and close a trade against its label
     */
    private Trade settle(int id, ScoredRow row, double equityBefore) {
        Label label = row.getLabel();
        Direction direction = row.getConfidence() >= 0.5 ? Direction.LONG : Direction.SHORT;
        boolean win = label.getOutcome().favours(direction);

        double rMultiple = win ? label.getRewardRiskRatio() : -1.0;
        double riskAmount = config.getRiskPerTrade() * equityBefore;
        double stopDistance = label.getSlMultiple() * label.getAtr();
        double pnl = rMultiple * riskAmount;

        return Trade.builder()
            .id(id)
            .symbol(row.getSymbol())
            .timestamp(row.getTimestamp())
            .originIndex(label.getOriginIndex())
            .direction(direction)
            .confidence(row.getConfidence())
            .entryPrice(label.getEntryPrice())
            .takeProfit(label.takeProfitFor(direction))
            .stopLoss(label.stopLossFor(direction))
            .labelOutcome(label.getOutcome())
            .result(win ? Trade.Result.WIN : Trade.Result.LOSS)
            .rMultiple(rMultiple)
            .riskAmount(riskAmount)
            .positionSize(riskAmount / stopDistance)
            .pnl(pnl)
            .equityBefore(equityBefore)
            .equityAfter(equityBefore + pnl)
            .build();
    }
}
