package com.triplebarrier.backtest.label;

import com.triplebarrier.backtest.config.Config;
import com.triplebarrier.backtest.model.Label;
import com.triplebarrier.backtest.model.Label.Outcome;
import com.triplebarrier.backtest.model.Label.Resolution;
import com.triplebarrier.backtest.model.PriceBar;
import com.triplebarrier.backtest.model.RegimeTag;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Volatility-adaptive triple-barrier labeling.
 *
 * <p>For an origin bar the entry is its close; long and short take-profit / stop-loss levels sit at
 * TP and SL multiples of the origin ATR. Forward bars are scanned up to the chosen horizon and the
 * first touch of each of the four levels is recorded from the bars' high/low. A side wins when its
 * take profit is touched strictly before its stop; a stop touched in the same bar as the take profit
 * counts first. Exactly one winning side gives that side's label, otherwise the label is neutral.
 *
 * <p>No label is produced when the origin regime is indeterminate, the ATR is unusable or fewer
 * forward bars remain than the horizon needs. An extended low-volatility horizon is first shortened
 * to the bars that remain.
 */
@Slf4j
public class LabelEngine {

    private final BarrierPolicy policy;

    /**
     * Create label engine
     * @param config run configuration
     */
    public LabelEngine(Config config) {
        this.policy = new BarrierPolicy(config);
    }

    /**
     * Label every eligible bar of a symbol series
     * @param series symbol bars in ascending timestamp order
     * @param tags regime tags aligned with the series
     * @return labels in origin order; ineligible origins are absent
     */
    public List<Label> labelSeries(List<PriceBar> series, List<RegimeTag> tags) {
        if (series.size() != tags.size()) {
            throw new IllegalArgumentException(
                "Regime tags (" + tags.size() + ") do not match series length (" + series.size() + ")");
        }
        List<Label> labels = new ArrayList<>();
        for (int i = 0; i < series.size(); i++) {
            label(series, i, tags.get(i)).ifPresent(labels::add);
        }
        return labels;
    }

    /**
     * Label one origin bar
     * @param series symbol bars in ascending timestamp order
     * @param originIndex origin bar index
     * @param regime origin bar's regime tag
     * @return label, or empty when the origin is not eligible
     */
    public Optional<Label> label(List<PriceBar> series, int originIndex, RegimeTag regime) {
        if (!regime.isDeterminate()) {
            return Optional.empty();
        }

        PriceBar origin = series.get(originIndex);
        double atr = origin.getAtr();
        if (!Double.isFinite(atr) || atr <= 0) {
            return Optional.empty();
        }

        int availableBars = series.size() - 1 - originIndex;
        BarrierParameters params = policy.select(regime.getVolRatio(), regime.getAdx(), availableBars);
        int horizonEnd = originIndex + params.getHorizon();
        if (horizonEnd >= series.size()) {
            return Optional.empty();
        }

        double entry = origin.getClose();
        double longTp = entry + params.getTpMultiple() * atr;
        double longSl = entry - params.getSlMultiple() * atr;
        double shortTp = entry - params.getTpMultiple() * atr;
        double shortSl = entry + params.getSlMultiple() * atr;

        int longTpIndex = Label.NOT_TOUCHED;
        int longSlIndex = Label.NOT_TOUCHED;
        int shortTpIndex = Label.NOT_TOUCHED;
        int shortSlIndex = Label.NOT_TOUCHED;

        for (int j = originIndex + 1; j <= horizonEnd; j++) {
            PriceBar bar = series.get(j);
            if (longTpIndex == Label.NOT_TOUCHED && bar.reachesAbove(longTp)) {
                longTpIndex = j;
            }
            if (longSlIndex == Label.NOT_TOUCHED && bar.reachesBelow(longSl)) {
                longSlIndex = j;
            }
            if (shortTpIndex == Label.NOT_TOUCHED && bar.reachesBelow(shortTp)) {
                shortTpIndex = j;
            }
            if (shortSlIndex == Label.NOT_TOUCHED && bar.reachesAbove(shortSl)) {
                shortSlIndex = j;
            }
        }

        boolean longWins = wins(longTpIndex, longSlIndex);
        boolean shortWins = wins(shortTpIndex, shortSlIndex);

        Outcome outcome;
        Resolution resolution;
        int decidedAt;
        if (longWins && shortWins) {
            outcome = Outcome.NEUTRAL;
            resolution = Resolution.BOTH_SIDES_WON;
            decidedAt = Math.max(longTpIndex, shortTpIndex);
            log.debug("{} bar {}: both sides reached take profit, labeling neutral",
                origin.getSymbol(), originIndex);
        } else if (longWins) {
            outcome = Outcome.LONG_WIN;
            resolution = Resolution.LONG_TAKE_PROFIT;
            decidedAt = longTpIndex;
        } else if (shortWins) {
            outcome = Outcome.SHORT_WIN;
            resolution = Resolution.SHORT_TAKE_PROFIT;
            decidedAt = shortTpIndex;
        } else {
            outcome = Outcome.NEUTRAL;
            resolution = Resolution.NO_WINNER;
            decidedAt = horizonEnd;
        }

        return Optional.of(Label.builder()
            .symbol(origin.getSymbol())
            .originIndex(originIndex)
            .originTimestamp(origin.getTimestamp())
            .outcome(outcome)
            .resolution(resolution)
            .entryPrice(entry)
            .atr(atr)
            .tpMultiple(params.getTpMultiple())
            .slMultiple(params.getSlMultiple())
            .horizon(params.getHorizon())
            .longTakeProfit(longTp)
            .longStopLoss(longSl)
            .shortTakeProfit(shortTp)
            .shortStopLoss(shortSl)
            .longTpIndex(longTpIndex)
            .longSlIndex(longSlIndex)
            .shortTpIndex(shortTpIndex)
            .shortSlIndex(shortSlIndex)
            .decidedAtIndex(decidedAt)
            .build());
    }

    /**
     * Take profit touched, and strictly before any stop (same bar: stop first)
     */
    private static boolean wins(int tpIndex, int slIndex) {
        return tpIndex != Label.NOT_TOUCHED && (slIndex == Label.NOT_TOUCHED || tpIndex < slIndex);
    }
}
