package com.triplebarrier.backtest.regime;

import com.triplebarrier.backtest.config.Config;
import com.triplebarrier.backtest.model.PriceBar;
import com.triplebarrier.backtest.model.RegimeTag;
import com.triplebarrier.backtest.model.RegimeTag.MarketState;
import com.triplebarrier.backtest.model.RegimeTag.TrendClass;
import com.triplebarrier.backtest.model.RegimeTag.VolatilityClass;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Market regime classification.
 * Tags every bar of a symbol series with volatility class, trend class, SMA slopes,
 * a composite market state and a running consolidation counter. The counter grows on each
 * narrow-range bar and resets on a wide bar or a breakout. Each tag reads only
 * the bar itself and its trailing window.
 */
@Slf4j
public class RegimeClassifier {

    private final Config config;

    /**
     * Create classifier
     * @param config run configuration
     */
    public RegimeClassifier(Config config) {
        this.config = config;
    }

    /**
     * Bars of history (including the current one) needed before a tag can be determinate
     * @return required window
     */
    public int requiredHistory() {
        int trailing = Math.max(
            Math.max(config.getFastSlopeLookback(), config.getSlowSlopeLookback()),
            config.getBreakoutLookback());
        return Math.max(config.getAtrMeanWindow(), trailing + 1);
    }

    /**
     * Classify a whole symbol series
     * @param series one symbol's bars in ascending timestamp order
     * @return one tag per bar, same order
     */
    public List<RegimeTag> classify(List<PriceBar> series) {
        List<RegimeTag> tags = new ArrayList<>(series.size());
        int consolidationDays = 0;
        int indeterminate = 0;

        for (int i = 0; i < series.size(); i++) {
            if (i >= config.getBreakoutLookback()) {
                boolean quiet = !isBreakout(series, i) && isNarrowRange(series.get(i));
                consolidationDays = quiet ? consolidationDays + 1 : 0;
            }
            RegimeTag tag = classifyAt(series, i, consolidationDays);
            if (!tag.isDeterminate()) {
                indeterminate++;
            }
            tags.add(tag);
        }

        if (!series.isEmpty()) {
            log.debug("Classified {} bars of {}, {} indeterminate",
                series.size(), series.get(0).getSymbol(), indeterminate);
        }
        return tags;
    }

    /**
     * Classify one bar from its trailing window
     * @param series symbol series
     * @param index bar to classify
     * @param consolidationDays running consolidation counter at this bar
     * @return regime tag, indeterminate when the window is short or has gaps
     */
    public RegimeTag classifyAt(List<PriceBar> series, int index, int consolidationDays) {
        if (index + 1 < requiredHistory()) {
            return RegimeTag.indeterminate("insufficient history", consolidationDays);
        }

        PriceBar bar = series.get(index);
        double atr = bar.getAtr();
        if (!isUsable(atr) || atr <= 0) {
            return RegimeTag.indeterminate("ATR unavailable", consolidationDays);
        }

        double atrMean = rollingAtrMean(series, index);
        if (!isUsable(atrMean) || atrMean <= 0) {
            return RegimeTag.indeterminate("ATR window incomplete", consolidationDays);
        }

        PriceBar fastRef = series.get(index - config.getFastSlopeLookback());
        PriceBar slowRef = series.get(index - config.getSlowSlopeLookback());
        if (!isUsable(bar.getAdx()) || !isUsable(bar.getSmaFast()) || !isUsable(bar.getSmaSlow())
            || !isUsable(fastRef.getSmaFast()) || !isUsable(slowRef.getSmaSlow())) {
            return RegimeTag.indeterminate("indicator unavailable", consolidationDays);
        }

        double volRatio = atr / atrMean;
        double fastSlope = (bar.getSmaFast() - fastRef.getSmaFast()) / atr;
        double slowSlope = (bar.getSmaSlow() - slowRef.getSmaSlow()) / atr;
        VolatilityClass volatilityClass = classifyVolatility(volRatio, config);
        TrendClass trendClass = classifyTrend(bar.getAdx(), config);
        boolean breakout = isBreakout(series, index);

        return RegimeTag.builder()
            .determinate(true)
            .volRatio(volRatio)
            .volatilityClass(volatilityClass)
            .adx(bar.getAdx())
            .trendClass(trendClass)
            .fastSlope(fastSlope)
            .slowSlope(slowSlope)
            .slopeSign((int) Math.signum(fastSlope))
            .bbWidthAtr(isUsable(bar.getBbWidth()) ? bar.getBbWidth() / atr : Double.NaN)
            .marketState(classifyMarketState(breakout, bar.getAdx(), volatilityClass, consolidationDays))
            .consolidationDays(consolidationDays)
            .build();
    }

    /**
     * Volatility class from the ATR ratio: &lt;0.8 low, [0.8,1.2] mid, (1.2,1.5] high, &gt;1.5 extreme
     */
    public static VolatilityClass classifyVolatility(double volRatio, Config config) {
        if (volRatio < config.getLowVolBound()) {
            return VolatilityClass.LOW;
        } else if (volRatio <= config.getMidVolBound()) {
            return VolatilityClass.MID;
        } else if (volRatio <= config.getHighVolBound()) {
            return VolatilityClass.HIGH;
        } else {
            return VolatilityClass.EXTREME;
        }
    }

    /**
     * Trend class from ADX: &lt;20 none, [20,30) weak, [30,40) strong, &gt;=40 very strong
     */
    public static TrendClass classifyTrend(double adx, Config config) {
        if (adx >= config.getVeryStrongTrendAdx()) {
            return TrendClass.VERY_STRONG;
        } else if (adx >= config.getStrongTrendAdx()) {
            return TrendClass.STRONG;
        } else if (adx >= config.getWeakTrendAdx()) {
            return TrendClass.WEAK;
        } else {
            return TrendClass.NONE;
        }
    }

    private MarketState classifyMarketState(boolean breakout, double adx,
                                            VolatilityClass volatilityClass, int consolidationDays) {
        if (breakout) {
            return MarketState.BREAKOUT;
        } else if (adx > config.getTrendingAdxThreshold()) {
            return MarketState.TRENDING;
        } else if (consolidationDays >= config.getConsolidationMinDays()
            && (volatilityClass == VolatilityClass.LOW || volatilityClass == VolatilityClass.MID)) {
            return MarketState.CONSOLIDATING;
        } else {
            return MarketState.RANGING;
        }
    }

    /**
     * Bar range (high - low) under the narrow-range fraction of its ATR; false without a usable ATR
     */
    private boolean isNarrowRange(PriceBar bar) {
        double atr = bar.getAtr();
        return isUsable(atr) && bar.getHigh() - bar.getLow() < config.getNarrowRangeAtrFactor() * atr;
    }

    /**
     * Close outside the high/low envelope of the preceding bars
     */
    private boolean isBreakout(List<PriceBar> series, int index) {
        int lookback = config.getBreakoutLookback();
        if (index < lookback) {
            return false;
        }
        double highest = Double.NEGATIVE_INFINITY;
        double lowest = Double.POSITIVE_INFINITY;
        for (int j = index - lookback; j < index; j++) {
            highest = Math.max(highest, series.get(j).getHigh());
            lowest = Math.min(lowest, series.get(j).getLow());
        }
        double close = series.get(index).getClose();
        return close > highest || close < lowest;
    }

    private double rollingAtrMean(List<PriceBar> series, int index) {
        int window = config.getAtrMeanWindow();
        double sum = 0;
        for (int j = index - window + 1; j <= index; j++) {
            double atr = series.get(j).getAtr();
            if (!isUsable(atr)) {
                return Double.NaN;
            }
            sum += atr;
        }
        return sum / window;
    }

    private static boolean isUsable(double value) {
        return Double.isFinite(value);
    }
}
