package com.triplebarrier.backtest.regime;

import static com.triplebarrier.backtest.TestData.flatSeries;
import static com.triplebarrier.backtest.TestData.setRange;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.triplebarrier.backtest.config.Config;
import com.triplebarrier.backtest.model.PriceBar;
import com.triplebarrier.backtest.model.RegimeTag;
import com.triplebarrier.backtest.model.RegimeTag.MarketState;
import com.triplebarrier.backtest.model.RegimeTag.TrendClass;
import com.triplebarrier.backtest.model.RegimeTag.VolatilityClass;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class RegimeClassifierTest {

    private final Config config = Config.defaults();
    private final RegimeClassifier classifier = new RegimeClassifier(config);

    @ParameterizedTest
    @CsvSource({
        "0.79, LOW",
        "0.8,  MID",
        "1.2,  MID",
        "1.21, HIGH",
        "1.5,  HIGH",
        "1.51, EXTREME"
    })
    void classifyVolatility_boundaries(double volRatio, VolatilityClass expected) {
        assertThat(RegimeClassifier.classifyVolatility(volRatio, config)).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({
        "19.9, NONE",
        "20,   WEAK",
        "29.9, WEAK",
        "30,   STRONG",
        "39.9, STRONG",
        "40,   VERY_STRONG"
    })
    void classifyTrend_boundaries(double adx, TrendClass expected) {
        assertThat(RegimeClassifier.classifyTrend(adx, config)).isEqualTo(expected);
    }

    @Test
    void classify_shortHistory_isIndeterminate() {
        List<RegimeTag> tags = classifier.classify(flatSeries("BTC", 80));

        assertThat(classifier.requiredHistory()).isEqualTo(60);
        assertThat(tags).hasSize(80);
        assertThat(tags.get(58).isDeterminate()).isFalse();
        assertThat(tags.get(58).getReason()).isEqualTo("insufficient history");
        assertThat(tags.get(59).isDeterminate()).isTrue();
    }

    @Test
    void classify_flatSeries_consolidatesWithMidVolatility() {
        RegimeTag tag = classifier.classify(flatSeries("BTC", 80)).get(59);

        assertThat(tag.getVolRatio()).isCloseTo(1.0, within(1e-12));
        assertThat(tag.getVolatilityClass()).isEqualTo(VolatilityClass.MID);
        assertThat(tag.getTrendClass()).isEqualTo(TrendClass.NONE);
        assertThat(tag.getConsolidationDays()).isEqualTo(40);
        assertThat(tag.getMarketState()).isEqualTo(MarketState.CONSOLIDATING);
        assertThat(tag.getBbWidthAtr()).isCloseTo(2.0, within(1e-12));
    }

    @Test
    void classify_atrSpike_isExtremeVolatility() {
        List<PriceBar> series = flatSeries("BTC", 80);
        series.set(79, series.get(79).toBuilder().atr(2.0).build());

        RegimeTag tag = classifier.classify(series).get(79);

        assertThat(tag.getVolRatio()).isCloseTo(120.0 / 61.0, within(1e-9));
        assertThat(tag.getVolatilityClass()).isEqualTo(VolatilityClass.EXTREME);
        assertThat(tag.getMarketState()).isEqualTo(MarketState.RANGING);
    }

    @Test
    void classify_closeAboveRecentHighs_resetsConsolidation() {
        List<PriceBar> series = flatSeries("BTC", 80);
        series.set(70, series.get(70).toBuilder().close(101.0).high(101.2).build());

        List<RegimeTag> tags = classifier.classify(series);

        assertThat(tags.get(69).getConsolidationDays()).isEqualTo(50);
        assertThat(tags.get(70).getConsolidationDays()).isZero();
        assertThat(tags.get(70).getMarketState()).isEqualTo(MarketState.BREAKOUT);
        assertThat(tags.get(71).getConsolidationDays()).isEqualTo(1);
        assertThat(tags.get(71).getMarketState()).isEqualTo(MarketState.RANGING);
    }

    @Test
    void classify_wideRangeBars_neverConsolidate() {
        List<PriceBar> series = new ArrayList<>();
        for (PriceBar bar : flatSeries("BTC", 80)) {
            series.add(bar.toBuilder().high(103.0).low(97.0).build());
        }

        RegimeTag tag = classifier.classify(series).get(79);

        assertThat(tag.getConsolidationDays()).isZero();
        assertThat(tag.getMarketState()).isEqualTo(MarketState.RANGING);
    }

    @Test
    void classify_singleWideBar_resetsConsolidation() {
        List<PriceBar> series = flatSeries("BTC", 80);
        setRange(series, 70, 100.4, 99.6);

        List<RegimeTag> tags = classifier.classify(series);

        assertThat(tags.get(69).getConsolidationDays()).isEqualTo(50);
        assertThat(tags.get(70).getConsolidationDays()).isZero();
        assertThat(tags.get(70).getMarketState()).isEqualTo(MarketState.RANGING);
        assertThat(tags.get(71).getConsolidationDays()).isEqualTo(1);
    }

    @Test
    void classify_highAdx_isTrending() {
        List<PriceBar> series = flatSeries("BTC", 80);
        series.set(70, series.get(70).toBuilder().adx(28.0).build());

        RegimeTag tag = classifier.classify(series).get(70);

        assertThat(tag.getTrendClass()).isEqualTo(TrendClass.WEAK);
        assertThat(tag.getMarketState()).isEqualTo(MarketState.TRENDING);
    }

    @Test
    void classify_risingAverages_positiveSlopesInAtrUnits() {
        List<PriceBar> series = new ArrayList<>();
        for (PriceBar bar : flatSeries("BTC", 80)) {
            int i = series.size();
            series.add(bar.toBuilder().smaFast(100 + 0.1 * i).smaSlow(100 + 0.05 * i).build());
        }

        RegimeTag tag = classifier.classify(series).get(70);

        assertThat(tag.getFastSlope()).isCloseTo(0.5, within(1e-9));
        assertThat(tag.getSlowSlope()).isCloseTo(0.5, within(1e-9));
        assertThat(tag.getSlopeSign()).isEqualTo(1);
    }

    @Test
    void classify_missingIndicator_isIndeterminate() {
        List<PriceBar> series = flatSeries("BTC", 130);
        series.set(40, series.get(40).toBuilder().atr(Double.NaN).build());

        List<RegimeTag> tags = classifier.classify(series);

        assertThat(tags.get(99).isDeterminate()).isFalse();
        assertThat(tags.get(99).getReason()).isEqualTo("ATR window incomplete");
        assertThat(tags.get(100).isDeterminate()).isTrue();
    }

    @Test
    void classify_futureBarsChanged_pastTagsUnchanged() {
        List<PriceBar> series = flatSeries("BTC", 100);
        List<RegimeTag> before = classifier.classify(series);

        List<PriceBar> altered = new ArrayList<>(series);
        for (int i = 80; i < altered.size(); i++) {
            altered.set(i, altered.get(i).toBuilder().close(120.0).high(121.0).atr(3.0).adx(45.0).build());
        }
        List<RegimeTag> after = classifier.classify(altered);

        assertThat(after.subList(0, 80)).isEqualTo(before.subList(0, 80));
        assertThat(after.get(80)).isNotEqualTo(before.get(80));
    }
}
