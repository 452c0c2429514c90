package com.triplebarrier.backtest.metrics;

import static com.triplebarrier.backtest.TestData.scored;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.triplebarrier.backtest.config.Config;
import com.triplebarrier.backtest.engine.SimulationResult;
import com.triplebarrier.backtest.engine.TradeSimulator;
import com.triplebarrier.backtest.model.BacktestReport;
import com.triplebarrier.backtest.model.EquityCurve;
import com.triplebarrier.backtest.model.EquitySample;
import com.triplebarrier.backtest.model.Label.Outcome;
import com.triplebarrier.backtest.model.ScoredRow;
import java.util.List;
import org.junit.jupiter.api.Test;

class MetricsCalculatorTest {

    private final TradeSimulator simulator = new TradeSimulator(Config.defaults());
    private final MetricsCalculator calculator = new MetricsCalculator();

    @Test
    void calculate_threeWinsTwoLosses() {
        List<ScoredRow> rows = List.of(
            scored("BTC", 0, Outcome.LONG_WIN, 0.8),
            scored("BTC", 1, Outcome.LONG_WIN, 0.8),
            scored("BTC", 2, Outcome.SHORT_WIN, 0.8),
            scored("BTC", 3, Outcome.LONG_WIN, 0.8),
            scored("BTC", 4, Outcome.SHORT_WIN, 0.8));

        BacktestReport report = calculator.calculate(simulator.simulate(rows, 0.7));

        assertThat(report.isNoTrades()).isFalse();
        assertThat(report.getTradeCount()).isEqualTo(5);
        assertThat(report.getWinCount()).isEqualTo(3);
        assertThat(report.getLossCount()).isEqualTo(2);
        assertThat(report.getWinRate().getValue()).isCloseTo(0.6, within(1e-12));
        assertThat(report.getProfitFactor().getValue()).isCloseTo(2.7, within(1e-12));
        assertThat(report.getAverageR().getValue()).isCloseTo(0.68, within(1e-12));
        assertThat(report.getAverageLoss().getValue()).isPositive();
        assertThat(report.getMaxDrawdown()).isCloseTo(-0.01, within(1e-12));
        assertThat(report.getSharpe().isDefined()).isTrue();
        assertThat(report.getTotalPnl()).isCloseTo(report.getFinalEquity() - 10_000.0, within(1e-9));
        assertThat(report.getTotalReturn()).isCloseTo(report.getTotalPnl() / 10_000.0, within(1e-12));
    }

    @Test
    void calculate_onlyWinners_profitFactorIsInfinite() {
        List<ScoredRow> rows = List.of(
            scored("BTC", 0, Outcome.LONG_WIN, 0.8),
            scored("BTC", 1, Outcome.LONG_WIN, 0.8),
            scored("BTC", 2, Outcome.LONG_WIN, 0.8));

        BacktestReport report = calculator.calculate(simulator.simulate(rows, 0.7));

        assertThat(report.getProfitFactor().isInfinite()).isTrue();
        assertThat(report.getProfitFactor().rankValue()).isEqualTo(Double.POSITIVE_INFINITY);
        assertThat(report.getProfitFactor()).hasToString("+inf");
        assertThat(report.getMaxDrawdown()).isZero();
        assertThat(report.getAverageLoss().isUndefined()).isTrue();
        assertThat(report.getSharpe().isUndefined()).isTrue();
    }

    @Test
    void calculate_noTrades_winRateZeroAndRatiosUndefined() {
        BacktestReport report = calculator.calculate(
            simulator.simulate(List.of(scored("BTC", 0, Outcome.LONG_WIN, 0.6)), 0.7));

        assertThat(report.isNoTrades()).isTrue();
        assertThat(report.getTradeCount()).isZero();
        assertThat(report.getWinRate().isDefined()).isTrue();
        assertThat(report.getWinRate().getValue()).isZero();
        assertThat(report.getProfitFactor().isUndefined()).isTrue();
        assertThat(report.getAverageR().isUndefined()).isTrue();
        assertThat(report.getSharpe().isUndefined()).isTrue();
        assertThat(report.getFinalEquity()).isEqualTo(10_000.0);
        assertThat(report.getMaxDrawdown()).isZero();
        assertThat(report.getTotalReturn()).isZero();
        assertThat(report.getPerSymbol()).isEmpty();
    }

    @Test
    void calculate_skippedRows_counted() {
        List<ScoredRow> rows = List.of(
            scored("BTC", 0, Outcome.LONG_WIN, Double.NaN),
            scored("BTC", 1, Outcome.LONG_WIN, 0.9));

        BacktestReport report = calculator.calculate(simulator.simulate(rows, 0.7));

        assertThat(report.getSkippedCount()).isEqualTo(1);
        assertThat(report.getTradeCount()).isEqualTo(1);
    }

    @Test
    void calculate_perSymbolBreakdown_sortedAndComplete() {
        List<ScoredRow> rows = List.of(
            scored("ETH", 0, Outcome.LONG_WIN, 0.8),
            scored("BTC", 0, Outcome.SHORT_WIN, 0.8),
            scored("BTC", 1, Outcome.LONG_WIN, 0.8));

        SimulationResult result = simulator.simulate(rows, 0.7);
        BacktestReport report = calculator.calculate(result);

        assertThat(report.getPerSymbol()).containsOnlyKeys("BTC", "ETH");
        assertThat(report.getPerSymbol().keySet()).containsExactly("BTC", "ETH");
        BacktestReport btc = report.getPerSymbol().get("BTC");
        assertThat(btc.getTradeCount()).isEqualTo(2);
        assertThat(btc.getProfitFactor().getValue()).isCloseTo(1.8, within(1e-12));
        assertThat(btc.getInitialEquity()).isEqualTo(10_000.0);
        assertThat(report.getPerSymbol().get("ETH").getWinRate().getValue()).isEqualTo(1.0);
    }

    @Test
    void maxDrawdown_peakSeededWithInitialEquity() {
        EquityCurve curve = new EquityCurve(100.0, List.of(
            new EquitySample(1, 1L, "BTC", 90.0),
            new EquitySample(2, 2L, "BTC", 120.0),
            new EquitySample(3, 3L, "BTC", 96.0),
            new EquitySample(4, 4L, "BTC", 130.0)));

        assertThat(MetricsCalculator.maxDrawdown(curve)).isCloseTo(-0.2, within(1e-12));
    }

    @Test
    void maxDrawdown_risingCurve_isZero() {
        EquityCurve curve = new EquityCurve(100.0, List.of(
            new EquitySample(1, 1L, "BTC", 101.0),
            new EquitySample(2, 2L, "BTC", 105.0)));

        assertThat(MetricsCalculator.maxDrawdown(curve)).isZero();
    }

    @Test
    void sharpe_singleTrade_isUndefined() {
        SimulationResult result = simulator.simulate(List.of(scored("BTC", 0, Outcome.LONG_WIN, 0.9)), 0.7);

        assertThat(MetricsCalculator.sharpe(result.getTrades()).isUndefined()).isTrue();
    }

    @Test
    void sharpe_meanOverSampleDeviation() {
        SimulationResult result = simulator.simulate(List.of(
            scored("BTC", 0, Outcome.LONG_WIN, 0.9),
            scored("BTC", 1, Outcome.SHORT_WIN, 0.9)), 0.7);

        // R = {1.8, -1}: mean 0.4, sample stdev sqrt(3.92)
        assertThat(MetricsCalculator.sharpe(result.getTrades()).getValue())
            .isCloseTo(0.4 / Math.sqrt(3.92), within(1e-12));
    }
}
