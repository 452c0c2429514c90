package com.triplebarrier.backtest.pipeline;

import com.triplebarrier.backtest.model.Label;
import com.triplebarrier.backtest.model.LabeledRow;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Label distribution per symbol and overall
 */
@Slf4j
@Value
public class LabelStatistics {

    List<SymbolStats> symbols;
    SymbolStats overall;

    @Value
    public static class SymbolStats {
        String symbol;
        int total;
        int longWins;
        int shortWins;
        int neutral;

        public double getLongPercent() {
            return percent(longWins);
        }

        public double getShortPercent() {
            return percent(shortWins);
        }

        public double getNeutralPercent() {
            return percent(neutral);
        }

        private double percent(int count) {
            return total == 0 ? 0 : count * 100.0 / total;
        }
    }

    /**
     * Count outcomes
     * @param rows labeled rows
     * @return statistics, symbols sorted by name
     */
    public static LabelStatistics of(List<LabeledRow> rows) {
        Map<String, int[]> counts = new TreeMap<>();
        int[] all = new int[3];
        for (LabeledRow row : rows) {
            int slot = slot(row.getLabel().getOutcome());
            counts.computeIfAbsent(row.getSymbol(), k -> new int[3])[slot]++;
            all[slot]++;
        }

        List<SymbolStats> symbols = new ArrayList<>();
        for (Map.Entry<String, int[]> entry : counts.entrySet()) {
            symbols.add(stats(entry.getKey(), entry.getValue()));
        }
        return new LabelStatistics(symbols, stats("ALL", all));
    }

    /**
     * Log the distribution at INFO
     */
    public void logDistribution() {
        log.info("Label distribution:");
        for (SymbolStats s : symbols) {
            logLine(s);
        }
        logLine(overall);
    }

    private static void logLine(SymbolStats s) {
        log.info("  {} total={} long={} ({}%) short={} ({}%) neutral={} ({}%)",
            s.getSymbol(), s.getTotal(),
            s.getLongWins(), oneDecimal(s.getLongPercent()),
            s.getShortWins(), oneDecimal(s.getShortPercent()),
            s.getNeutral(), oneDecimal(s.getNeutralPercent()));
    }

    static double oneDecimal(double value) {
        return Math.round(value * 10) / 10.0;
    }

    private static int slot(Label.Outcome outcome) {
        switch (outcome) {
            case LONG_WIN:
                return 0;
            case SHORT_WIN:
                return 1;
            default:
                return 2;
        }
    }

    private static SymbolStats stats(String symbol, int[] c) {
        return new SymbolStats(symbol, c[0] + c[1] + c[2], c[0], c[1], c[2]);
    }
}
