package com.triplebarrier.backtest;

import static com.triplebarrier.backtest.TestData.flatSeries;
import static com.triplebarrier.backtest.TestData.setRange;
import static org.assertj.core.api.Assertions.assertThat;

import com.triplebarrier.backtest.config.Config;
import com.triplebarrier.backtest.model.PriceBar;
import com.triplebarrier.backtest.util.Timestamps;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MainTest {

    @TempDir
    Path dir;

    @Test
    void run_writesLabelBacktestAndSweepOutputs() throws IOException {
        List<PriceBar> bars = flatSeries("BTC", 80);
        setRange(bars, 62, 101.9, 99.9);

        StringBuilder barCsv = new StringBuilder("symbol,timestamp,open,high,low,close,atr,adx,sma_fast,sma_slow,bb_width\n");
        StringBuilder scoreCsv = new StringBuilder("symbol,timestamp,confidence\n");
        for (PriceBar bar : bars) {
            String timestamp = Timestamps.format(bar.getTimestamp());
            barCsv.append(String.join(",", bar.getSymbol(), timestamp,
                    "100", String.valueOf(bar.getHigh()), String.valueOf(bar.getLow()), "100",
                    "1", "15", "100", "100", "2"))
                .append('\n');
            scoreCsv.append("BTC,").append(timestamp).append(",0.9\n");
        }
        Files.writeString(dir.resolve("bars.csv"), barCsv);
        Files.writeString(dir.resolve("scores.csv"), scoreCsv);

        Path out = dir.resolve("out");
        Config config = Config.builder()
            .barsFile(dir.resolve("bars.csv").toString())
            .confidenceFile(dir.resolve("scores.csv").toString())
            .outputDir(out.toString())
            .parallelism(1)
            .build();

        new Main().run(config);

        assertThat(Files.readAllLines(out.resolve("labeled_rows.csv"))).hasSize(12);
        assertThat(Files.readAllLines(out.resolve("trades.csv"))).hasSize(12);
        assertThat(out.resolve("equity_curve.csv")).exists();
        assertThat(out.resolve("skipped_rows.csv")).exists();
        assertThat(Files.readString(out.resolve("report.json"))).contains("\"tradeCount\": 11");
        assertThat(Files.readAllLines(out.resolve("threshold_sweep.csv")))
            .hasSize(Config.DEFAULT_CANDIDATE_THRESHOLDS.size() + 1);
        assertThat(out.resolve("optimization.json")).exists();
    }
}
