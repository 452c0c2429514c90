package com.triplebarrier.backtest.engine;

import static com.triplebarrier.backtest.TestData.scored;
import static org.assertj.core.api.Assertions.assertThat;

import com.triplebarrier.backtest.model.Label.Outcome;
import com.triplebarrier.backtest.model.ScoredRow;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.junit.jupiter.api.Test;

class ChronologicalMergerTest {

    @Test
    void merge_ordersByTimestampThenSymbol() {
        ScoredRow eth0 = scored("ETH", 0, Outcome.LONG_WIN, 0.8);
        ScoredRow btc0 = scored("BTC", 0, Outcome.LONG_WIN, 0.8);
        ScoredRow btc1 = scored("BTC", 1, Outcome.LONG_WIN, 0.8);
        ScoredRow sol2 = scored("SOL", 2, Outcome.LONG_WIN, 0.8);

        List<ScoredRow> merged = ChronologicalMerger.merge(List.of(sol2, btc1, eth0, btc0));

        assertThat(merged).containsExactly(btc0, eth0, btc1, sol2);
    }

    @Test
    void mergeSorted_interleavesSortedStreams() {
        Map<String, List<ScoredRow>> streams = new TreeMap<>();
        streams.put("BTC", List.of(
            scored("BTC", 0, Outcome.NEUTRAL, 0.5),
            scored("BTC", 3, Outcome.NEUTRAL, 0.5)));
        streams.put("ETH", List.of(
            scored("ETH", 1, Outcome.NEUTRAL, 0.5),
            scored("ETH", 2, Outcome.NEUTRAL, 0.5),
            scored("ETH", 4, Outcome.NEUTRAL, 0.5)));
        streams.put("SOL", List.of());

        List<ScoredRow> merged = ChronologicalMerger.mergeSorted(streams);

        assertThat(merged).extracting(ScoredRow::getSymbol).containsExactly("BTC", "ETH", "ETH", "BTC", "ETH");
        assertThat(merged).isSortedAccordingTo(ChronologicalMerger.ORDER);
    }

    @Test
    void merge_empty_isEmpty() {
        assertThat(ChronologicalMerger.merge(List.of())).isEmpty();
    }
}
