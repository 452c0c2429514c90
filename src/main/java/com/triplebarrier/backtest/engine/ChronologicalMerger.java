package com.triplebarrier.backtest.engine;

import com.triplebarrier.backtest.model.ScoredRow;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.TreeMap;

/**
 * K-way merge of per-symbol row streams into one chronological stream.
 * Equal timestamps are ordered by symbol, then by origin index, so the result is deterministic.
 */
public final class ChronologicalMerger {

    static final Comparator<ScoredRow> ORDER = Comparator
        .comparingLong(ScoredRow::getTimestamp)
        .thenComparing(ScoredRow::getSymbol)
        .thenComparingInt(r -> r.getLabel().getOriginIndex());

    private ChronologicalMerger() {
    }

    /**
     * Merge rows of any order
     * @param rows scored rows of one or many symbols
     * @return rows in chronological order
     */
    public static List<ScoredRow> merge(List<ScoredRow> rows) {
        Map<String, List<ScoredRow>> bySymbol = new TreeMap<>();
        for (ScoredRow row : rows) {
            bySymbol.computeIfAbsent(row.getSymbol(), k -> new ArrayList<>()).add(row);
        }
        for (List<ScoredRow> stream : bySymbol.values()) {
            stream.sort(ORDER);
        }
        return mergeSorted(bySymbol);
    }

    /**
     * Merge streams that are each already chronological
     * @param streams per-symbol streams, each sorted by timestamp
     * @return rows in chronological order
     */
    public static List<ScoredRow> mergeSorted(Map<String, List<ScoredRow>> streams) {
        PriorityQueue<Cursor> heads = new PriorityQueue<>(
            Comparator.comparing((Cursor c) -> c.current(), ORDER));
        int total = 0;
        for (List<ScoredRow> stream : streams.values()) {
            total += stream.size();
            if (!stream.isEmpty()) {
                heads.add(new Cursor(stream));
            }
        }

        List<ScoredRow> merged = new ArrayList<>(total);
        while (!heads.isEmpty()) {
            Cursor head = heads.poll();
            merged.add(head.current());
            if (head.advance()) {
                heads.add(head);
            }
        }
        return merged;
    }

    private static final class Cursor {
        private final List<ScoredRow> rows;
        private int position;

        private Cursor(List<ScoredRow> rows) {
            this.rows = rows;
        }

        private ScoredRow current() {
            return rows.get(position);
        }

        private boolean advance() {
            position++;
            return position < rows.size();
        }
    }
}
