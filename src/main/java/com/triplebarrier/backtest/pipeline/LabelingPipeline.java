package com.triplebarrier.backtest.pipeline;

import com.triplebarrier.backtest.config.Config;
import com.triplebarrier.backtest.label.LabelEngine;
import com.triplebarrier.backtest.model.Label;
import com.triplebarrier.backtest.model.LabeledRow;
import com.triplebarrier.backtest.model.PriceBar;
import com.triplebarrier.backtest.model.RegimeTag;
import com.triplebarrier.backtest.regime.RegimeClassifier;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Regime classification and labeling for all symbols.
 * Every symbol series is self-contained, so symbols are processed on a worker pool and the
 * results reassembled in (symbol, timestamp) order.
 */
@Slf4j
public class LabelingPipeline {

    private final Config config;
    private final RegimeClassifier classifier;
    private final LabelEngine labelEngine;

    public LabelingPipeline(Config config) {
        this.config = config;
        this.classifier = new RegimeClassifier(config);
        this.labelEngine = new LabelEngine(config);
    }

    /**
     * Validate, classify and label every series
     * @param seriesBySymbol bars keyed by symbol, each in file order
     * @return labeled rows ordered by symbol, then timestamp
     * @throws InvalidSeriesException if any series is malformed; no work is done in that case
     */
    public List<LabeledRow> run(Map<String, List<PriceBar>> seriesBySymbol) {
        SeriesValidator.validateAll(seriesBySymbol);

        Map<String, List<PriceBar>> ordered = new TreeMap<>(seriesBySymbol);
        Map<String, List<LabeledRow>> bySymbol = new LinkedHashMap<>();

        int workers = Math.max(1, Math.min(config.getParallelism(), ordered.size()));
        if (workers == 1) {
            for (Map.Entry<String, List<PriceBar>> entry : ordered.entrySet()) {
                bySymbol.put(entry.getKey(), labelSymbol(entry.getValue()));
            }
        } else {
            ExecutorService executor = Executors.newFixedThreadPool(workers);
            try {
                Map<String, Future<List<LabeledRow>>> futures = new LinkedHashMap<>();
                for (Map.Entry<String, List<PriceBar>> entry : ordered.entrySet()) {
                    List<PriceBar> series = entry.getValue();
                    futures.put(entry.getKey(), executor.submit(() -> labelSymbol(series)));
                }
                for (Map.Entry<String, Future<List<LabeledRow>>> entry : futures.entrySet()) {
                    bySymbol.put(entry.getKey(), entry.getValue().get());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Labeling interrupted", e);
            } catch (ExecutionException e) {
                throw new IllegalStateException("Labeling failed", e.getCause());
            } finally {
                executor.shutdown();
            }
        }

        List<LabeledRow> rows = new ArrayList<>();
        for (Map.Entry<String, List<LabeledRow>> entry : bySymbol.entrySet()) {
            log.info("{}: {} bars -> {} labeled rows", entry.getKey(),
                ordered.get(entry.getKey()).size(), entry.getValue().size());
            rows.addAll(entry.getValue());
        }
        return rows;
    }

    /**
     * Classify and label a single validated series
     * @param series one symbol's bars
     * @return labeled rows in timestamp order
     */
    public List<LabeledRow> labelSymbol(List<PriceBar> series) {
        List<RegimeTag> tags = classifier.classify(series);
        List<Label> labels = labelEngine.labelSeries(series, tags);

        List<LabeledRow> rows = new ArrayList<>(labels.size());
        for (Label label : labels) {
            int origin = label.getOriginIndex();
            rows.add(new LabeledRow(series.get(origin), tags.get(origin), label));
        }
        return rows;
    }
}
