package com.triplebarrier.backtest.util;

import com.triplebarrier.backtest.model.PriceBar;
import com.triplebarrier.backtest.pipeline.InvalidSeriesException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Loads indicator-enriched bars from a multi-symbol CSV file.
 * Header: symbol,timestamp,open,high,low,close,atr,adx,sma_fast,sma_slow,bb_width.
 * Empty indicator cells load as NaN (warm-up bars). Rows keep file order per symbol so that
 * validation can reject out-of-order input instead of silently sorting it.
 */
@Slf4j
public class CsvBarLoader {

    static final CSVFormat FORMAT = CSVFormat.DEFAULT
        .builder()
        .setHeader()
        .setSkipHeaderRecord(true)
        .setIgnoreHeaderCase(true)
        .setTrim(true)
        .build();

    /**
     * Load bars grouped by symbol
     * @param filePath path to CSV file
     * @return bars per symbol (sorted by symbol name), each list in file order
     * @throws IOException if the file cannot be read
     * @throws InvalidSeriesException if a record cannot be parsed
     */
    public Map<String, List<PriceBar>> load(Path filePath) throws IOException {
        log.info("Loading bars from: {}", filePath);
        try (Reader reader = Files.newBufferedReader(filePath)) {
            Map<String, List<PriceBar>> bars = load(reader);
            log.info("Loaded {} bars for {} symbols from {}",
                bars.values().stream().mapToInt(List::size).sum(), bars.size(), filePath);
            return bars;
        }
    }

    /**
     * Load bars grouped by symbol
     * @param reader CSV source
     * @return bars per symbol (sorted by symbol name), each list in file order
     * @throws IOException if the source cannot be read
     */
    public Map<String, List<PriceBar>> load(Reader reader) throws IOException {
        Map<String, List<PriceBar>> bars = new TreeMap<>();

        try (CSVParser csvParser = new CSVParser(reader, FORMAT)) {
            for (CSVRecord record : csvParser) {
                PriceBar bar = parse(record);
                bars.computeIfAbsent(bar.getSymbol(), k -> new ArrayList<>()).add(bar);
            }
        }

        return bars;
    }

    private PriceBar parse(CSVRecord record) {
        String symbol = record.get("symbol");
        try {
            return PriceBar.builder()
                .symbol(symbol)
                .timestamp(Timestamps.parse(record.get("timestamp")))
                .open(Double.parseDouble(record.get("open")))
                .high(Double.parseDouble(record.get("high")))
                .low(Double.parseDouble(record.get("low")))
                .close(Double.parseDouble(record.get("close")))
                .atr(indicator(record, "atr"))
                .adx(indicator(record, "adx"))
                .smaFast(indicator(record, "sma_fast"))
                .smaSlow(indicator(record, "sma_slow"))
                .bbWidth(indicator(record, "bb_width"))
                .build();
        } catch (IllegalArgumentException e) {
            throw new InvalidSeriesException(symbol,
                "unparseable record at line " + record.getRecordNumber() + ": " + e.getMessage());
        }
    }

    private static double indicator(CSVRecord record, String column) {
        if (!record.isMapped(column) || !record.isSet(column)) {
            return Double.NaN;
        }
        String value = record.get(column);
        return value.isEmpty() ? Double.NaN : Double.parseDouble(value);
    }
}
