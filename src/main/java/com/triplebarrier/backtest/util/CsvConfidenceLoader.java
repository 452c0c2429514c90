package com.triplebarrier.backtest.util;

import com.triplebarrier.backtest.confidence.PrecomputedConfidenceSource;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads model scores (symbol,timestamp,confidence).
 * A confidence cell that is missing or not a number is kept as NaN so the simulator records the skip.
 * Records without a symbol or a parseable timestamp are logged and ignored.
 */
@Slf4j
public class CsvConfidenceLoader {

    /**
     * Load scores from file
     * @param filePath path to CSV file
     * @return score lookup
     * @throws IOException if the file cannot be read
     */
    public PrecomputedConfidenceSource load(Path filePath) throws IOException {
        log.info("Loading confidence scores from: {}", filePath);
        try (Reader reader = Files.newBufferedReader(filePath)) {
            PrecomputedConfidenceSource source = load(reader);
            log.info("Loaded {} confidence scores from {}", source.size(), filePath);
            return source;
        }
    }

    /**
     * Load scores
     * @param reader CSV source
     * @return score lookup
     * @throws IOException if the source cannot be read
     */
    public PrecomputedConfidenceSource load(Reader reader) throws IOException {
        PrecomputedConfidenceSource source = new PrecomputedConfidenceSource();

        try (CSVParser csvParser = new CSVParser(reader, CsvBarLoader.FORMAT)) {
            for (CSVRecord record : csvParser) {
                if (!record.isSet("symbol") || !record.isSet("timestamp")) {
                    log.warn("Skipping record at line {}: missing symbol or timestamp", record.getRecordNumber());
                    continue;
                }
                long timestamp;
                try {
                    timestamp = Timestamps.parse(record.get("timestamp"));
                } catch (IllegalArgumentException e) {
                    log.warn("Failed to parse timestamp at line {}: {}", record.getRecordNumber(), e.getMessage());
                    continue;
                }
                double confidence = record.isSet("confidence") ? parseConfidence(record.get("confidence")) : Double.NaN;
                source.put(record.get("symbol"), timestamp, confidence);
            }
        }

        return source;
    }

    private static double parseConfidence(String value) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }
}
