package com.triplebarrier.backtest.util;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.triplebarrier.backtest.model.BacktestReport;
import com.triplebarrier.backtest.optimizer.OptimizationResult;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes reports as pretty-printed JSON.
 * Special floating values are allowed so an infinite profit factor survives serialization.
 */
@Slf4j
public class JsonReportWriter {

    private final Gson gson = new GsonBuilder()
        .setPrettyPrinting()
        .serializeSpecialFloatingPointValues()
        .create();

    public String toJson(BacktestReport report) {
        return gson.toJson(report);
    }

    public String toJson(OptimizationResult result) {
        return gson.toJson(result);
    }

    public Path writeReport(BacktestReport report, Path path) throws IOException {
        return write(toJson(report), path);
    }

    public Path writeOptimization(OptimizationResult result, Path path) throws IOException {
        return write(toJson(result), path);
    }

    private Path write(String json, Path path) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        Files.writeString(path, json);
        log.info("Report written: {}", path.toAbsolutePath());
        return path;
    }
}
