package com.triplebarrier.backtest.config;

import io.github.cdimascio.dotenv.Dotenv;
import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Immutable run configuration.
 * Loaded once from the .env file (or built directly) and passed into every component call,
 * so per-symbol workers and threshold sweeps never share mutable settings.
 */
@Value
@Builder(toBuilder = true)
@Slf4j
public class Config {

    public static final List<Double> DEFAULT_CANDIDATE_THRESHOLDS =
        List.of(0.50, 0.55, 0.60, 0.65, 0.70, 0.75, 0.80);

    // Input / output
    @Builder.Default String barsFile = "./data/bars.csv";
    @Builder.Default String confidenceFile = "";
    @Builder.Default String outputDir = "./data/backtests";

    // Regime classification
    @Builder.Default int atrMeanWindow = 60;
    @Builder.Default int fastSlopeLookback = 5;
    @Builder.Default int slowSlopeLookback = 10;
    @Builder.Default int breakoutLookback = 20;
    @Builder.Default double trendingAdxThreshold = 25.0;
    @Builder.Default int consolidationMinDays = 5;
    // bar range below this many ATRs counts as a consolidation bar
    @Builder.Default double narrowRangeAtrFactor = 0.5;

    @Builder.Default double lowVolBound = 0.8;
    @Builder.Default double midVolBound = 1.2;
    @Builder.Default double highVolBound = 1.5;

    @Builder.Default double weakTrendAdx = 20.0;
    @Builder.Default double strongTrendAdx = 30.0;
    @Builder.Default double veryStrongTrendAdx = 40.0;

    // Barriers
    @Builder.Default double baseTpMultiple = 1.8;
    @Builder.Default double trendTpMultiple = 2.5;
    @Builder.Default double lowVolTpMultiple = 1.5;
    @Builder.Default double slMultiple = 1.0;
    @Builder.Default int minHorizon = 3;
    @Builder.Default int maxHorizon = 10;
    @Builder.Default double extremeVolHorizonFactor = 0.5;
    @Builder.Default double lowVolHorizonFactor = 1.3;

    // Simulation
    @Builder.Default double initialEquity = 10_000.0;
    @Builder.Default double riskPerTrade = 0.01;
    @Builder.Default double confidenceThreshold = 0.7;
    @Builder.Default boolean excludeNeutralLabels = false;

    // Threshold sweep
    @Builder.Default List<Double> candidateThresholds = DEFAULT_CANDIDATE_THRESHOLDS;
    @Builder.Default Objective objective = Objective.PROFIT_FACTOR;
    @Builder.Default int parallelism = Runtime.getRuntime().availableProcessors();

    /**
     * Ranking objective used by the threshold sweep
     */
    public enum Objective {
        PROFIT_FACTOR, WIN_RATE, AVERAGE_R, TOTAL_RETURN, SHARPE
    }

    /**
     * Configuration with every documented default
     * @return default config
     */
    public static Config defaults() {
        return Config.builder().build();
    }

    /**
     * Load configuration from .env (missing file is fine) and the process environment
     * @return validated config
     */
    public static Config fromEnv() {
        Dotenv dotenv = Dotenv.configure()
            .ignoreIfMissing()
            .load();
        return fromDotenv(dotenv);
    }

    /**
     * Load configuration from an already opened dotenv source
     * @param dotenv key/value source
     * @return validated config
     */
    public static Config fromDotenv(Dotenv dotenv) {
        EnvReader env = new EnvReader(dotenv);
        Config d = defaults();

        Config config = Config.builder()
            .barsFile(env.string("BARS_FILE", d.barsFile))
            .confidenceFile(env.string("CONFIDENCE_FILE", d.confidenceFile))
            .outputDir(env.string("OUTPUT_DIR", d.outputDir))

            .atrMeanWindow(env.integer("ATR_MEAN_WINDOW", d.atrMeanWindow))
            .fastSlopeLookback(env.integer("FAST_SLOPE_LOOKBACK", d.fastSlopeLookback))
            .slowSlopeLookback(env.integer("SLOW_SLOPE_LOOKBACK", d.slowSlopeLookback))
            .breakoutLookback(env.integer("BREAKOUT_LOOKBACK", d.breakoutLookback))
            .trendingAdxThreshold(env.decimal("TRENDING_ADX_THRESHOLD", d.trendingAdxThreshold))
            .consolidationMinDays(env.integer("CONSOLIDATION_MIN_DAYS", d.consolidationMinDays))
            .narrowRangeAtrFactor(env.decimal("NARROW_RANGE_ATR_FACTOR", d.narrowRangeAtrFactor))
            .lowVolBound(env.decimal("LOW_VOL_BOUND", d.lowVolBound))
            .midVolBound(env.decimal("MID_VOL_BOUND", d.midVolBound))
            .highVolBound(env.decimal("HIGH_VOL_BOUND", d.highVolBound))
            .weakTrendAdx(env.decimal("WEAK_TREND_ADX", d.weakTrendAdx))
            .strongTrendAdx(env.decimal("STRONG_TREND_ADX", d.strongTrendAdx))
            .veryStrongTrendAdx(env.decimal("VERY_STRONG_TREND_ADX", d.veryStrongTrendAdx))

            .baseTpMultiple(env.decimal("BASE_TP_MULTIPLE", d.baseTpMultiple))
            .trendTpMultiple(env.decimal("TREND_TP_MULTIPLE", d.trendTpMultiple))
            .lowVolTpMultiple(env.decimal("LOW_VOL_TP_MULTIPLE", d.lowVolTpMultiple))
            .slMultiple(env.decimal("SL_MULTIPLE", d.slMultiple))
            .minHorizon(env.integer("MIN_HORIZON", d.minHorizon))
            .maxHorizon(env.integer("MAX_HORIZON", d.maxHorizon))
            .extremeVolHorizonFactor(env.decimal("EXTREME_VOL_HORIZON_FACTOR", d.extremeVolHorizonFactor))
            .lowVolHorizonFactor(env.decimal("LOW_VOL_HORIZON_FACTOR", d.lowVolHorizonFactor))

            .initialEquity(env.decimal("INITIAL_EQUITY", d.initialEquity))
            .riskPerTrade(env.decimal("RISK_PER_TRADE", d.riskPerTrade))
            .confidenceThreshold(env.decimal("CONFIDENCE_THRESHOLD", d.confidenceThreshold))
            .excludeNeutralLabels(env.bool("EXCLUDE_NEUTRAL_LABELS", d.excludeNeutralLabels))

            .candidateThresholds(env.decimals("CANDIDATE_THRESHOLDS", d.candidateThresholds))
            .objective(env.objective("OPTIMIZATION_OBJECTIVE", d.objective))
            .parallelism(env.integer("PARALLELISM", d.parallelism))
            .build();

        config.validate();
        config.logConfiguration();
        return config;
    }

    /**
     * Reject settings no component can run with
     * @return this config
     * @throws IllegalArgumentException on the first invalid setting
     */
    public Config validate() {
        require(atrMeanWindow >= 1, "ATR mean window must be >= 1: " + atrMeanWindow);
        require(fastSlopeLookback >= 1 && slowSlopeLookback >= 1, "slope lookbacks must be >= 1");
        require(breakoutLookback >= 1, "breakout lookback must be >= 1: " + breakoutLookback);
        require(narrowRangeAtrFactor > 0, "narrow range ATR factor must be positive: " + narrowRangeAtrFactor);
        require(lowVolBound <= midVolBound && midVolBound <= highVolBound,
            "volatility bounds must be ascending: " + lowVolBound + "/" + midVolBound + "/" + highVolBound);
        require(weakTrendAdx <= strongTrendAdx && strongTrendAdx <= veryStrongTrendAdx,
            "ADX bounds must be ascending: " + weakTrendAdx + "/" + strongTrendAdx + "/" + veryStrongTrendAdx);
        require(baseTpMultiple > 0 && trendTpMultiple > 0 && lowVolTpMultiple > 0,
            "take-profit multiples must be positive");
        require(slMultiple > 0, "stop-loss multiple must be positive: " + slMultiple);
        require(minHorizon >= 1, "min horizon must be >= 1: " + minHorizon);
        require(minHorizon <= maxHorizon, "min horizon " + minHorizon + " exceeds max horizon " + maxHorizon);
        require(extremeVolHorizonFactor > 0 && lowVolHorizonFactor > 0, "horizon factors must be positive");
        require(initialEquity > 0, "initial equity must be positive: " + initialEquity);
        require(riskPerTrade > 0 && riskPerTrade < 1, "risk per trade must be in (0,1): " + riskPerTrade);
        require(isValidThreshold(confidenceThreshold), "confidence threshold must be in [0.5,1]: " + confidenceThreshold);
        require(candidateThresholds != null && !candidateThresholds.isEmpty(), "candidate thresholds must not be empty");
        for (Double candidate : candidateThresholds) {
            require(candidate != null && isValidThreshold(candidate), "candidate threshold must be in [0.5,1]: " + candidate);
        }
        require(objective != null, "objective must be set");
        require(parallelism >= 1, "parallelism must be >= 1: " + parallelism);
        return this;
    }

    /**
     * Check if a confidence file is configured
     * @return true if the backtest stage should run
     */
    public boolean hasConfidenceFile() {
        return confidenceFile != null && !confidenceFile.isBlank();
    }

    private static boolean isValidThreshold(double threshold) {
        return threshold >= 0.5 && threshold <= 1.0;
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    /**
     * Log current configuration
     */
    private void logConfiguration() {
        log.info("=== BACKTEST CONFIGURATION ===");
        log.info("Bars File: {}", barsFile);
        log.info("Confidence File: {}", hasConfidenceFile() ? confidenceFile : "Not set");
        log.info("Output Directory: {}", outputDir);
        log.info("Regime: atrMeanWindow={}, slopes={}/{}, breakout={}, trendingAdx={}, narrowRange={}",
            atrMeanWindow, fastSlopeLookback, slowSlopeLookback, breakoutLookback, trendingAdxThreshold,
            narrowRangeAtrFactor);
        log.info("Barriers: TP base={} trend={} lowVol={}, SL={}, horizon=[{},{}]",
            baseTpMultiple, trendTpMultiple, lowVolTpMultiple, slMultiple, minHorizon, maxHorizon);
        log.info("Simulation: equity={}, risk={}, threshold={}, excludeNeutral={}",
            initialEquity, riskPerTrade, confidenceThreshold, excludeNeutralLabels);
        log.info("Sweep: candidates={}, objective={}, parallelism={}", candidateThresholds, objective, parallelism);
        log.info("==============================");
    }

    /**
     * Typed lookups with defaults over a dotenv source.
     * Malformed values fall back to the default with a warning.
     */
    private static final class EnvReader {

        private final Dotenv dotenv;

        private EnvReader(Dotenv dotenv) {
            this.dotenv = dotenv;
        }

        private String string(String key, String defaultValue) {
            String value = dotenv.get(key);
            return value != null ? value.trim() : defaultValue;
        }

        private int integer(String key, int defaultValue) {
            String value = dotenv.get(key);
            if (value == null)
                return defaultValue;
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                log.warn("Invalid integer for {}: {}, using default: {}", key, value, defaultValue);
                return defaultValue;
            }
        }

        private double decimal(String key, double defaultValue) {
            String value = dotenv.get(key);
            if (value == null)
                return defaultValue;
            try {
                return Double.parseDouble(value.trim());
            } catch (NumberFormatException e) {
                log.warn("Invalid double for {}: {}, using default: {}", key, value, defaultValue);
                return defaultValue;
            }
        }

        private boolean bool(String key, boolean defaultValue) {
            String value = dotenv.get(key);
            if (value == null)
                return defaultValue;
            return Boolean.parseBoolean(value.trim());
        }

        private List<Double> decimals(String key, List<Double> defaultValue) {
            String value = dotenv.get(key);
            if (value == null || value.trim().isEmpty()) {
                return defaultValue;
            }
            try {
                return Arrays.stream(value.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .map(Double::parseDouble)
                    .collect(Collectors.toUnmodifiableList());
            } catch (NumberFormatException e) {
                log.warn("Invalid number list for {}: {}, using default: {}", key, value, defaultValue);
                return defaultValue;
            }
        }

        private Objective objective(String key, Objective defaultValue) {
            String value = dotenv.get(key);
            if (value == null)
                return defaultValue;
            try {
                return Objective.valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                log.warn("Invalid objective for {}: {}, using default: {}", key, value, defaultValue);
                return defaultValue;
            }
        }
    }
}
