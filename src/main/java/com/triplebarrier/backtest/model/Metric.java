package com.triplebarrier.backtest.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Locale;

/**
 * A ratio-style metric with an explicit sentinel instead of a silent NaN or a division crash.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Metric {

    public enum Status {
        DEFINED, POSITIVE_INFINITY, UNDEFINED
    }

    private static final Metric INFINITE = new Metric(Status.POSITIVE_INFINITY, Double.POSITIVE_INFINITY, null);

    Status status;
    double value;

    /**
     * Why the metric is undefined (null otherwise)
     */
    String note;

    public static Metric of(double value) {
        if (Double.isNaN(value)) {
            return undefined("not a number");
        }
        if (value == Double.POSITIVE_INFINITY) {
            return INFINITE;
        }
        return new Metric(Status.DEFINED, value, null);
    }

    public static Metric infinite() {
        return INFINITE;
    }

    public static Metric undefined(String note) {
        return new Metric(Status.UNDEFINED, Double.NaN, note);
    }

    public boolean isDefined() {
        return status == Status.DEFINED;
    }

    public boolean isInfinite() {
        return status == Status.POSITIVE_INFINITY;
    }

    public boolean isUndefined() {
        return status == Status.UNDEFINED;
    }

    /**
     * Value for ranking: +inf ranks above everything, undefined below everything
     * @return comparable value
     */
    public double rankValue() {
        switch (status) {
            case POSITIVE_INFINITY:
                return Double.POSITIVE_INFINITY;
            case UNDEFINED:
                return Double.NEGATIVE_INFINITY;
            default:
                return value;
        }
    }

    @Override
    public String toString() {
        switch (status) {
            case POSITIVE_INFINITY:
                return "+inf";
            case UNDEFINED:
                return "n/a";
            default:
                return String.format(Locale.ROOT, "%.4f", value);
        }
    }
}
