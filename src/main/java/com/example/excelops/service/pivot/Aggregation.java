package com.example.excelops.service.pivot;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;

public enum Aggregation {
    SUM,
    MEAN,
    COUNT,
    MIN,
    MAX;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Aggregation parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return SUM;
        }
        String s = raw.trim().toUpperCase(Locale.ROOT);
        if (s.equals("AVG") || s.equals("AVERAGE")) {
            return MEAN;
        }
        try {
            return valueOf(s);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported aggregation: " + raw, e);
        }
    }

    /**
     * Aggregates one cell group. {@code numbers} holds the normalized values, {@code present}
     * how many raw cells were non-null. Empty groups aggregate to 0.
     */
    public double apply(List<Double> numbers, int present) {
        if (this == COUNT) {
            return present;
        }
        double sum = 0;
        int n = 0;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (Double d : numbers) {
            if (d == null) {
                continue;
            }
            sum += d;
            n++;
            min = Math.min(min, d);
            max = Math.max(max, d);
        }
        if (n == 0) {
            return 0;
        }
        return switch (this) {
            case SUM -> sum;
            case MEAN -> sum / n;
            case MIN -> min;
            case MAX -> max;
            case COUNT -> present;
        };
    }
}
