package com.example.excelops.service.io;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Guesses the delimiter of a CSV sample.
 * <p>
 * The candidate occurring most often in the header line wins. When none occurs there, each
 * candidate is scored by the median field count over the sample lines, ties going to the lower
 * variance; a best median of one field means no delimiter was found.
 */
public final class CsvDelimiterDetector {

    public static final List<Character> CANDIDATES = List.of(',', ';', '\t', '|');

    private CsvDelimiterDetector() {
    }

    public static Optional<Character> detect(List<String> sampleLines) {
        if (sampleLines == null || sampleLines.isEmpty()) {
            return Optional.empty();
        }
        String header = sampleLines.get(0);
        Character bestHeader = null;
        long bestHeaderCount = 0;
        for (Character candidate : CANDIDATES) {
            long count = header.chars().filter(ch -> ch == candidate).count();
            if (count > bestHeaderCount) {
                bestHeader = candidate;
                bestHeaderCount = count;
            }
        }
        if (bestHeader != null) {
            return Optional.of(bestHeader);
        }

        Character best = null;
        int bestMedian = 1;
        double bestVariance = Double.POSITIVE_INFINITY;
        String sample = String.join("\n", sampleLines);
        for (Character candidate : CANDIDATES) {
            List<Integer> counts = fieldCounts(sample, candidate);
            if (counts.isEmpty()) {
                continue;
            }
            Collections.sort(counts);
            int median = counts.get(counts.size() / 2);
            double variance = 0;
            for (int c : counts) {
                variance += (double) (c - median) * (c - median);
            }
            variance /= counts.size();
            if (median > bestMedian || (median == bestMedian && variance < bestVariance)) {
                best = candidate;
                bestMedian = median;
                bestVariance = variance;
            }
        }
        if (best == null || bestMedian <= 1) {
            return Optional.empty();
        }
        return Optional.of(best);
    }

    private static List<Integer> fieldCounts(String sample, char delimiter) {
        List<Integer> counts = new ArrayList<>();
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setDelimiter(delimiter)
                .build();
        try (CSVParser parser = CSVParser.parse(new StringReader(sample), format)) {
            for (CSVRecord record : parser) {
                counts.add(record.size());
            }
        } catch (IOException | RuntimeException e) {
            return List.of();
        }
        return counts;
    }
}
