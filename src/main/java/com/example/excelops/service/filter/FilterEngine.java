package com.example.excelops.service.filter;

import com.example.excelops.service.data.CellValues;
import com.example.excelops.service.data.Dataset;
import com.example.excelops.service.data.NumericNormalizer;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Evaluates a sheet's filter rows into a row subset.
 * <p>
 * Each usable row yields one boolean mask. Masks are folded left to right: the first mask seeds
 * the result and every later mask is AND-ed or OR-ed in according to its own join. There is no
 * grouping, so {@code a OR b AND c} reads as {@code (a OR b) AND c}.
 * <p>
 * Rows naming a column the dataset does not have, or an operator that is not a
 * {@link FilterOperator}, are skipped. A row whose evaluation fails contributes an all-false mask.
 */
@Slf4j
public final class FilterEngine {

    private static final int SUGGESTION_LIMIT = 300;

    private FilterEngine() {
    }

    public static Dataset apply(Dataset dataset, FilterConfig config) {
        return apply(dataset, config == null ? List.of() : config.filters());
    }

    public static Dataset apply(Dataset dataset, List<FilterRow> filterRows) {
        if (dataset == null || dataset.isEmpty() || filterRows == null || filterRows.isEmpty()) {
            return dataset;
        }

        boolean[] result = null;
        for (FilterRow row : filterRows) {
            Optional<boolean[]> mask = maskFor(dataset, row);
            if (mask.isEmpty()) {
                continue;
            }
            if (result == null) {
                result = mask.get();
                continue;
            }
            boolean or = Conjunction.parse(row.join()) == Conjunction.OR;
            boolean[] m = mask.get();
            for (int i = 0; i < result.length; i++) {
                result[i] = or ? result[i] || m[i] : result[i] && m[i];
            }
        }

        if (result == null) {
            return dataset;
        }
        return dataset.filterRows(result);
    }

    /**
     * Mask for one filter row, or empty when the row is not usable against this dataset.
     */
    static Optional<boolean[]> maskFor(Dataset dataset, FilterRow row) {
        if (row.column().isBlank() || !dataset.hasColumn(row.column())) {
            log.debug("Skipping filter on missing column '{}'", row.column());
            return Optional.empty();
        }
        Optional<FilterOperator> resolved = FilterOperator.fromSymbol(row.operator());
        if (resolved.isEmpty()) {
            log.debug("Skipping filter with unknown operator '{}'", row.operator());
            return Optional.empty();
        }
        FilterOperator op = resolved.get();
        if (op.isColumnComparison() && !dataset.hasColumn(row.compareColumn())) {
            log.debug("Skipping column comparison against missing column '{}'", row.compareColumn());
            return Optional.empty();
        }

        try {
            return Optional.of(evaluate(dataset, row, op));
        } catch (RuntimeException e) {
            log.debug("Filter on '{}' failed, excluding all rows: {}", row.column(), e.getMessage());
            return Optional.of(new boolean[dataset.rowCount()]);
        }
    }

    private static boolean[] evaluate(Dataset dataset, FilterRow row, FilterOperator op) {
        List<Object> cells = dataset.column(row.column());
        boolean[] mask = new boolean[cells.size()];

        if (op.isColumnComparison()) {
            List<Object> other = dataset.column(row.compareColumn());
            for (int i = 0; i < mask.length; i++) {
                boolean same = CellValues.asText(cells.get(i)).equals(CellValues.asText(other.get(i)));
                mask[i] = op == FilterOperator.COLUMN_EQ ? same : !same;
            }
            return mask;
        }

        if (op == FilterOperator.CONTAINS) {
            String needle = row.value().toLowerCase(Locale.ROOT);
            for (int i = 0; i < mask.length; i++) {
                Object cell = cells.get(i);
                mask[i] = cell != null && CellValues.asText(cell).toLowerCase(Locale.ROOT).contains(needle);
            }
            return mask;
        }

        if (op == FilterOperator.IN) {
            Set<String> accepted = new LinkedHashSet<>();
            for (String part : row.value().split(",")) {
                if (!part.isBlank()) {
                    accepted.add(part.trim());
                }
            }
            for (int i = 0; i < mask.length; i++) {
                mask[i] = accepted.contains(CellValues.asText(cells.get(i)));
            }
            return mask;
        }

        if (row.usesColumnAverage()) {
            List<Double> numbers = NumericNormalizer.normalize(cells);
            Double mean = NumericNormalizer.mean(numbers);
            if (mean == null) {
                return mask;
            }
            for (int i = 0; i < mask.length; i++) {
                mask[i] = op.test(numbers.get(i), mean);
            }
            return mask;
        }

        Double literal = NumericNormalizer.parseLiteral(row.value());
        if (literal != null) {
            List<Double> numbers = NumericNormalizer.normalize(cells);
            for (int i = 0; i < mask.length; i++) {
                mask[i] = op.test(numbers.get(i), literal);
            }
            return mask;
        }

        if (op == FilterOperator.EQ || op == FilterOperator.NE) {
            for (int i = 0; i < mask.length; i++) {
                boolean same = CellValues.asText(cells.get(i)).equals(row.value());
                mask[i] = op == FilterOperator.EQ ? same : !same;
            }
            return mask;
        }

        // ordering against a non-numeric literal
        Arrays.fill(mask, false);
        return mask;
    }

    /**
     * Choices offered for a filter value: the column-average sentinel followed by the column's
     * distinct non-empty cell texts in first-seen order.
     */
    public static List<String> suggestValues(Dataset dataset, String column) {
        List<String> out = new ArrayList<>();
        if (dataset == null || !dataset.hasColumn(column)) {
            return out;
        }
        out.add(FilterRow.COLUMN_AVERAGE);
        Set<String> distinct = new LinkedHashSet<>();
        for (Object cell : dataset.column(column)) {
            if (cell == null) {
                continue;
            }
            distinct.add(CellValues.asText(cell));
            if (distinct.size() >= SUGGESTION_LIMIT) {
                break;
            }
        }
        out.addAll(distinct);
        return out;
    }
}
