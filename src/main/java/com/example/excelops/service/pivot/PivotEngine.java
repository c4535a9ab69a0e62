package com.example.excelops.service.pivot;

import com.example.excelops.service.data.CellValues;
import com.example.excelops.service.data.Dataset;
import com.example.excelops.service.data.NumericNormalizer;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds a flat cross-tab from a dataset.
 * <p>
 * Output rows are the distinct row-key combinations in sorted order. Without value columns each
 * cell counts occurrences (a single {@code Count} column when no column keys are chosen). With value
 * columns each cell aggregates that column, one output column per value column, or one per
 * (value column, column-key combination) named {@code value | key1 | key2}. Missing combinations
 * are 0. Input rows with an empty key cell do not take part.
 */
public final class PivotEngine {

    public static final String COUNT_COLUMN = "Count";
    public static final String HEADER_SEPARATOR = " | ";

    private PivotEngine() {
    }

    /**
     * @return the pivot, or empty when no usable row key is selected
     */
    public static Optional<Dataset> build(Dataset dataset, PivotSpec spec) {
        if (dataset == null || spec == null) {
            return Optional.empty();
        }
        List<String> rowKeys = present(dataset, spec.rows(), List.of());
        if (rowKeys.isEmpty()) {
            return Optional.empty();
        }
        List<String> colKeys = present(dataset, spec.columns(), rowKeys);
        List<String> excluded = new ArrayList<>(rowKeys);
        excluded.addAll(colKeys);
        List<String> values = present(dataset, spec.values(), excluded);

        Map<List<Object>, Map<List<Object>, List<List<Object>>>> groups = new LinkedHashMap<>();
        Map<List<Object>, Boolean> allColumnKeys = new LinkedHashMap<>();
        for (int r = 0; r < dataset.rowCount(); r++) {
            List<Object> rowKey = keyOf(dataset, r, rowKeys);
            List<Object> colKey = keyOf(dataset, r, colKeys);
            if (rowKey == null || colKey == null) {
                continue;
            }
            allColumnKeys.put(colKey, Boolean.TRUE);
            List<List<Object>> cells = groups
                    .computeIfAbsent(rowKey, k -> new LinkedHashMap<>())
                    .computeIfAbsent(colKey, k -> newCellLists(values.size()));
            for (int v = 0; v < values.size(); v++) {
                cells.get(v).add(dataset.value(r, values.get(v)));
            }
            if (values.isEmpty()) {
                cells.get(0).add(Boolean.TRUE);
            }
        }

        List<List<Object>> sortedRowKeys = new ArrayList<>(groups.keySet());
        sortedRowKeys.sort(tupleComparator(dataset, rowKeys));
        List<List<Object>> sortedColKeys = new ArrayList<>(allColumnKeys.keySet());
        sortedColKeys.sort(tupleComparator(dataset, colKeys));

        List<String> header = new ArrayList<>(rowKeys);
        if (values.isEmpty()) {
            if (colKeys.isEmpty()) {
                header.add(COUNT_COLUMN);
            } else {
                for (List<Object> colKey : sortedColKeys) {
                    header.add(label(colKey));
                }
            }
        } else if (colKeys.isEmpty()) {
            header.addAll(values);
        } else {
            for (String value : values) {
                for (List<Object> colKey : sortedColKeys) {
                    header.add(value + HEADER_SEPARATOR + label(colKey));
                }
            }
        }

        List<List<Object>> out = new ArrayList<>(sortedRowKeys.size());
        for (List<Object> rowKey : sortedRowKeys) {
            Map<List<Object>, List<List<Object>>> byColumn = groups.get(rowKey);
            List<Object> line = new ArrayList<>(rowKey);
            if (values.isEmpty()) {
                for (List<Object> colKey : sortedColKeys) {
                    List<List<Object>> cells = byColumn.get(colKey);
                    line.add(cells == null ? 0L : (long) cells.get(0).size());
                }
            } else {
                for (int v = 0; v < values.size(); v++) {
                    for (List<Object> colKey : sortedColKeys) {
                        List<List<Object>> cells = byColumn.get(colKey);
                        line.add(cells == null ? zero(spec.agg()) : aggregate(cells.get(v), spec.agg()));
                    }
                }
            }
            out.add(line);
        }
        return Optional.of(new Dataset(header, out));
    }

    private static Object aggregate(List<Object> cells, Aggregation aggregation) {
        int present = 0;
        for (Object cell : cells) {
            if (cell != null) {
                present++;
            }
        }
        double result = aggregation.apply(NumericNormalizer.normalize(cells), present);
        return aggregation == Aggregation.COUNT ? (Object) (long) result : (Object) result;
    }

    private static Object zero(Aggregation aggregation) {
        return aggregation == Aggregation.COUNT ? (Object) 0L : (Object) 0.0;
    }

    private static List<String> present(Dataset dataset, List<String> names, List<String> exclude) {
        List<String> out = new ArrayList<>();
        for (String name : names) {
            if (dataset.hasColumn(name) && !exclude.contains(name) && !out.contains(name)) {
                out.add(name);
            }
        }
        return out;
    }

    private static List<Object> keyOf(Dataset dataset, int row, List<String> keys) {
        List<Object> key = new ArrayList<>(keys.size());
        for (String k : keys) {
            Object value = dataset.value(row, k);
            if (CellValues.isBlank(value)) {
                return null;
            }
            key.add(value);
        }
        return key;
    }

    private static List<List<Object>> newCellLists(int valueCount) {
        List<List<Object>> lists = new ArrayList<>();
        for (int i = 0; i < Math.max(1, valueCount); i++) {
            lists.add(new ArrayList<>());
        }
        return lists;
    }

    private static String label(List<Object> colKey) {
        List<String> parts = new ArrayList<>(colKey.size());
        for (Object part : colKey) {
            parts.add(CellValues.asText(part));
        }
        return String.join(HEADER_SEPARATOR, parts);
    }

    private static Comparator<List<Object>> tupleComparator(Dataset dataset, List<String> keys) {
        List<Comparator<Object>> parts = new ArrayList<>();
        for (String k : keys) {
            parts.add(CellValues.comparatorFor(dataset.column(k)));
        }
        return (a, b) -> {
            for (int i = 0; i < parts.size(); i++) {
                int cmp = parts.get(i).compare(a.get(i), b.get(i));
                if (cmp != 0) {
                    return cmp;
                }
            }
            return 0;
        };
    }
}
