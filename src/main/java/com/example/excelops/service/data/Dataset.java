package com.example.excelops.service.data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * In-memory table: ordered column names plus row-major cell values.
 * <p>
 * Cells are {@link String}, {@link Number} or {@code null}. Rows are positional and always
 * as wide as {@link #columns()}. Instances are immutable; every transformation returns a
 * new dataset.
 */
public record Dataset(
        List<String> columns,
        List<List<Object>> rows
) {

    public Dataset {
        columns = List.copyOf(columns);
        List<List<Object>> copied = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            List<Object> cells = new ArrayList<>(columns.size());
            for (int c = 0; c < columns.size(); c++) {
                cells.add(row != null && c < row.size() ? row.get(c) : null);
            }
            copied.add(Collections.unmodifiableList(cells));
        }
        rows = Collections.unmodifiableList(copied);
    }

    public static Dataset empty() {
        return new Dataset(List.of(), List.of());
    }

    public int rowCount() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty() || columns.isEmpty();
    }

    /**
     * Index of the first column with exactly this name, or -1.
     */
    public int columnIndex(String name) {
        if (name == null) {
            return -1;
        }
        return columns.indexOf(name);
    }

    public boolean hasColumn(String name) {
        return columnIndex(name) >= 0;
    }

    public Set<String> duplicateColumns() {
        Set<String> seen = new HashSet<>();
        Set<String> duplicates = new LinkedHashSet<>();
        for (String column : columns) {
            if (!seen.add(column)) {
                duplicates.add(column);
            }
        }
        return duplicates;
    }

    public Object value(int row, String column) {
        int idx = columnIndex(column);
        return idx < 0 ? null : rows.get(row).get(idx);
    }

    /**
     * All cells of one column in row order.
     */
    public List<Object> column(String name) {
        int idx = columnIndex(name);
        if (idx < 0) {
            throw new IllegalArgumentException("Unknown column: " + name);
        }
        List<Object> values = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            values.add(row.get(idx));
        }
        return values;
    }

    public Dataset filterRows(boolean[] keep) {
        List<List<Object>> kept = new ArrayList<>();
        for (int r = 0; r < rows.size(); r++) {
            if (keep[r]) {
                kept.add(rows.get(r));
            }
        }
        return new Dataset(columns, kept);
    }

    public Dataset selectRows(List<Integer> order) {
        List<List<Object>> selected = new ArrayList<>(order.size());
        for (Integer r : order) {
            selected.add(rows.get(r));
        }
        return new Dataset(columns, selected);
    }

    /**
     * Keeps only the named columns, in the given order. Names absent from this dataset are skipped.
     */
    public Dataset project(List<String> keep) {
        List<String> names = new ArrayList<>();
        List<Integer> indexes = new ArrayList<>();
        for (String name : keep) {
            int idx = columnIndex(name);
            if (idx >= 0) {
                names.add(name);
                indexes.add(idx);
            }
        }
        List<List<Object>> projected = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            List<Object> cells = new ArrayList<>(indexes.size());
            for (Integer idx : indexes) {
                cells.add(row.get(idx));
            }
            projected.add(cells);
        }
        return new Dataset(names, projected);
    }

    public Dataset withoutRows(Set<Integer> rowIndexes) {
        List<List<Object>> kept = new ArrayList<>();
        for (int r = 0; r < rows.size(); r++) {
            if (!rowIndexes.contains(r)) {
                kept.add(rows.get(r));
            }
        }
        return new Dataset(columns, kept);
    }
}
