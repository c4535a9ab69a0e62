package com.example.excelops.service.columns;

import com.example.excelops.service.data.Dataset;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Applies a {@link ColumnConfig}: de-duplicate rows first, then project onto the visible columns
 * in configured order.
 */
public final class ColumnProjectionEngine {

    private ColumnProjectionEngine() {
    }

    public static Dataset apply(Dataset dataset, ColumnConfig config) {
        if (dataset == null || dataset.isEmpty() || config == null) {
            return dataset;
        }
        Dataset out = dedupe(dataset, config.dedupe());

        // an unconfigured sheet, or one with everything hidden, keeps its columns
        List<String> visibleColumns = visibleColumns(out, config);
        if (visibleColumns.isEmpty()) {
            return out;
        }
        return out.project(visibleColumns);
    }

    public static List<String> visibleColumns(Dataset dataset, ColumnConfig config) {
        List<String> columns = new ArrayList<>();
        for (String c : config.order()) {
            if (config.isVisible(c) && dataset.hasColumn(c)) {
                columns.add(c);
            }
        }
        return columns;
    }

    /**
     * Drops rows whose dedupe-column value was already seen, keeping the first occurrence.
     */
    static Dataset dedupe(Dataset dataset, DedupeConfig dedupe) {
        if (!dedupe.enabled() || !dataset.hasColumn(dedupe.column())) {
            return dataset;
        }
        List<Object> cells = dataset.column(dedupe.column());
        Set<Object> seen = new HashSet<>();
        boolean[] keep = new boolean[cells.size()];
        for (int i = 0; i < keep.length; i++) {
            keep[i] = seen.add(cells.get(i));
        }
        return dataset.filterRows(keep);
    }
}
