package com.example.excelops.service.sort;

import com.example.excelops.service.data.CellValues;
import com.example.excelops.service.data.Dataset;
import com.example.excelops.service.filter.Conjunction;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Multi-level sorting with OR-separated precedence tiers.
 * <p>
 * Sort rows are split into groups: an {@code OR} row opens a new group, any other row extends
 * the current one. Each group is an ordinary multi-key sort. Groups run last to first through a
 * stable sort, so the first group ends up as the outermost key and later groups only break its ties.
 * Nulls sort last in either direction.
 */
@Slf4j
public final class SortEngine {

    private SortEngine() {
    }

    public static Dataset apply(Dataset dataset, SortConfig config) {
        return apply(dataset, config == null ? List.of() : config.sorts());
    }

    public static Dataset apply(Dataset dataset, List<SortRow> sortRows) {
        if (dataset == null || dataset.isEmpty() || sortRows == null || sortRows.isEmpty()) {
            return dataset;
        }
        List<List<SortRow>> groups = group(dataset, sortRows);
        if (groups.isEmpty()) {
            return dataset;
        }

        List<Integer> order = new ArrayList<>(dataset.rowCount());
        for (int r = 0; r < dataset.rowCount(); r++) {
            order.add(r);
        }
        for (int g = groups.size() - 1; g >= 0; g--) {
            order.sort(groupComparator(dataset, groups.get(g)));
        }
        return dataset.selectRows(order);
    }

    /**
     * Splits the rows into OR-separated groups, dropping rows on columns the dataset lacks.
     * The join of the first row is ignored.
     */
    static List<List<SortRow>> group(Dataset dataset, List<SortRow> sortRows) {
        List<List<SortRow>> groups = new ArrayList<>();
        List<SortRow> current = new ArrayList<>();
        boolean first = true;
        for (SortRow row : sortRows) {
            boolean startsGroup = !first && Conjunction.parse(row.join()) == Conjunction.OR;
            first = false;
            if (row.column().isBlank() || !dataset.hasColumn(row.column())) {
                log.debug("Skipping sort on missing column '{}'", row.column());
                continue;
            }
            if (startsGroup && !current.isEmpty()) {
                groups.add(current);
                current = new ArrayList<>();
            }
            current.add(row);
        }
        if (!current.isEmpty()) {
            groups.add(current);
        }
        return groups;
    }

    private static Comparator<Integer> groupComparator(Dataset dataset, List<SortRow> group) {
        Comparator<Integer> combined = null;
        for (SortRow key : group) {
            Comparator<Integer> next = keyComparator(dataset, key);
            combined = combined == null ? next : combined.thenComparing(next);
        }
        return combined;
    }

    private static Comparator<Integer> keyComparator(Dataset dataset, SortRow key) {
        List<Object> cells = dataset.column(key.column());
        Comparator<Object> values = CellValues.comparatorFor(cells);
        Comparator<Object> directed = key.ascending() ? values : values.reversed();
        Comparator<Object> nullsLast = Comparator.nullsLast(directed);
        return (a, b) -> nullsLast.compare(cells.get(a), cells.get(b));
    }
}
