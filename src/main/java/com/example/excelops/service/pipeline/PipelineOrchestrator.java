package com.example.excelops.service.pipeline;

import com.example.excelops.service.columns.ColumnProjectionEngine;
import com.example.excelops.service.data.CellValues;
import com.example.excelops.service.data.Dataset;
import com.example.excelops.service.filter.FilterEngine;
import com.example.excelops.service.pivot.PivotEngine;
import com.example.excelops.service.pivot.PivotException;
import com.example.excelops.service.preset.SheetPreset;
import com.example.excelops.service.sort.SortEngine;

import java.util.Map;
import java.util.Optional;

/**
 * Chains the engines into a sheet's views: filter, sort, columns, then the pivot when the sheet
 * has generated one.
 */
public final class PipelineOrchestrator {

    private PipelineOrchestrator() {
    }

    /**
     * Filter, sort and column projection; the source for pivots and VLOOKUPs.
     */
    public static Dataset baseView(Dataset raw, Sheet sheet) {
        Dataset out = FilterEngine.apply(raw, sheet.getFilters());
        out = SortEngine.apply(out, sheet.getSorts());
        return ColumnProjectionEngine.apply(out, sheet.getColumns());
    }

    /**
     * What the sheet shows and exports: the base view, replaced by the pivot once generated.
     */
    public static Dataset derivedView(Dataset raw, Sheet sheet) {
        Dataset base = baseView(raw, sheet);
        if (!sheet.getPivot().generated()) {
            return base;
        }
        return pivot(base, sheet).orElse(base);
    }

    public static Optional<Dataset> pivot(Dataset base, Sheet sheet) {
        try {
            return PivotEngine.build(base, sheet.getPivot());
        } catch (RuntimeException e) {
            throw new PivotException("Pivot failed: " + e.getMessage(), e);
        }
    }

    /**
     * Runs a saved sheet over a dataset with extra exact-match conditions applied after the
     * saved filters and before sorting.
     */
    public static Dataset applyPreset(Dataset raw, SheetPreset preset, Map<String, String> extraEquals) {
        Dataset out = FilterEngine.apply(raw, preset.filters());
        if (extraEquals != null) {
            for (Map.Entry<String, String> condition : extraEquals.entrySet()) {
                out = equalTo(out, condition.getKey(), condition.getValue());
            }
        }
        out = SortEngine.apply(out, preset.sorts());
        return ColumnProjectionEngine.apply(out, preset.columns());
    }

    static Dataset equalTo(Dataset dataset, String column, String value) {
        if (dataset == null || !dataset.hasColumn(column)) {
            return dataset;
        }
        boolean[] keep = new boolean[dataset.rowCount()];
        for (int r = 0; r < keep.length; r++) {
            keep[r] = CellValues.asText(dataset.value(r, column)).equals(value);
        }
        return dataset.filterRows(keep);
    }
}
