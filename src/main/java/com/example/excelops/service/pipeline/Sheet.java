package com.example.excelops.service.pipeline;

import com.example.excelops.service.columns.ColumnConfig;
import com.example.excelops.service.filter.FilterConfig;
import com.example.excelops.service.pivot.PivotSpec;
import com.example.excelops.service.preset.SheetPreset;
import com.example.excelops.service.sort.SortConfig;
import com.example.excelops.service.vlookup.JoinSpec;
import lombok.Getter;
import lombok.Setter;

import java.util.List;

/**
 * A named pipeline configuration over the shared working dataset. The name is a display
 * label only; it may change at any time.
 */
@Getter
@Setter
public class Sheet {

    private String name;
    private FilterConfig filters = FilterConfig.empty();
    private SortConfig sorts = SortConfig.empty();
    private ColumnConfig columns = ColumnConfig.empty();
    private PivotSpec pivot = PivotSpec.empty();
    private JoinSpec vlookup = JoinSpec.empty();

    public Sheet(String name) {
        this.name = name;
    }

    public static Sheet fromPreset(SheetPreset preset) {
        Sheet sheet = new Sheet(preset.name());
        sheet.apply(preset);
        return sheet;
    }

    /**
     * Replaces every config with the preset's; the name is kept.
     */
    public void apply(SheetPreset preset) {
        this.filters = preset.filters();
        this.sorts = preset.sorts();
        this.columns = preset.columns();
        this.pivot = preset.pivot();
        this.vlookup = preset.vlookup();
    }

    public SheetPreset toPreset() {
        return new SheetPreset(name, filters, sorts, columns, pivot, vlookup);
    }

    public Sheet copyAs(String newName) {
        Sheet copy = fromPreset(toPreset());
        copy.setName(newName);
        return copy;
    }

    public void reset(List<String> datasetColumns) {
        this.filters = FilterConfig.empty();
        this.sorts = SortConfig.empty();
        this.columns = ColumnConfig.allVisible(datasetColumns);
        this.pivot = PivotSpec.empty();
        this.vlookup = JoinSpec.empty();
    }

    public void reconcile(List<String> datasetColumns) {
        this.columns = columns.reconcile(datasetColumns);
    }
}
