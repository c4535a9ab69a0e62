package com.example.excelops.service.preset;

import com.example.excelops.service.columns.ColumnConfig;
import com.example.excelops.service.filter.FilterConfig;
import com.example.excelops.service.pivot.PivotSpec;
import com.example.excelops.service.sort.SortConfig;
import com.example.excelops.service.vlookup.JoinSpec;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Saved configuration of one sheet.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SheetPreset(
        String name,
        FilterConfig filters,
        SortConfig sorts,
        ColumnConfig columns,
        PivotSpec pivot,
        JoinSpec vlookup
) {
    public SheetPreset {
        name = name == null || name.isBlank() ? "Sheet" : name;
        filters = filters == null ? FilterConfig.empty() : filters;
        sorts = sorts == null ? SortConfig.empty() : sorts;
        columns = columns == null ? ColumnConfig.empty() : columns;
        pivot = pivot == null ? PivotSpec.empty() : pivot;
        vlookup = vlookup == null ? JoinSpec.empty() : vlookup;
    }
}
