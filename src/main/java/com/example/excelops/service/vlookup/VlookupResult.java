package com.example.excelops.service.vlookup;

import com.example.excelops.service.data.Dataset;

import java.util.List;

/**
 * @param merged         main dataset with the added columns
 * @param addedColumns   final names of the columns brought over, in value-column order
 * @param matchedRows    main rows that found a lookup row
 */
public record VlookupResult(
        Dataset merged,
        List<String> addedColumns,
        int matchedRows
) {
}
