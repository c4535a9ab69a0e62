package com.example.excelops.service.pipeline;

import java.util.List;

public record VlookupSummary(
        List<String> addedColumns,
        int matchedRows,
        int totalRows
) {
}
