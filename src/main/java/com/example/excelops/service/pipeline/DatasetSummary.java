package com.example.excelops.service.pipeline;

import java.util.List;

public record DatasetSummary(
        String fileName,
        int totalRows,
        List<String> columns,
        List<String> sheets
) {
}
