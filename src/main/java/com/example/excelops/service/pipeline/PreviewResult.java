package com.example.excelops.service.pipeline;

import java.util.List;

public record PreviewResult(
        List<String> headers,
        List<List<String>> previewRows,
        int totalRows
) {
}
