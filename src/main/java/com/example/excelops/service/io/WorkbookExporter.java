package com.example.excelops.service.io;

import com.example.excelops.service.data.CellValues;
import com.example.excelops.service.data.Dataset;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Writes named datasets to an {@code .xlsx} workbook, one worksheet each, in map order.
 */
@Slf4j
@Component
public class WorkbookExporter {

    public static final int MAX_SHEET_NAME = 31;
    private static final String FALLBACK_NAME = "Sheet";
    private static final int MAX_COLUMN_CHARS = 80;

    public byte[] write(Map<String, Dataset> sheets) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        writeTo(out, sheets);
        return out.toByteArray();
    }

    public void writeTo(Path target, Map<String, Dataset> sheets) {
        try (OutputStream out = Files.newOutputStream(target)) {
            writeTo(out, sheets);
        } catch (IOException e) {
            throw new IllegalStateException("Export failed: " + e.getMessage(), e);
        }
        log.info("Wrote {} sheet(s) to {}", sheets.size(), target);
    }

    private void writeTo(OutputStream out, Map<String, Dataset> sheets) {
        if (sheets.isEmpty()) {
            throw new IllegalStateException("Nothing to export.");
        }
        try (Workbook workbook = new XSSFWorkbook()) {
            Set<String> used = new HashSet<>();
            for (Map.Entry<String, Dataset> entry : sheets.entrySet()) {
                String name = uniqueName(sanitizeSheetName(entry.getKey()), used);
                writeSheet(workbook.createSheet(name), entry.getValue());
            }
            workbook.write(out);
        } catch (IOException e) {
            throw new IllegalStateException("Export failed: " + e.getMessage(), e);
        }
    }

    private void writeSheet(Sheet sheet, Dataset data) {
        List<String> headers = data.columns();
        int[] widths = new int[headers.size()];
        Row header = sheet.createRow(0);
        for (int i = 0; i < headers.size(); i++) {
            header.createCell(i).setCellValue(headers.get(i));
            widths[i] = headers.get(i).length();
        }

        for (int r = 0; r < data.rowCount(); r++) {
            Row row = sheet.createRow(r + 1);
            List<Object> values = data.rows().get(r);
            for (int c = 0; c < values.size(); c++) {
                Object value = values.get(c);
                if (value instanceof Number number) {
                    row.createCell(c).setCellValue(number.doubleValue());
                } else if (value != null) {
                    row.createCell(c).setCellValue(value.toString());
                }
                widths[c] = Math.max(widths[c], CellValues.asText(value).length());
            }
        }

        // widths from text length, capped
        for (int c = 0; c < widths.length; c++) {
            sheet.setColumnWidth(c, Math.min(MAX_COLUMN_CHARS, widths[c] + 2) * 256);
        }
    }

    /**
     * Drops characters Excel rejects in sheet names and truncates to 31 characters.
     */
    public static String sanitizeSheetName(String name) {
        String cleaned = name == null ? "" : name.replaceAll("[\\[\\]:*?/\\\\]", "").trim();
        if (cleaned.length() > MAX_SHEET_NAME) {
            cleaned = cleaned.substring(0, MAX_SHEET_NAME);
        }
        return cleaned.isEmpty() ? FALLBACK_NAME : cleaned;
    }

    // Excel compares sheet names case-insensitively.
    private static String uniqueName(String base, Set<String> used) {
        String name = base;
        int i = 2;
        while (used.contains(name.toLowerCase(Locale.ROOT))) {
            String suffix = "_" + i++;
            String head = base.length() + suffix.length() > MAX_SHEET_NAME
                    ? base.substring(0, MAX_SHEET_NAME - suffix.length())
                    : base;
            name = head + suffix;
        }
        used.add(name.toLowerCase(Locale.ROOT));
        return name;
    }
}
