package com.example.excelops.service.io;

import com.example.excelops.service.data.Dataset;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Loads {@code .xlsx}, {@code .xls} and {@code .csv} files into a {@link Dataset}.
 */
@Slf4j
@Component
public class TabularFileReader {

    private static final Set<String> EXCEL_EXTENSIONS = Set.of(".xlsx", ".xls");
    private static final int SHEET_SCAN_ROWS = 80;
    private static final int SHEET_SCAN_COLUMNS = 50;
    private static final int CSV_SAMPLE_LINES = 30;
    private static final String UNNAMED_PREFIX = "Unnamed: ";
    private static final Pattern PLAIN_NUMBER =
            Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    public static boolean isSupported(String fileName) {
        String ext = extension(fileName);
        return EXCEL_EXTENSIONS.contains(ext) || ".csv".equals(ext);
    }

    public Dataset read(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return read(in, path.getFileName().toString());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to open " + path.getFileName() + ": " + e.getMessage(), e);
        }
    }

    public Dataset read(InputStream in, String fileName) {
        String ext = extension(fileName);
        if (!isSupported(fileName)) {
            throw new IllegalStateException("Unsupported file type: " + fileName);
        }
        try {
            Dataset dataset = ".csv".equals(ext) ? readCsv(in.readAllBytes()) : readWorkbook(in);
            if (!dataset.duplicateColumns().isEmpty()) {
                log.warn("{} has duplicate column names: {}", fileName, dataset.duplicateColumns());
            }
            log.info("Loaded {} with {} rows, {} columns", fileName, dataset.rowCount(), dataset.columns().size());
            return dataset;
        } catch (IOException | RuntimeException e) {
            throw new IllegalStateException("Failed to load " + fileName + ": " + e.getMessage(), e);
        }
    }

    // =========================
    // Excel
    // =========================

    private Dataset readWorkbook(InputStream in) throws IOException {
        try (Workbook workbook = WorkbookFactory.create(in)) {
            Sheet sheet = pickBestDataSheet(workbook);
            DataFormatter fmt = new DataFormatter();
            int headerRowIndex = findFirstNonEmptyRow(sheet, fmt);
            if (headerRowIndex < 0) {
                return Dataset.empty();
            }

            Row headerRow = sheet.getRow(headerRowIndex);
            int width = Math.max(0, headerRow.getLastCellNum());
            List<String> headers = new ArrayList<>();
            for (int c = 0; c < width; c++) {
                Cell cell = headerRow.getCell(c);
                String name = cell == null ? "" : fmt.formatCellValue(cell).trim();
                headers.add(name.isBlank() ? UNNAMED_PREFIX + c : name);
            }

            List<List<Object>> rows = new ArrayList<>();
            for (int r = headerRowIndex + 1; r <= sheet.getLastRowNum(); r++) {
                Row row = sheet.getRow(r);
                if (isRowBlank(row, fmt)) {
                    continue;
                }
                List<Object> values = new ArrayList<>(width);
                for (int c = 0; c < width; c++) {
                    values.add(cellValue(row.getCell(c), fmt));
                }
                rows.add(values);
            }
            return new Dataset(headers, rows);
        }
    }

    private Object cellValue(Cell cell, DataFormatter fmt) {
        if (cell == null) {
            return null;
        }
        CellType cellType = cell.getCellType() == CellType.FORMULA
                ? cell.getCachedFormulaResultType()
                : cell.getCellType();
        if (cellType == CellType.NUMERIC && !DateUtil.isCellDateFormatted(cell)) {
            return cell.getNumericCellValue();
        }
        String value;
        if (cell.getCellType() == CellType.FORMULA && cellType == CellType.STRING) {
            value = cell.getStringCellValue();
        } else if (cell.getCellType() == CellType.FORMULA && cellType == CellType.BOOLEAN) {
            value = String.valueOf(cell.getBooleanCellValue()).toUpperCase(Locale.ROOT);
        } else {
            value = fmt.formatCellValue(cell);
        }
        value = value == null ? "" : value.trim();
        return value.isEmpty() ? null : value;
    }

    private int findFirstNonEmptyRow(Sheet sheet, DataFormatter fmt) {
        for (int r = sheet.getFirstRowNum(); r <= sheet.getLastRowNum(); r++) {
            if (!isRowBlank(sheet.getRow(r), fmt)) {
                return r;
            }
        }
        return -1;
    }

    private boolean isRowBlank(Row row, DataFormatter fmt) {
        if (row == null || row.getFirstCellNum() < 0) {
            return true;
        }
        for (int c = row.getFirstCellNum(); c < row.getLastCellNum(); c++) {
            Cell cell = row.getCell(c);
            String v = cell == null ? "" : fmt.formatCellValue(cell);
            if (v != null && !v.trim().isBlank()) {
                return false;
            }
        }
        return true;
    }

    /**
     * The sheet with the most non-empty cells in its top-left area.
     */
    private Sheet pickBestDataSheet(Workbook workbook) {
        DataFormatter fmt = new DataFormatter();

        Sheet best = null;
        int bestScore = -1;
        for (int i = 0; i < workbook.getNumberOfSheets(); i++) {
            Sheet sheet = workbook.getSheetAt(i);
            if (sheet == null) continue;

            int score = 0;
            int maxRow = Math.min(sheet.getLastRowNum(), SHEET_SCAN_ROWS);
            for (int r = sheet.getFirstRowNum(); r <= maxRow; r++) {
                Row row = sheet.getRow(r);
                if (row == null) continue;

                short firstCell = row.getFirstCellNum();
                short lastCell = row.getLastCellNum();
                if (firstCell < 0 || lastCell < 0) continue;

                int endCol = Math.min(lastCell, firstCell + SHEET_SCAN_COLUMNS);
                for (int c = firstCell; c < endCol; c++) {
                    Cell cell = row.getCell(c);
                    String v = cell == null ? "" : fmt.formatCellValue(cell).trim();
                    if (!v.isBlank()) score++;
                }
            }
            if (score > bestScore) {
                bestScore = score;
                best = sheet;
            }
        }
        return best != null ? best : workbook.getSheetAt(0);
    }

    // =========================
    // CSV
    // =========================

    Dataset readCsv(byte[] bytes) throws IOException {
        String text = decode(bytes);
        List<String> sample = sampleLines(text);
        if (sample.isEmpty()) {
            return Dataset.empty();
        }
        char delimiter = CsvDelimiterDetector.detect(sample).orElse(',');
        Dataset dataset = parseCsv(text, delimiter);
        if (dataset.columns().size() == 1) {
            for (Character candidate : CsvDelimiterDetector.CANDIDATES) {
                if (candidate == delimiter) {
                    continue;
                }
                Dataset retry = parseCsv(text, candidate);
                if (retry.columns().size() > dataset.columns().size()) {
                    dataset = retry;
                    delimiter = candidate;
                }
            }
        }
        log.info("CSV delimiter '{}'", delimiter == '\t' ? "\\t" : String.valueOf(delimiter));
        return dataset;
    }

    private Dataset parseCsv(String text, char delimiter) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setDelimiter(delimiter)
                .setIgnoreEmptyLines(true)
                .build();
        List<String> headers = new ArrayList<>();
        List<List<Object>> rows = new ArrayList<>();
        try (CSVParser parser = CSVParser.parse(new StringReader(text), format)) {
            for (CSVRecord record : parser) {
                if (headers.isEmpty()) {
                    for (int c = 0; c < record.size(); c++) {
                        String name = record.get(c).trim();
                        headers.add(name.isBlank() ? UNNAMED_PREFIX + c : name);
                    }
                    continue;
                }
                List<Object> values = new ArrayList<>(headers.size());
                for (int c = 0; c < headers.size() && c < record.size(); c++) {
                    String v = record.get(c);
                    values.add(v == null || v.isEmpty() ? null : v);
                }
                // short records are padded
                while (values.size() < headers.size()) {
                    values.add(null);
                }
                rows.add(values);
            }
        } catch (IllegalStateException | UncheckedIOException e) {
            throw new IOException("Malformed CSV: " + e.getMessage(), e);
        }
        return inferNumericColumns(new Dataset(headers, rows));
    }

    /**
     * Converts columns whose non-empty cells are all plain numbers into numbers.
     */
    private Dataset inferNumericColumns(Dataset dataset) {
        int width = dataset.columns().size();
        boolean[] numeric = new boolean[width];
        for (int c = 0; c < width; c++) {
            boolean any = false;
            boolean all = true;
            for (List<Object> row : dataset.rows()) {
                Object v = row.get(c);
                if (v == null) {
                    continue;
                }
                any = true;
                if (!PLAIN_NUMBER.matcher(v.toString().trim()).matches()) {
                    all = false;
                    break;
                }
            }
            numeric[c] = any && all;
        }
        List<List<Object>> rows = new ArrayList<>(dataset.rowCount());
        for (List<Object> row : dataset.rows()) {
            List<Object> converted = new ArrayList<>(row);
            for (int c = 0; c < width; c++) {
                if (numeric[c] && converted.get(c) != null) {
                    converted.set(c, Double.parseDouble(converted.get(c).toString().trim()));
                }
            }
            rows.add(converted);
        }
        return new Dataset(dataset.columns(), rows);
    }

    private static List<String> sampleLines(String text) {
        List<String> lines = new ArrayList<>();
        for (String line : text.split("\\r?\\n")) {
            if (!line.isBlank()) {
                lines.add(line);
                if (lines.size() >= CSV_SAMPLE_LINES) {
                    break;
                }
            }
        }
        return lines;
    }

    /**
     * UTF-8 (BOM stripped) when the bytes are valid UTF-8, Latin-1 otherwise.
     */
    static String decode(byte[] bytes) {
        int offset = bytes.length >= 3
                && (bytes[0] & 0xFF) == 0xEF && (bytes[1] & 0xFF) == 0xBB && (bytes[2] & 0xFF) == 0xBF ? 3 : 0;
        ByteBuffer buffer = ByteBuffer.wrap(bytes, offset, bytes.length - offset);
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(buffer)
                    .toString();
        } catch (CharacterCodingException e) {
            return new String(bytes, offset, bytes.length - offset, StandardCharsets.ISO_8859_1);
        }
    }

    private static String extension(String fileName) {
        if (fileName == null) {
            return "";
        }
        int dot = fileName.lastIndexOf('.');
        return dot < 0 ? "" : fileName.substring(dot).toLowerCase(Locale.ROOT);
    }
}
