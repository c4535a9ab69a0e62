package com.example.excelops.service.io;

import com.example.excelops.service.data.Dataset;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TabularFileReaderTest {

    private final TabularFileReader reader = new TabularFileReader();

    private Dataset csv(byte[] bytes) {
        return reader.read(new ByteArrayInputStream(bytes), "data.csv");
    }

    @Test
    public void testCsvWithBomAndNumericInference() {
        byte[] bom = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};
        byte[] body = "Name;Amt;Code\nä;1.5;7\nb;;x\n".getBytes(StandardCharsets.UTF_8);
        byte[] bytes = new byte[bom.length + body.length];
        System.arraycopy(bom, 0, bytes, 0, bom.length);
        System.arraycopy(body, 0, bytes, bom.length, body.length);

        Dataset data = csv(bytes);
        assertEquals(List.of("Name", "Amt", "Code"), data.columns());
        assertEquals(Arrays.asList("ä", 1.5, "7"), data.rows().get(0));
        assertEquals(Arrays.asList("b", null, "x"), data.rows().get(1));
    }

    @Test
    public void testLatin1Fallback() {
        Dataset data = csv("City,Pop\nCafé,12\n".getBytes(StandardCharsets.ISO_8859_1));
        assertEquals("Café", data.rows().get(0).get(0));
        assertEquals(12.0, data.rows().get(0).get(1));
    }

    @Test
    public void testBlankHeadersAndShortRows() {
        Dataset data = csv(" A ,,C\n1,2\n".getBytes(StandardCharsets.UTF_8));
        assertEquals(List.of("A", "Unnamed: 1", "C"), data.columns());
        assertEquals(Arrays.asList(1.0, 2.0, null), data.rows().get(0));
    }

    @Test
    public void testQuotedDelimiters() {
        Dataset data = csv("Name,Note\nx,\"a, b\"\n".getBytes(StandardCharsets.UTF_8));
        assertEquals("a, b", data.rows().get(0).get(1));
    }

    @Test
    public void testDecode() {
        assertEquals("é", TabularFileReader.decode("é".getBytes(StandardCharsets.UTF_8)));
        assertEquals("é", TabularFileReader.decode("é".getBytes(StandardCharsets.ISO_8859_1)));
    }

    @Test
    public void testWorkbookPicksBusiestSheet(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("book.xlsx");
        try (Workbook workbook = new XSSFWorkbook()) {
            workbook.createSheet("Notes").createRow(0).createCell(0).setCellValue("read me");

            Sheet data = workbook.createSheet("Data");
            Row header = data.createRow(2);
            header.createCell(0).setCellValue("Region");
            header.createCell(1).setCellValue("Amt");
            header.createCell(2).setCellValue("Code");
            Row first = data.createRow(3);
            first.createCell(0).setCellValue("E");
            first.createCell(1).setCellValue(10);
            first.createCell(2).setCellValue("A-1");
            data.createRow(4);
            Row second = data.createRow(5);
            second.createCell(0).setCellValue("W");
            second.createCell(2).setCellValue("  ");

            ByteArrayOutputStream out = new ByteArrayOutputStream();
            workbook.write(out);
            Files.write(file, out.toByteArray());
        }

        Dataset dataset = reader.read(file);
        assertEquals(List.of("Region", "Amt", "Code"), dataset.columns());
        assertEquals(2, dataset.rowCount());
        assertEquals(Arrays.asList("E", 10.0, "A-1"), dataset.rows().get(0));
        assertEquals(Arrays.asList("W", null, null), dataset.rows().get(1));
    }

    @Test
    public void testUnsupportedFile() {
        assertFalse(TabularFileReader.isSupported("notes.txt"));
        assertTrue(TabularFileReader.isSupported("DATA.XLSX"));
        assertThrows(IllegalStateException.class,
                () -> reader.read(new ByteArrayInputStream(new byte[0]), "notes.txt"));
    }

    @Test
    public void testCorruptWorkbook() {
        assertThrows(IllegalStateException.class,
                () -> reader.read(new ByteArrayInputStream("not a workbook".getBytes(StandardCharsets.UTF_8)), "x.xlsx"));
    }
}
