package com.example.excelops.service.automation;

import com.example.excelops.service.columns.ColumnConfig;
import com.example.excelops.service.columns.DedupeConfig;
import com.example.excelops.service.data.Dataset;
import com.example.excelops.service.filter.FilterConfig;
import com.example.excelops.service.filter.FilterRow;
import com.example.excelops.service.io.TabularFileReader;
import com.example.excelops.service.io.WorkbookExporter;
import com.example.excelops.service.preset.PresetDocument;
import com.example.excelops.service.preset.PresetService;
import com.example.excelops.service.preset.SheetPreset;
import com.example.excelops.service.sort.SortConfig;
import com.example.excelops.service.sort.SortDirection;
import com.example.excelops.service.sort.SortRow;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class AutomationServiceTest {

    private static final String ORDERS = "User,Region,Amt\nu1,E,10\nu2,W,40\nu1,W,30\nu2,E,5\nu3,E,1\n";

    @TempDir
    Path dir;

    private AutomationService service;

    @BeforeEach
    public void setUp() {
        PresetService presets = new PresetService(new ObjectMapper(), dir.resolve("presets"));
        presets.save("big", new PresetDocument(List.of(bigOrders())));
        service = new AutomationService(new TabularFileReader(), new WorkbookExporter(), presets, "User");
    }

    private static SheetPreset bigOrders() {
        return new SheetPreset("Big",
                new FilterConfig(List.of(FilterRow.of("", "Amt", ">", "4"))),
                new SortConfig(List.of(new SortRow("", "Amt", SortDirection.DESCENDING))),
                new ColumnConfig(List.of("Amt", "Region", "User"), Map.of("User", false), DedupeConfig.disabled()),
                null, null);
    }

    @Test
    public void testOneSheetPerUserWithRows() {
        Dataset raw = new TabularFileReader().read(
                new ByteArrayInputStream(ORDERS.getBytes(StandardCharsets.UTF_8)), "orders.csv");
        Map<String, Dataset> out = service.process(raw, List.of("u1, u2", "u3"), new PresetDocument(List.of(bigOrders())));

        assertEquals(List.of("u1", "u2"), List.copyOf(out.keySet()));
        assertEquals(List.of("Amt", "Region"), out.get("u1").columns());
        assertEquals(List.of(30.0, 10.0), out.get("u1").column("Amt"));
        assertEquals(List.of(40.0, 5.0), out.get("u2").column("Amt"));
    }

    @Test
    public void testRunOnFileWritesOutputNextToInput() throws IOException {
        Path input = dir.resolve("orders.csv");
        Files.writeString(input, ORDERS);

        Path output = service.runOnFile(input, List.of("u2", "u1"), "big");
        assertEquals(dir.resolve("orders_OUTPUT.xlsx").toAbsolutePath().normalize(), output);
        assertTrue(Files.exists(output));
        try (Workbook workbook = WorkbookFactory.create(output.toFile())) {
            assertEquals("u2", workbook.getSheetName(0));
            assertEquals("u1", workbook.getSheetName(1));
        }
    }

    @Test
    public void testRunReturnsWorkbookBytes() throws IOException {
        byte[] bytes = service.run(new ByteArrayInputStream(ORDERS.getBytes(StandardCharsets.UTF_8)),
                "orders.csv", List.of("u1"), "big");
        try (Workbook workbook = WorkbookFactory.create(new ByteArrayInputStream(bytes))) {
            assertEquals(1, workbook.getNumberOfSheets());
            assertEquals(2, workbook.getSheetAt(0).getLastRowNum());
        }
    }

    @Test
    public void testNobodyWithRowsFails() {
        Dataset raw = new TabularFileReader().read(
                new ByteArrayInputStream(ORDERS.getBytes(StandardCharsets.UTF_8)), "orders.csv");
        PresetDocument preset = new PresetDocument(List.of(bigOrders()));
        assertThrows(IllegalStateException.class, () -> service.process(raw, List.of("u3", "u9"), preset));
        assertThrows(IllegalArgumentException.class, () -> service.process(raw, List.of(" , "), preset));
        assertThrows(IllegalArgumentException.class,
                () -> service.process(raw, List.of("u1"), new PresetDocument(List.of())));
    }

    @Test
    public void testPathLocksAreShared() throws IOException {
        Path input = dir.resolve("orders.csv");
        assertSame(service.lockFor(input), service.lockFor(dir.resolve("orders.csv")));

        Set<ReentrantLock> distinct = Collections.newSetFromMap(new IdentityHashMap<>());
        for (int i = 0; i < 1000; i++) {
            distinct.add(service.lockFor(dir.resolve("in" + i + ".csv")));
        }
        assertTrue(distinct.size() <= 64);

        Files.writeString(input, ORDERS);
        service.runOnFile(input, List.of("u1"), "big");
        assertFalse(service.lockFor(input.toAbsolutePath().normalize()).isLocked());
    }

    @Test
    public void testNormalizeUsers() {
        assertEquals(List.of("a", "b", "c"), AutomationService.normalizeUsers(List.of(" a ,b", "a", "", "c")));
    }
}
