package com.example.excelops.service.pipeline;

import com.example.excelops.service.columns.ColumnConfig;
import com.example.excelops.service.columns.DedupeConfig;
import com.example.excelops.service.data.Dataset;
import com.example.excelops.service.filter.FilterConfig;
import com.example.excelops.service.filter.FilterRow;
import com.example.excelops.service.pivot.Aggregation;
import com.example.excelops.service.pivot.PivotSpec;
import com.example.excelops.service.preset.SheetPreset;
import com.example.excelops.service.sort.SortConfig;
import com.example.excelops.service.sort.SortDirection;
import com.example.excelops.service.sort.SortRow;
import com.example.excelops.service.vlookup.JoinSpec;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class PipelineOrchestratorTest {

    private static Dataset orders() {
        return new Dataset(List.of("User", "Region", "Amt"), List.of(
                List.of("u1", "E", 10.0),
                List.of("u2", "W", 40.0),
                List.of("u1", "W", 30.0),
                List.of("u2", "E", 5.0)));
    }

    private static Sheet sheet() {
        Sheet sheet = new Sheet("Sheet1");
        sheet.setFilters(new FilterConfig(List.of(FilterRow.of("", "Amt", ">", "6"))));
        sheet.setSorts(new SortConfig(List.of(new SortRow("", "Amt", SortDirection.DESCENDING))));
        sheet.setColumns(new ColumnConfig(List.of("Amt", "User", "Region"), Map.of("Region", false),
                DedupeConfig.disabled()));
        return sheet;
    }

    @Test
    public void testBaseViewFiltersSortsThenProjects() {
        Dataset out = PipelineOrchestrator.baseView(orders(), sheet());
        assertEquals(List.of("Amt", "User"), out.columns());
        assertEquals(List.of(40.0, 30.0, 10.0), out.column("Amt"));
    }

    @Test
    public void testDerivedViewUsesGeneratedPivot() {
        Sheet sheet = sheet();
        sheet.setColumns(ColumnConfig.empty());
        sheet.setPivot(new PivotSpec(List.of("Region"), List.of(), List.of("Amt"), Aggregation.SUM, false));
        assertEquals(3, PipelineOrchestrator.derivedView(orders(), sheet).rowCount());

        sheet.setPivot(sheet.getPivot().withGenerated(true));
        Dataset pivot = PipelineOrchestrator.derivedView(orders(), sheet);
        assertEquals(List.of("Region", "Amt"), pivot.columns());
        assertEquals(List.of("E", 10.0), pivot.rows().get(0));
        assertEquals(List.of("W", 70.0), pivot.rows().get(1));
    }

    @Test
    public void testGeneratedPivotWithoutUsableKeysFallsBack() {
        Sheet sheet = sheet();
        sheet.setPivot(new PivotSpec(List.of("Region"), List.of(), List.of(), Aggregation.SUM, true));
        // Region is hidden by the column config, so the base view has no pivot key
        assertEquals(List.of("Amt", "User"), PipelineOrchestrator.derivedView(orders(), sheet).columns());
    }

    @Test
    public void testPresetWithExtraEquality() {
        SheetPreset preset = new SheetPreset("Sheet1",
                new FilterConfig(List.of(FilterRow.of("", "Region", "==", "W"))),
                new SortConfig(List.of(new SortRow("", "Amt", SortDirection.ASCENDING))),
                ColumnConfig.empty(), PivotSpec.empty(), JoinSpec.empty());

        Dataset u1 = PipelineOrchestrator.applyPreset(orders(), preset, Map.of("User", "u1"));
        assertEquals(List.of(30.0), u1.column("Amt"));

        Dataset everyone = PipelineOrchestrator.applyPreset(orders(), preset, Map.of());
        assertEquals(List.of(30.0, 40.0), everyone.column("Amt"));

        Dataset unknownColumn = PipelineOrchestrator.applyPreset(orders(), preset, Map.of("Owner", "u1"));
        assertEquals(2, unknownColumn.rowCount());
    }
}
