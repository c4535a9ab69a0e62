package com.example.excelops.service.pivot;

import com.example.excelops.service.data.Dataset;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class PivotEngineTest {

    private static Dataset sales() {
        return new Dataset(List.of("Region", "Quarter", "Amt"), List.of(
                Arrays.asList("W", "Q1", 5.0),
                Arrays.asList("E", "Q1", 10.0),
                Arrays.asList("E", "Q2", 20.0)));
    }

    private static PivotSpec spec(List<String> rows, List<String> columns, List<String> values, Aggregation agg) {
        return new PivotSpec(rows, columns, values, agg, false);
    }

    @Test
    public void testSumByRegion() {
        Dataset out = PivotEngine.build(sales(), spec(List.of("Region"), List.of(), List.of("Amt"), Aggregation.SUM))
                .orElseThrow();
        assertEquals(List.of("Region", "Amt"), out.columns());
        assertEquals(List.of("E", 30.0), out.rows().get(0));
        assertEquals(List.of("W", 5.0), out.rows().get(1));
    }

    @Test
    public void testCountWithoutValues() {
        Dataset out = PivotEngine.build(sales(), spec(List.of("Region"), List.of(), List.of(), Aggregation.SUM))
                .orElseThrow();
        assertEquals(List.of("Region", PivotEngine.COUNT_COLUMN), out.columns());
        assertEquals(List.of("E", 2L), out.rows().get(0));
        assertEquals(List.of("W", 1L), out.rows().get(1));
    }

    @Test
    public void testColumnKeysFlattenHeadersAndFillZero() {
        Dataset out = PivotEngine.build(sales(),
                spec(List.of("Region"), List.of("Quarter"), List.of("Amt"), Aggregation.SUM)).orElseThrow();
        assertEquals(List.of("Region", "Amt | Q1", "Amt | Q2"), out.columns());
        assertEquals(List.of("E", 10.0, 20.0), out.rows().get(0));
        assertEquals(List.of("W", 5.0, 0.0), out.rows().get(1));
    }

    @Test
    public void testCountWithColumnKeys() {
        Dataset out = PivotEngine.build(sales(),
                spec(List.of("Region"), List.of("Quarter"), List.of(), Aggregation.SUM)).orElseThrow();
        assertEquals(List.of("Region", "Q1", "Q2"), out.columns());
        assertEquals(List.of("W", 1L, 0L), out.rows().get(1));
    }

    @Test
    public void testMeanMinMax() {
        PivotSpec mean = spec(List.of("Region"), List.of(), List.of("Amt"), Aggregation.MEAN);
        assertEquals(15.0, PivotEngine.build(sales(), mean).orElseThrow().rows().get(0).get(1));
        PivotSpec min = spec(List.of("Region"), List.of(), List.of("Amt"), Aggregation.MIN);
        assertEquals(10.0, PivotEngine.build(sales(), min).orElseThrow().rows().get(0).get(1));
        PivotSpec max = spec(List.of("Region"), List.of(), List.of("Amt"), Aggregation.MAX);
        assertEquals(20.0, PivotEngine.build(sales(), max).orElseThrow().rows().get(0).get(1));
    }

    @Test
    public void testNoRowKeyMeansNoResult() {
        Optional<Dataset> none = PivotEngine.build(sales(), spec(List.of(), List.of(), List.of("Amt"), Aggregation.SUM));
        assertTrue(none.isEmpty());
        Optional<Dataset> missing = PivotEngine.build(sales(), spec(List.of("Nope"), List.of(), List.of(), Aggregation.SUM));
        assertTrue(missing.isEmpty());
    }

    @Test
    public void testBlankKeysAreDropped() {
        Dataset data = new Dataset(List.of("Region", "Amt"), List.of(
                Arrays.asList("E", 1.0),
                Arrays.asList(null, 2.0),
                Arrays.asList(" ", 3.0)));
        Dataset out = PivotEngine.build(data, spec(List.of("Region"), List.of(), List.of("Amt"), Aggregation.SUM))
                .orElseThrow();
        assertEquals(1, out.rowCount());
    }

    @Test
    public void testAggregationParsing() {
        assertEquals(Aggregation.MEAN, Aggregation.parse("avg"));
        assertEquals(Aggregation.COUNT, Aggregation.parse("Count"));
        assertEquals(Aggregation.SUM, Aggregation.parse(null));
        assertThrows(IllegalArgumentException.class, () -> Aggregation.parse("median"));
    }
}
