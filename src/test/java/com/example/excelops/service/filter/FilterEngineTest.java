package com.example.excelops.service.filter;

import com.example.excelops.service.data.Dataset;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class FilterEngineTest {

    private static Dataset numbers() {
        List<List<Object>> rows = new ArrayList<>();
        for (int i = 1; i <= 5; i++) {
            rows.add(List.of((double) i));
        }
        return new Dataset(List.of("A"), rows);
    }

    private static Dataset people() {
        return new Dataset(List.of("Name", "City", "Home", "Score"), List.of(
                Arrays.asList("Ann", "Oslo", "Oslo", "10%"),
                Arrays.asList("Bob", "Rome", "Oslo", "1,200"),
                Arrays.asList("Cid", "Paris", "Paris", null),
                Arrays.asList("Dee", "oslo", "Rome", "abc")));
    }

    private static List<Object> column(Dataset dataset, String name) {
        return dataset.column(name);
    }

    @Test
    public void testAndRange() {
        Dataset out = FilterEngine.apply(numbers(), List.of(
                FilterRow.of("", "A", ">", "2"),
                FilterRow.of("AND", "A", "<", "5")));
        assertEquals(List.of(3.0, 4.0), column(out, "A"));
    }

    @Test
    public void testColumnAverage() {
        Dataset out = FilterEngine.apply(numbers(), List.of(
                FilterRow.of("", "A", ">", "column average")));
        assertEquals(List.of(4.0, 5.0), column(out, "A"));
    }

    @Test
    public void testFlatLeftFold() {
        // (A == 1 OR A == 5) AND A > 2
        Dataset out = FilterEngine.apply(numbers(), List.of(
                FilterRow.of("", "A", "==", "1"),
                FilterRow.of("OR", "A", "==", "5"),
                FilterRow.of("AND", "A", ">", "2")));
        assertEquals(List.of(5.0), column(out, "A"));
    }

    @Test
    public void testFirstJoinIgnored() {
        Dataset out = FilterEngine.apply(numbers(), List.of(FilterRow.of("OR", "A", "<=", "2")));
        assertEquals(List.of(1.0, 2.0), column(out, "A"));
    }

    @Test
    public void testContainsIsCaseInsensitive() {
        Dataset out = FilterEngine.apply(people(), List.of(FilterRow.of("", "City", "contains", "OS")));
        assertEquals(List.of("Ann", "Dee"), column(out, "Name"));
    }

    @Test
    public void testInList() {
        Dataset out = FilterEngine.apply(people(), List.of(FilterRow.of("", "Name", "in", "Bob, Dee ,Zed")));
        assertEquals(List.of("Bob", "Dee"), column(out, "Name"));
    }

    @Test
    public void testColumnComparison() {
        Dataset same = FilterEngine.apply(people(), List.of(FilterRow.columns("", "City", "== Column", "Home")));
        assertEquals(List.of("Ann", "Cid"), column(same, "Name"));

        Dataset different = FilterEngine.apply(people(), List.of(FilterRow.columns("", "City", "!= Column", "Home")));
        assertEquals(List.of("Bob", "Dee"), column(different, "Name"));
    }

    @Test
    public void testNumericLiteralNormalizesCells() {
        Dataset out = FilterEngine.apply(people(), List.of(FilterRow.of("", "Score", ">", "5")));
        assertEquals(List.of("Ann", "Bob"), column(out, "Name"));
    }

    @Test
    public void testNotEqualKeepsNonNumericCells() {
        Dataset out = FilterEngine.apply(people(), List.of(FilterRow.of("", "Score", "!=", "10")));
        assertEquals(List.of("Bob", "Cid", "Dee"), column(out, "Name"));
    }

    @Test
    public void testStringEquality() {
        Dataset out = FilterEngine.apply(people(), List.of(FilterRow.of("", "City", "==", "Oslo")));
        assertEquals(List.of("Ann"), column(out, "Name"));
    }

    @Test
    public void testOrderingAgainstTextMatchesNothing() {
        Dataset out = FilterEngine.apply(people(), List.of(FilterRow.of("", "City", ">", "Oslo")));
        assertEquals(0, out.rowCount());
    }

    @Test
    public void testUnusableRowsAreSkipped() {
        Dataset input = people();
        Dataset out = FilterEngine.apply(input, List.of(
                FilterRow.of("", "Missing", "==", "x"),
                FilterRow.of("AND", "City", "~=", "x"),
                FilterRow.columns("AND", "City", "== Column", "Nowhere")));
        assertSame(input, out);
    }

    @Test
    public void testEmptyFilterReturnsInput() {
        Dataset input = numbers();
        assertSame(input, FilterEngine.apply(input, FilterConfig.empty()));
    }

    @Test
    public void testSuggestValues() {
        List<String> values = FilterEngine.suggestValues(people(), "Home");
        assertEquals(List.of(FilterRow.COLUMN_AVERAGE, "Oslo", "Paris", "Rome"), values);
        assertTrue(FilterEngine.suggestValues(people(), "Missing").isEmpty());
    }

    @Test
    public void testFormattedLiteralComparesAsText() {
        Dataset equal = FilterEngine.apply(people(), List.of(FilterRow.of("", "Score", "==", "10%")));
        assertEquals(List.of("Ann"), column(equal, "Name"));

        Dataset ordered = FilterEngine.apply(people(), List.of(FilterRow.of("", "Score", ">", "5%")));
        assertEquals(0, ordered.rowCount());

        Dataset plain = FilterEngine.apply(people(), List.of(FilterRow.of("", "Score", ">", " 5 ")));
        assertEquals(List.of("Ann", "Bob"), column(plain, "Name"));
    }
}
