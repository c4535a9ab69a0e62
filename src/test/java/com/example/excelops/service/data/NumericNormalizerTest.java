package com.example.excelops.service.data;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

public class NumericNormalizerTest {

    @Test
    public void testPercentAndThousandsSeparators() {
        assertEquals(12.5, NumericNormalizer.normalize("12.5%"));
        assertEquals(1234.0, NumericNormalizer.normalize("1,234"));
        assertEquals(-0.5, NumericNormalizer.normalize(" -.5 "));
    }

    @Test
    public void testNonNumericIsNull() {
        assertNull(NumericNormalizer.normalize(""));
        assertNull(NumericNormalizer.normalize("abc"));
        assertNull(NumericNormalizer.normalize("12abc"));
        assertNull(NumericNormalizer.normalize("NaN"));
        assertNull(NumericNormalizer.normalize(null));
    }

    @Test
    public void testNumbersPassThrough() {
        assertEquals(3.0, NumericNormalizer.normalize(3));
        assertEquals(2.25, NumericNormalizer.normalize(2.25));
        assertNull(NumericNormalizer.normalize(Double.NaN));
    }

    @Test
    public void testMeanIgnoresNulls() {
        List<Double> series = NumericNormalizer.normalize(Arrays.asList("1", null, "x", 5.0));
        assertEquals(Arrays.asList(1.0, null, null, 5.0), series);
        assertEquals(3.0, NumericNormalizer.mean(series));
        assertNull(NumericNormalizer.mean(Arrays.asList(null, null)));
    }

    @Test
    public void testCellText() {
        assertEquals("", CellValues.asText(null));
        assertEquals("3", CellValues.asText(3.0));
        assertEquals("2.5", CellValues.asText(2.5));
        assertEquals("abc", CellValues.asText("abc"));
        assertEquals("Infinity", CellValues.asText(Double.POSITIVE_INFINITY));
        assertEquals("-Infinity", CellValues.asText(Double.NEGATIVE_INFINITY));
        assertEquals("Infinity", CellValues.asText(1e308 + 1e308));
    }

    @Test
    public void testParseLiteral() {
        assertEquals(12.0, NumericNormalizer.parseLiteral(" 12 "));
        assertEquals(-0.5, NumericNormalizer.parseLiteral("-.5"));
        assertNull(NumericNormalizer.parseLiteral("12%"));
        assertNull(NumericNormalizer.parseLiteral("1,234"));
        assertNull(NumericNormalizer.parseLiteral(null));
    }
}
