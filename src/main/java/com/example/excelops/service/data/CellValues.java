package com.example.excelops.service.data;

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.List;

/**
 * Text rendering and ordering rules shared by every engine.
 */
public final class CellValues {

    private CellValues() {
    }

    /**
     * Text form of a cell: {@code null} is empty, integral numbers drop the fraction.
     */
    public static String asText(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d)) {
                return "";
            }
            if (Double.isInfinite(d)) {
                return Double.toString(d);
            }
            if (d == Math.rint(d) && Math.abs(d) < 1e15) {
                return Long.toString((long) d);
            }
            return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
        }
        return value.toString();
    }

    public static boolean isBlank(Object value) {
        return value == null || asText(value).isBlank();
    }

    /**
     * Ordering for the cells of one column. Columns whose non-null cells are all numbers
     * order numerically, anything else orders by text. Nulls are not handled here.
     */
    public static Comparator<Object> comparatorFor(List<Object> column) {
        boolean numeric = true;
        for (Object value : column) {
            if (value != null && !(value instanceof Number)) {
                numeric = false;
                break;
            }
        }
        if (numeric) {
            return (a, b) -> Double.compare(((Number) a).doubleValue(), ((Number) b).doubleValue());
        }
        return Comparator.comparing(CellValues::asText);
    }
}
