package com.example.excelops.service.data;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Coerces text and number cells into comparable doubles. Percent signs and thousands
 * separators are stripped first, so {@code "12.5%"} is 12.5 and {@code "1,234"} is 1234.
 * Anything else that does not read as a plain decimal number becomes {@code null}.
 */
public final class NumericNormalizer {

    private static final Pattern PLAIN_NUMBER =
            Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private NumericNormalizer() {
    }

    public static Double normalize(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            double d = number.doubleValue();
            return Double.isNaN(d) ? null : d;
        }
        String s = value.toString().trim()
                .replace("%", "")
                .replace(",", "");
        if (s.isEmpty() || !PLAIN_NUMBER.matcher(s).matches()) {
            return null;
        }
        try {
            return Double.parseDouble(s);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Reads a typed literal as a number. Unlike cell values, a literal keeps its {@code %} and
     * {@code ,} characters, so {@code "12%"} is not a number here.
     */
    public static Double parseLiteral(String literal) {
        if (literal == null) {
            return null;
        }
        String s = literal.trim();
        if (!PLAIN_NUMBER.matcher(s).matches()) {
            return null;
        }
        try {
            return Double.parseDouble(s);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public static List<Double> normalize(List<?> series) {
        List<Double> out = new ArrayList<>(series.size());
        for (Object value : series) {
            out.add(normalize(value));
        }
        return out;
    }

    /**
     * Mean of the non-null values, or {@code null} when there are none.
     */
    public static Double mean(List<Double> series) {
        double sum = 0;
        int count = 0;
        for (Double d : series) {
            if (d != null) {
                sum += d;
                count++;
            }
        }
        return count == 0 ? null : sum / count;
    }
}
