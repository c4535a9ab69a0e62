package com.example.excelops.service.filter;

import java.util.Locale;

/**
 * How a filter or sort row links to the rows before it. Ignored on the first row.
 */
public enum Conjunction {
    AND,
    OR;

    /**
     * Anything other than {@code OR} (case-insensitive) reads as {@code AND}.
     */
    public static Conjunction parse(String raw) {
        if (raw != null && "OR".equals(raw.trim().toUpperCase(Locale.ROOT))) {
            return OR;
        }
        return AND;
    }
}
