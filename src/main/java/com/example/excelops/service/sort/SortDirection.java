package com.example.excelops.service.sort;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SortDirection {
    ASCENDING("Ascending"),
    DESCENDING("Descending");

    private final String label;

    SortDirection(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /**
     * Only an explicit descending value reads as {@link #DESCENDING}.
     */
    @JsonCreator
    public static SortDirection parse(String raw) {
        if (raw == null) {
            return ASCENDING;
        }
        String s = raw.trim().toLowerCase(Locale.ROOT);
        return s.equals("descending") || s.equals("desc") ? DESCENDING : ASCENDING;
    }
}
