package com.example.excelops.service.filter;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One line of a sheet's filter list. The operator is kept as entered so that presets
 * round-trip unchanged; it is resolved against {@link FilterOperator} when the filter runs.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FilterRow(
        @JsonProperty("join") String join,
        @JsonProperty("col") String column,
        @JsonProperty("op") String operator,
        @JsonProperty("val") String value,
        @JsonProperty("cmp") String compareColumn
) {
    public static final String COLUMN_AVERAGE = "Column Average";

    public FilterRow {
        join = join == null ? "" : join;
        column = column == null ? "" : column;
        operator = operator == null ? "==" : operator;
        value = value == null ? "" : value;
        compareColumn = compareColumn == null ? "" : compareColumn;
    }

    public static FilterRow of(String join, String column, String operator, String value) {
        return new FilterRow(join, column, operator, value, "");
    }

    public static FilterRow columns(String join, String column, String operator, String compareColumn) {
        return new FilterRow(join, column, operator, "", compareColumn);
    }

    public boolean usesColumnAverage() {
        return COLUMN_AVERAGE.equalsIgnoreCase(value.trim());
    }
}
