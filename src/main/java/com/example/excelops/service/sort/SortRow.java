package com.example.excelops.service.sort;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

/**
 * One sort level. Written to presets as a {@code [join, column, order]} array.
 */
@JsonFormat(shape = JsonFormat.Shape.ARRAY)
@JsonPropertyOrder({"join", "column", "direction"})
@JsonDeserialize(using = SortRowDeserializer.class)
public record SortRow(
        String join,
        String column,
        SortDirection direction
) {
    public SortRow {
        join = join == null ? "" : join;
        column = column == null ? "" : column;
        direction = direction == null ? SortDirection.ASCENDING : direction;
    }

    public boolean ascending() {
        return direction == SortDirection.ASCENDING;
    }
}
