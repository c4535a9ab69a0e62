package com.example.excelops.service.pivot;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Cross-tab definition for a sheet. {@code generated} marks a pivot that replaces the sheet's
 * derived view instead of only being previewed.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PivotSpec(
        List<String> rows,
        List<String> columns,
        List<String> values,
        Aggregation agg,
        boolean generated
) {

    public PivotSpec {
        rows = clean(rows);
        columns = clean(columns);
        values = clean(values);
        agg = agg == null ? Aggregation.SUM : agg;
    }

    /**
     * Reads presets that still carry the single {@code value} field.
     */
    @JsonCreator
    static PivotSpec fromJson(@JsonProperty("rows") List<String> rows,
                              @JsonProperty("columns") List<String> columns,
                              @JsonProperty("values") List<String> values,
                              @JsonProperty("value") String legacyValue,
                              @JsonProperty("agg") Aggregation aggregation,
                              @JsonProperty("generated") boolean generated) {
        List<String> resolvedValues = values;
        if (resolvedValues == null && legacyValue != null && !legacyValue.isBlank()) {
            resolvedValues = List.of(legacyValue);
        }
        return new PivotSpec(rows, columns, resolvedValues, aggregation, generated);
    }

    public static PivotSpec empty() {
        return new PivotSpec(List.of(), List.of(), List.of(), Aggregation.SUM, false);
    }

    public PivotSpec withGenerated(boolean flag) {
        return new PivotSpec(rows, columns, values, agg, flag);
    }

    private static List<String> clean(List<String> names) {
        if (names == null) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (String name : names) {
            if (name != null && !name.isBlank() && !out.contains(name)) {
                out.add(name);
            }
        }
        return List.copyOf(out);
    }

    public boolean hasRows() {
        return !rows.isEmpty();
    }
}
