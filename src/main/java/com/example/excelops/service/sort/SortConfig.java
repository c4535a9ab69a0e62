package com.example.excelops.service.sort;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Objects;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SortConfig(List<SortRow> sorts) {

    public SortConfig {
        sorts = sorts == null ? List.of() : sorts.stream()
                .filter(Objects::nonNull)
                .toList();
    }

    public static SortConfig empty() {
        return new SortConfig(List.of());
    }
}
