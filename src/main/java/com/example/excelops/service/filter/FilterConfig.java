package com.example.excelops.service.filter;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Objects;

@JsonIgnoreProperties(ignoreUnknown = true)
public record FilterConfig(List<FilterRow> filters) {

    public FilterConfig {
        filters = filters == null ? List.of() : filters.stream()
                .filter(Objects::nonNull)
                .toList();
    }

    public static FilterConfig empty() {
        return new FilterConfig(List.of());
    }
}
