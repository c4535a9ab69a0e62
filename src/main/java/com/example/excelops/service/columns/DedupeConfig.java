package com.example.excelops.service.columns;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record DedupeConfig(boolean enabled, String column) {

    public DedupeConfig {
        column = column == null ? "" : column;
    }

    public static DedupeConfig disabled() {
        return new DedupeConfig(false, "");
    }
}
