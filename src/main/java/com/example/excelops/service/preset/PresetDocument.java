package com.example.excelops.service.preset;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Objects;

@JsonIgnoreProperties(ignoreUnknown = true)
public record PresetDocument(List<SheetPreset> sheets) {

    public PresetDocument {
        sheets = sheets == null ? List.of() : sheets.stream()
                .filter(Objects::nonNull)
                .toList();
    }

    /**
     * The sheet automation runs with, if any.
     */
    public SheetPreset firstSheet() {
        return sheets.isEmpty() ? null : sheets.get(0);
    }
}
