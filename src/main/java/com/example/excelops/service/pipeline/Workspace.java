package com.example.excelops.service.pipeline;

import com.example.excelops.service.data.Dataset;
import lombok.Getter;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * The working dataset and the sheets configured over it.
 * <p>
 * The dataset is only ever replaced as a whole; every replacement reconciles the sheets'
 * column configs against the new column set.
 */
@Getter
public class Workspace {

    private static final String SHEET_PREFIX = "Sheet";

    private Dataset dataset;
    private String sourceName;
    private final List<Sheet> sheets = new ArrayList<>();

    public Workspace(Dataset dataset, String sourceName) {
        this.dataset = dataset;
        this.sourceName = sourceName;
    }

    public void replaceDataset(Dataset replacement, String newSourceName) {
        this.sourceName = newSourceName;
        replaceDataset(replacement);
    }

    public void replaceDataset(Dataset replacement) {
        this.dataset = replacement;
        for (Sheet sheet : sheets) {
            sheet.reconcile(replacement.columns());
        }
    }

    public Sheet sheet(String name) {
        for (Sheet sheet : sheets) {
            if (sheet.getName().equals(name)) {
                return sheet;
            }
        }
        throw new UnknownSheetException(name);
    }

    public boolean hasSheet(String name) {
        return sheets.stream().anyMatch(s -> s.getName().equals(name));
    }

    public List<String> sheetNames() {
        return sheets.stream().map(Sheet::getName).toList();
    }

    /**
     * First free {@code SheetN} name.
     */
    public String nextSheetName() {
        Set<String> existing = new HashSet<>(sheetNames());
        int i = 1;
        while (existing.contains(SHEET_PREFIX + i)) {
            i++;
        }
        return SHEET_PREFIX + i;
    }

    public Sheet addSheet(String name) {
        if (hasSheet(name)) {
            throw new IllegalArgumentException("A sheet named '" + name + "' already exists.");
        }
        Sheet sheet = new Sheet(name);
        sheet.reconcile(dataset.columns());
        sheets.add(sheet);
        return sheet;
    }

    public void addSheet(Sheet sheet) {
        if (hasSheet(sheet.getName())) {
            throw new IllegalArgumentException("A sheet named '" + sheet.getName() + "' already exists.");
        }
        sheet.reconcile(dataset.columns());
        sheets.add(sheet);
    }

    public void removeSheet(String name) {
        sheets.remove(sheet(name));
    }

    public void clearSheets() {
        sheets.clear();
    }
}
