package com.example.excelops.service.pipeline;

import com.example.excelops.service.data.CellValues;
import com.example.excelops.service.data.Dataset;
import com.example.excelops.service.filter.FilterEngine;
import com.example.excelops.service.io.TabularFileReader;
import com.example.excelops.service.io.WorkbookExporter;
import com.example.excelops.service.pivot.PivotException;
import com.example.excelops.service.pivot.PivotSpec;
import com.example.excelops.service.preset.PresetDocument;
import com.example.excelops.service.preset.SheetPreset;
import com.example.excelops.service.vlookup.JoinSpec;
import com.example.excelops.service.vlookup.VlookupEngine;
import com.example.excelops.service.vlookup.VlookupResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the loaded dataset and its sheets, and runs every interactive operation against them.
 */
@Slf4j
@Service
public class WorkspaceService {

    private final TabularFileReader reader;
    private final WorkbookExporter exporter;
    private final int previewLimit;

    private final AtomicReference<Workspace> workspaceRef = new AtomicReference<>();

    public WorkspaceService(TabularFileReader reader,
                            WorkbookExporter exporter,
                            @Value("${excelops.preview.limit:500}") int previewLimit) {
        this.reader = reader;
        this.exporter = exporter;
        this.previewLimit = previewLimit;
    }

    // =========================
    // Dataset
    // =========================

    /**
     * Loads a file as the working dataset. Open sheets keep their configs; when none is open,
     * {@code Sheet1} is created.
     */
    public synchronized DatasetSummary load(InputStream in, String fileName) {
        Dataset dataset = reader.read(in, fileName);
        Workspace workspace = workspaceRef.get();
        if (workspace == null) {
            workspace = new Workspace(dataset, fileName);
            workspaceRef.set(workspace);
        } else {
            workspace.replaceDataset(dataset, fileName);
        }
        if (workspace.getSheets().isEmpty()) {
            workspace.addSheet(workspace.nextSheetName());
        }
        return summary(workspace);
    }

    public synchronized DatasetSummary summary() {
        return summary(workspace());
    }

    public synchronized PreviewResult rawPreview() {
        return preview(workspace().getDataset());
    }

    public synchronized DatasetSummary deleteRows(Collection<Integer> rowIndexes) {
        Workspace workspace = workspace();
        Dataset dataset = workspace.getDataset();
        Set<Integer> targets = new HashSet<>();
        for (Integer index : rowIndexes) {
            if (index == null || index < 0 || index >= dataset.rowCount()) {
                throw new IllegalArgumentException("Row index out of range: " + index);
            }
            targets.add(index);
        }
        workspace.replaceDataset(dataset.withoutRows(targets));
        log.info("Deleted {} row(s), {} left", targets.size(), workspace.getDataset().rowCount());
        return summary(workspace);
    }

    // =========================
    // Sheets
    // =========================

    public synchronized List<String> listSheets() {
        return workspace().sheetNames();
    }

    public synchronized String addSheet() {
        Workspace workspace = workspace();
        return workspace.addSheet(workspace.nextSheetName()).getName();
    }

    public synchronized void renameSheet(String name, String newName) {
        Workspace workspace = workspace();
        String target = newName == null ? "" : newName.trim();
        if (target.isEmpty()) {
            throw new IllegalArgumentException("Sheet name must not be empty.");
        }
        Sheet sheet = workspace.sheet(name);
        if (target.equals(name)) {
            return;
        }
        if (workspace.hasSheet(target)) {
            throw new IllegalArgumentException("A sheet named '" + target + "' already exists.");
        }
        sheet.setName(target);
    }

    public synchronized String duplicateSheet(String name) {
        Workspace workspace = workspace();
        Sheet copy = workspace.sheet(name).copyAs(workspace.nextSheetName());
        workspace.addSheet(copy);
        return copy.getName();
    }

    public synchronized void closeSheet(String name) {
        workspace().removeSheet(name);
    }

    public synchronized void resetSheet(String name) {
        Workspace workspace = workspace();
        workspace.sheet(name).reset(workspace.getDataset().columns());
    }

    public synchronized SheetPreset sheetConfig(String name) {
        return workspace().sheet(name).toPreset();
    }

    /**
     * Replaces a sheet's filters, sorts, columns, pivot and VLOOKUP settings. The preset's name
     * is ignored; use {@link #renameSheet} for that.
     */
    public synchronized SheetPreset updateSheetConfig(String name, SheetPreset config) {
        Workspace workspace = workspace();
        Sheet sheet = workspace.sheet(name);
        sheet.apply(config);
        sheet.reconcile(workspace.getDataset().columns());
        return sheet.toPreset();
    }

    public synchronized PreviewResult preview(String name) {
        Workspace workspace = workspace();
        return preview(PipelineOrchestrator.derivedView(workspace.getDataset(), workspace.sheet(name)));
    }

    /**
     * Values offered for a filter's value field: the distinct cells of the column in the sheet's
     * unfiltered data.
     */
    public synchronized List<String> filterValues(String name, String column) {
        Workspace workspace = workspace();
        workspace.sheet(name);
        return FilterEngine.suggestValues(workspace.getDataset(), column);
    }

    // =========================
    // Pivot
    // =========================

    public synchronized PreviewResult pivotPreview(String name, PivotSpec spec) {
        Workspace workspace = workspace();
        Sheet sheet = workspace.sheet(name);
        return preview(buildPivot(workspace.getDataset(), sheet, spec));
    }

    public synchronized PreviewResult pivotGenerate(String name, PivotSpec spec) {
        Workspace workspace = workspace();
        Sheet sheet = workspace.sheet(name);
        Dataset pivot = buildPivot(workspace.getDataset(), sheet, spec);
        sheet.setPivot(effective(sheet, spec).withGenerated(true));
        log.info("Pivot generated on '{}': {} rows", name, pivot.rowCount());
        return preview(pivot);
    }

    public synchronized void pivotClear(String name) {
        workspace().sheet(name).setPivot(PivotSpec.empty());
    }

    private Dataset buildPivot(Dataset raw, Sheet sheet, PivotSpec spec) {
        PivotSpec effective = effective(sheet, spec);
        if (!effective.hasRows()) {
            throw new PivotException("Select at least one row field.");
        }
        Dataset base = PipelineOrchestrator.baseView(raw, sheet);
        Sheet probe = sheet.copyAs(sheet.getName());
        probe.setPivot(effective);
        return PipelineOrchestrator.pivot(base, probe)
                .orElseThrow(() -> new PivotException("None of the selected row fields exist in the sheet."));
    }

    private static PivotSpec effective(Sheet sheet, PivotSpec spec) {
        return spec == null ? sheet.getPivot() : spec;
    }

    // =========================
    // VLOOKUP
    // =========================

    /**
     * Joins a lookup file into the sheet's base view. The result becomes the working dataset
     * for every sheet.
     */
    public synchronized VlookupSummary vlookup(String name, InputStream lookupFile, String fileName, JoinSpec spec) {
        Workspace workspace = workspace();
        Sheet sheet = workspace.sheet(name);
        JoinSpec effective = spec == null ? sheet.getVlookup() : spec;
        Dataset main = PipelineOrchestrator.baseView(workspace.getDataset(), sheet);
        Dataset lookup = reader.read(lookupFile, fileName);

        VlookupResult result = VlookupEngine.join(main, lookup, effective);
        sheet.setVlookup(effective);
        workspace.replaceDataset(result.merged());
        log.info("VLOOKUP on '{}' with {}: {} of {} rows matched, added {}",
                name, fileName, result.matchedRows(), result.merged().rowCount(), result.addedColumns());
        return new VlookupSummary(result.addedColumns(), result.matchedRows(), result.merged().rowCount());
    }

    // =========================
    // Export
    // =========================

    public synchronized byte[] exportSheet(String name) {
        Workspace workspace = workspace();
        Sheet sheet = workspace.sheet(name);
        Map<String, Dataset> sheets = new LinkedHashMap<>();
        sheets.put(sheet.getName(), PipelineOrchestrator.derivedView(workspace.getDataset(), sheet));
        return exporter.write(sheets);
    }

    public synchronized byte[] exportWorkbook() {
        Workspace workspace = workspace();
        if (workspace.getSheets().isEmpty()) {
            throw new IllegalStateException("No sheet is open.");
        }
        Map<String, Dataset> sheets = new LinkedHashMap<>();
        for (Sheet sheet : workspace.getSheets()) {
            sheets.put(sheet.getName(), PipelineOrchestrator.derivedView(workspace.getDataset(), sheet));
        }
        return exporter.write(sheets);
    }

    // =========================
    // Presets
    // =========================

    public synchronized PresetDocument snapshot() {
        List<SheetPreset> sheets = new ArrayList<>();
        for (Sheet sheet : workspace().getSheets()) {
            sheets.add(sheet.toPreset());
        }
        return new PresetDocument(sheets);
    }

    /**
     * Replaces all open sheets with the preset's.
     */
    public synchronized List<String> applyPreset(PresetDocument preset) {
        Workspace workspace = workspace();
        if (preset.sheets().isEmpty()) {
            throw new IllegalArgumentException("Preset has no sheets.");
        }
        workspace.clearSheets();
        for (SheetPreset sheetPreset : preset.sheets()) {
            Sheet sheet = Sheet.fromPreset(sheetPreset);
            if (workspace.hasSheet(sheet.getName())) {
                sheet.setName(workspace.nextSheetName());
            }
            workspace.addSheet(sheet);
        }
        return workspace.sheetNames();
    }

    private Workspace workspace() {
        Workspace workspace = workspaceRef.get();
        if (workspace == null) {
            throw new IllegalStateException("Load a file first.");
        }
        return workspace;
    }

    private DatasetSummary summary(Workspace workspace) {
        Dataset dataset = workspace.getDataset();
        return new DatasetSummary(workspace.getSourceName(), dataset.rowCount(), dataset.columns(),
                workspace.sheetNames());
    }

    private PreviewResult preview(Dataset dataset) {
        int limit = Math.min(previewLimit, dataset.rowCount());
        List<List<String>> rows = new ArrayList<>(limit);
        for (int r = 0; r < limit; r++) {
            List<String> line = new ArrayList<>();
            for (Object cell : dataset.rows().get(r)) {
                line.add(CellValues.asText(cell));
            }
            rows.add(line);
        }
        return new PreviewResult(dataset.columns(), rows, dataset.rowCount());
    }
}
