package com.example.excelops.web;

import com.example.excelops.service.io.WorkbookExporter;
import com.example.excelops.service.pipeline.DatasetSummary;
import com.example.excelops.service.pipeline.PreviewResult;
import com.example.excelops.service.pipeline.VlookupSummary;
import com.example.excelops.service.pipeline.WorkspaceService;
import com.example.excelops.service.pivot.PivotSpec;
import com.example.excelops.service.preset.SheetPreset;
import com.example.excelops.service.vlookup.JoinSpec;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/excel")
@RequiredArgsConstructor
public class ExcelOpsController {

    static final MediaType XLSX = MediaType.parseMediaType(
            "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet");

    private final WorkspaceService workspaceService;

    @PostMapping("/load")
    public DatasetSummary load(@RequestParam("file") MultipartFile file) throws IOException {
        requireFile(file);
        try (InputStream in = file.getInputStream()) {
            return workspaceService.load(in, file.getOriginalFilename());
        }
    }

    @GetMapping("/raw")
    public PreviewResult raw() {
        return workspaceService.rawPreview();
    }

    @PostMapping("/raw/delete-rows")
    public DatasetSummary deleteRows(@RequestBody List<Integer> rows) {
        return workspaceService.deleteRows(rows);
    }

    @GetMapping("/sheets")
    public List<String> sheets() {
        return workspaceService.listSheets();
    }

    @PostMapping("/sheets")
    public Map<String, String> addSheet() {
        return Map.of("name", workspaceService.addSheet());
    }

    @PutMapping("/sheets/{name}/rename")
    public List<String> renameSheet(@PathVariable String name, @RequestParam("to") String newName) {
        workspaceService.renameSheet(name, newName);
        return workspaceService.listSheets();
    }

    @PostMapping("/sheets/{name}/duplicate")
    public Map<String, String> duplicateSheet(@PathVariable String name) {
        return Map.of("name", workspaceService.duplicateSheet(name));
    }

    @PostMapping("/sheets/{name}/reset")
    public SheetPreset resetSheet(@PathVariable String name) {
        workspaceService.resetSheet(name);
        return workspaceService.sheetConfig(name);
    }

    @DeleteMapping("/sheets/{name}")
    public List<String> closeSheet(@PathVariable String name) {
        workspaceService.closeSheet(name);
        return workspaceService.listSheets();
    }

    @GetMapping("/sheets/{name}/config")
    public SheetPreset sheetConfig(@PathVariable String name) {
        return workspaceService.sheetConfig(name);
    }

    @PutMapping("/sheets/{name}/config")
    public SheetPreset updateSheetConfig(@PathVariable String name, @RequestBody SheetPreset config) {
        return workspaceService.updateSheetConfig(name, config);
    }

    @GetMapping("/sheets/{name}/preview")
    public PreviewResult preview(@PathVariable String name) {
        return workspaceService.preview(name);
    }

    @GetMapping("/sheets/{name}/filter-values")
    public List<String> filterValues(@PathVariable String name, @RequestParam("column") String column) {
        return workspaceService.filterValues(name, column);
    }

    @PostMapping("/sheets/{name}/pivot/preview")
    public PreviewResult pivotPreview(@PathVariable String name, @RequestBody(required = false) PivotSpec spec) {
        return workspaceService.pivotPreview(name, spec);
    }

    @PostMapping("/sheets/{name}/pivot/generate")
    public PreviewResult pivotGenerate(@PathVariable String name, @RequestBody(required = false) PivotSpec spec) {
        return workspaceService.pivotGenerate(name, spec);
    }

    @PostMapping("/sheets/{name}/pivot/clear")
    public SheetPreset pivotClear(@PathVariable String name) {
        workspaceService.pivotClear(name);
        return workspaceService.sheetConfig(name);
    }

    @PostMapping("/sheets/{name}/vlookup")
    public VlookupSummary vlookup(@PathVariable String name,
                                  @RequestParam("file") MultipartFile file,
                                  @RequestParam(value = "mainKeys", required = false) String mainKeys,
                                  @RequestParam(value = "lookupKeys", required = false) String lookupKeys,
                                  @RequestParam(value = "values", required = false) String values,
                                  @RequestParam(value = "prefix", required = false) String prefix,
                                  @RequestParam(value = "defaultFill", required = false) String defaultFill)
            throws IOException {
        requireFile(file);
        JoinSpec spec = mainKeys == null ? null : new JoinSpec(
                List.of(mainKeys),
                lookupKeys == null ? List.of() : List.of(lookupKeys),
                values == null ? List.of() : List.of(values),
                prefix,
                defaultFill);
        try (InputStream in = file.getInputStream()) {
            return workspaceService.vlookup(name, in, file.getOriginalFilename(), spec);
        }
    }

    @GetMapping("/sheets/{name}/export")
    public ResponseEntity<byte[]> exportSheet(@PathVariable String name) {
        return xlsx(workspaceService.exportSheet(name), WorkbookExporter.sanitizeSheetName(name) + ".xlsx");
    }

    @GetMapping("/export")
    public ResponseEntity<byte[]> exportWorkbook() {
        return xlsx(workspaceService.exportWorkbook(), "excelops_export.xlsx");
    }

    static ResponseEntity<byte[]> xlsx(byte[] bytes, String fileName) {
        ContentDisposition disposition = ContentDisposition.attachment().filename(fileName).build();
        return ResponseEntity.ok()
                .contentType(XLSX)
                .header(HttpHeaders.CONTENT_DISPOSITION, disposition.toString())
                .body(bytes);
    }

    static void requireFile(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException("File must not be empty.");
        }
    }
}
