package com.example.excelops.web;

import com.example.excelops.service.pipeline.WorkspaceService;
import com.example.excelops.service.preset.PresetDocument;
import com.example.excelops.service.preset.PresetService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/presets")
@RequiredArgsConstructor
public class PresetController {

    private final PresetService presetService;
    private final WorkspaceService workspaceService;

    @GetMapping
    public List<String> list() {
        return presetService.list();
    }

    @GetMapping("/{name}")
    public PresetDocument get(@PathVariable String name) {
        return presetService.load(name);
    }

    /**
     * Saves the open sheets under {@code name}.
     */
    @PostMapping("/{name}")
    public List<String> save(@PathVariable String name) {
        presetService.save(name, workspaceService.snapshot());
        return presetService.list();
    }

    @PostMapping("/{name}/load")
    public List<String> load(@PathVariable String name) {
        return workspaceService.applyPreset(presetService.load(name));
    }

    @DeleteMapping("/{name}")
    public List<String> delete(@PathVariable String name) {
        presetService.delete(name);
        return presetService.list();
    }
}
