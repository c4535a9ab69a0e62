package com.example.excelops.service.automation;

import com.example.excelops.service.data.Dataset;
import com.example.excelops.service.io.TabularFileReader;
import com.example.excelops.service.io.WorkbookExporter;
import com.example.excelops.service.pipeline.PipelineOrchestrator;
import com.example.excelops.service.preset.PresetDocument;
import com.example.excelops.service.preset.PresetService;
import com.example.excelops.service.preset.SheetPreset;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.InputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One-shot batch runs: a preset's first sheet applied once per user identifier, one output
 * worksheet per identifier that has rows.
 */
@Slf4j
@Service
public class AutomationService {

    private static final String OUTPUT_SUFFIX = "_OUTPUT.xlsx";
    private static final int LOCK_STRIPES = 64;

    private final TabularFileReader reader;
    private final WorkbookExporter exporter;
    private final PresetService presetService;
    private final String userColumn;

    // runs on the same path share a stripe
    private final ReentrantLock[] pathLocks = new ReentrantLock[LOCK_STRIPES];

    public AutomationService(TabularFileReader reader,
                             WorkbookExporter exporter,
                             PresetService presetService,
                             @Value("${excelops.automation.user-column:User}") String userColumn) {
        this.reader = reader;
        this.exporter = exporter;
        this.presetService = presetService;
        this.userColumn = userColumn;
        for (int i = 0; i < LOCK_STRIPES; i++) {
            pathLocks[i] = new ReentrantLock();
        }
    }

    public byte[] run(InputStream in, String fileName, Collection<String> users, String presetName) {
        Dataset raw = reader.read(in, fileName);
        return exporter.write(process(raw, users, presetService.load(presetName)));
    }

    /**
     * Writes {@code <input>_OUTPUT.xlsx} next to the input file. Runs on the same input are
     * serialized.
     */
    public Path runOnFile(Path input, Collection<String> users, String presetName) {
        Path key = input.toAbsolutePath().normalize();
        ReentrantLock lock = lockFor(key);
        lock.lock();
        try {
            Dataset raw = reader.read(key);
            Map<String, Dataset> sheets = process(raw, users, presetService.load(presetName));
            Path output = outputPathFor(key);
            exporter.writeTo(output, sheets);
            return output;
        } finally {
            lock.unlock();
        }
    }

    ReentrantLock lockFor(Path path) {
        return pathLocks[Math.floorMod(path.hashCode(), LOCK_STRIPES)];
    }

    public LinkedHashMap<String, Dataset> process(Dataset raw, Collection<String> users, PresetDocument preset) {
        SheetPreset sheet = preset.firstSheet();
        if (sheet == null) {
            throw new IllegalArgumentException("Preset has no sheets.");
        }
        List<String> ids = normalizeUsers(users);
        if (ids.isEmpty()) {
            throw new IllegalArgumentException("No valid user identifiers given.");
        }

        LinkedHashMap<String, Dataset> out = new LinkedHashMap<>();
        for (String user : ids) {
            Dataset result = PipelineOrchestrator.applyPreset(raw, sheet, Map.of(userColumn, user));
            if (result.rowCount() == 0) {
                log.info("No rows for user '{}', skipped", user);
                continue;
            }
            out.put(user, result);
        }
        if (out.isEmpty()) {
            throw new IllegalStateException("None of the given users has matching rows.");
        }
        log.info("Automation produced {} sheet(s) for {} user(s)", out.size(), ids.size());
        return out;
    }

    /**
     * Splits comma-separated entries, trims them and drops blanks and repeats.
     */
    public static List<String> normalizeUsers(Collection<String> users) {
        List<String> out = new ArrayList<>();
        if (users == null) {
            return out;
        }
        for (String entry : users) {
            if (entry == null) continue;
            for (String part : entry.split(",")) {
                String id = part.trim();
                if (!id.isEmpty() && !out.contains(id)) {
                    out.add(id);
                }
            }
        }
        return out;
    }

    static Path outputPathFor(Path input) {
        String fileName = input.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String base = dot > 0 ? fileName.substring(0, dot) : fileName;
        return input.resolveSibling(base + OUTPUT_SUFFIX);
    }
}
