package com.example.excelops.service.preset;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Stores presets as {@code <name>.json} files in one directory.
 */
@Slf4j
@Service
public class PresetService {

    private static final String EXTENSION = ".json";
    private static final Pattern NAME_PATTERN = Pattern.compile("[\\w][\\w .-]{0,99}");

    private final ObjectMapper objectMapper;
    private final Path directory;

    @Autowired
    public PresetService(ObjectMapper objectMapper, @Value("${excelops.presets.dir:presets}") String directory) {
        this(objectMapper, Paths.get(directory));
    }

    public PresetService(ObjectMapper objectMapper, Path directory) {
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
        this.directory = directory.toAbsolutePath().normalize();
    }

    public List<String> list() {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(directory)) {
            return files
                    .map(p -> p.getFileName().toString())
                    .filter(n -> n.endsWith(EXTENSION))
                    .map(n -> n.substring(0, n.length() - EXTENSION.length()))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to list presets: " + e.getMessage(), e);
        }
    }

    public void save(String name, PresetDocument preset) {
        Path path = pathFor(name);
        try {
            Files.createDirectories(directory);
            objectMapper.writeValue(path.toFile(), preset);
            log.info("Saved preset '{}' with {} sheet(s)", name, preset.sheets().size());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to save preset '" + name + "': " + e.getMessage(), e);
        }
    }

    public PresetDocument load(String name) {
        Path path = pathFor(name);
        if (!Files.exists(path)) {
            throw new PresetNotFoundException(name);
        }
        try {
            PresetDocument preset = objectMapper.readValue(path.toFile(), PresetDocument.class);
            return preset == null ? new PresetDocument(List.of()) : preset;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read preset '" + name + "': " + e.getMessage(), e);
        }
    }

    public void delete(String name) {
        Path path = pathFor(name);
        try {
            if (!Files.deleteIfExists(path)) {
                throw new PresetNotFoundException(name);
            }
            log.info("Deleted preset '{}'", name);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to delete preset '" + name + "': " + e.getMessage(), e);
        }
    }

    public String toJson(PresetDocument preset) {
        try {
            return objectMapper.writeValueAsString(preset);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to serialize preset: " + e.getMessage(), e);
        }
    }

    public PresetDocument fromJson(String json) {
        try {
            return objectMapper.readValue(json, PresetDocument.class);
        } catch (IOException e) {
            throw new IllegalArgumentException("Invalid preset document: " + e.getMessage(), e);
        }
    }

    private Path pathFor(String name) {
        if (name == null || !NAME_PATTERN.matcher(name.trim()).matches()) {
            throw new IllegalArgumentException("Invalid preset name: " + name);
        }
        return directory.resolve(name.trim() + EXTENSION);
    }
}
