package com.example.excelops.service.preset;

public class PresetNotFoundException extends IllegalStateException {

    public PresetNotFoundException(String name) {
        super("Preset not found: " + name);
    }
}
