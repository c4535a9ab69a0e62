package com.example.excelops.service.vlookup;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * VLOOKUP settings of a sheet. Key and value lists also accept comma-separated strings,
 * which is how older presets stored them.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JoinSpec(
        @JsonProperty("main_keys")
        @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
        List<String> mainKeys,
        @JsonProperty("lookup_keys")
        @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
        List<String> lookupKeys,
        @JsonProperty("values")
        @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
        List<String> valueColumns,
        @JsonProperty("prefix") String prefix,
        @JsonProperty("default_fill") String defaultFill
) {

    public JoinSpec {
        mainKeys = split(mainKeys);
        lookupKeys = split(lookupKeys);
        valueColumns = split(valueColumns);
        prefix = prefix == null ? "" : prefix.trim();
        defaultFill = defaultFill == null || defaultFill.isEmpty() ? null : defaultFill;
    }

    public static JoinSpec empty() {
        return new JoinSpec(List.of(), List.of(), List.of(), "", null);
    }

    /**
     * Lookup-side keys, falling back to the main keys when none were given.
     */
    public List<String> effectiveLookupKeys() {
        return lookupKeys.isEmpty() ? mainKeys : lookupKeys;
    }

    private static List<String> split(List<String> raw) {
        if (raw == null) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (String entry : raw) {
            if (entry == null) {
                continue;
            }
            for (String part : entry.split(",")) {
                if (!part.isBlank()) {
                    out.add(part.trim());
                }
            }
        }
        return List.copyOf(out);
    }
}
