package com.example.excelops.service.vlookup;

import com.example.excelops.service.data.CellValues;
import com.example.excelops.service.data.Dataset;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Left outer join of a lookup table into a main table, Excel VLOOKUP style.
 * <p>
 * Column names given in the join settings are matched case-insensitively after trimming. Every main row is
 * kept; it takes values from the first lookup row (in lookup file order) whose key cells equal its
 * own, compared as trimmed text. Value columns that are lookup keys are not brought over. Added
 * columns are named {@code prefix + name} and get an {@code _lk1}, {@code _lk2}, ... suffix when
 * that name is already taken.
 */
public final class VlookupEngine {

    private static final String COLLISION_SUFFIX = "_lk";

    private VlookupEngine() {
    }

    public static VlookupResult join(Dataset main, Dataset lookup, JoinSpec spec) {
        if (main == null || main.isEmpty()) {
            throw new VlookupException(JoinFailure.EMPTY_SOURCE, "No data available in the main sheet.");
        }
        if (lookup == null || lookup.isEmpty()) {
            throw new VlookupException(JoinFailure.EMPTY_SOURCE, "Lookup file is empty.");
        }
        checkDuplicates(main, "main sheet");
        checkDuplicates(lookup, "lookup file");
        if (spec.mainKeys().isEmpty()) {
            throw new VlookupException(JoinFailure.UNKNOWN_COLUMN, "No key column given for the main sheet.");
        }

        List<String> mainKeys = resolve(main, spec.mainKeys(), "main sheet");
        List<String> lookupKeys = resolve(lookup, spec.effectiveLookupKeys(), "lookup file");
        List<String> valueColumns = resolve(lookup, spec.valueColumns(), "lookup file");
        if (mainKeys.size() != lookupKeys.size()) {
            throw new VlookupException(JoinFailure.KEY_ARITY_MISMATCH,
                    "Number of keys on both sides must match (" + mainKeys.size() + " vs " + lookupKeys.size() + ").");
        }

        try {
            return merge(main, lookup, mainKeys, lookupKeys, bringOver(valueColumns, lookupKeys), spec);
        } catch (RuntimeException e) {
            throw new VlookupException(JoinFailure.MERGE_FAILED, "Merge failed: " + e.getMessage(), e);
        }
    }

    private static VlookupResult merge(Dataset main,
                                       Dataset lookup,
                                       List<String> mainKeys,
                                       List<String> lookupKeys,
                                       List<String> valueColumns,
                                       JoinSpec spec) {
        Map<List<String>, Integer> index = new HashMap<>();
        for (int r = 0; r < lookup.rowCount(); r++) {
            List<String> key = keyOf(lookup, r, lookupKeys);
            if (key != null) {
                index.putIfAbsent(key, r);
            }
        }

        List<String> added = addedNames(main.columns(), valueColumns, spec.prefix());
        List<String> header = new ArrayList<>(main.columns());
        header.addAll(added);

        List<List<Object>> rows = new ArrayList<>(main.rowCount());
        int matched = 0;
        for (int r = 0; r < main.rowCount(); r++) {
            List<Object> line = new ArrayList<>(main.rows().get(r));
            List<String> key = keyOf(main, r, mainKeys);
            Integer hit = key == null ? null : index.get(key);
            if (hit != null) {
                matched++;
            }
            for (String value : valueColumns) {
                Object cell = hit == null ? null : lookup.value(hit, value);
                line.add(cell == null ? spec.defaultFill() : cell);
            }
            rows.add(line);
        }
        return new VlookupResult(new Dataset(header, rows), added, matched);
    }

    private static void checkDuplicates(Dataset dataset, String side) {
        Set<String> duplicates = dataset.duplicateColumns();
        if (!duplicates.isEmpty()) {
            throw new VlookupException(JoinFailure.DUPLICATE_COLUMNS,
                    "Duplicate column names in " + side + ": " + String.join(", ", duplicates));
        }
    }

    /**
     * Maps requested names onto the dataset's own spelling. An exact name wins over a trimmed
     * one, which wins over a case-insensitive one.
     */
    static List<String> resolve(Dataset dataset, List<String> requested, String side) {
        Map<String, String> trimmed = new HashMap<>();
        Map<String, String> canonical = new HashMap<>();
        for (String column : dataset.columns()) {
            trimmed.putIfAbsent(column.trim(), column);
            canonical.putIfAbsent(fold(column), column);
        }
        List<String> out = new ArrayList<>(requested.size());
        for (String name : requested) {
            String actual = dataset.columns().contains(name) ? name : null;
            if (actual == null && name != null) {
                actual = trimmed.get(name.trim());
            }
            if (actual == null) {
                actual = canonical.get(fold(name));
            }
            if (actual == null) {
                throw new VlookupException(JoinFailure.UNKNOWN_COLUMN,
                        "Column '" + name + "' not found in " + side + ".");
            }
            out.add(actual);
        }
        return out;
    }

    private static List<String> bringOver(List<String> valueColumns, List<String> lookupKeys) {
        List<String> out = new ArrayList<>();
        for (String value : valueColumns) {
            if (!lookupKeys.contains(value) && !out.contains(value)) {
                out.add(value);
            }
        }
        return out;
    }

    static List<String> addedNames(List<String> existing, List<String> valueColumns, String prefix) {
        Set<String> taken = new HashSet<>(existing);
        List<String> names = new ArrayList<>(valueColumns.size());
        for (String value : valueColumns) {
            String base = prefix.isEmpty() ? value : prefix + value;
            String name = base;
            int i = 1;
            while (taken.contains(name)) {
                name = base + COLLISION_SUFFIX + i++;
            }
            taken.add(name);
            names.add(name);
        }
        return names;
    }

    private static List<String> keyOf(Dataset dataset, int row, List<String> keys) {
        List<String> key = new ArrayList<>(keys.size());
        for (String k : keys) {
            Object cell = dataset.value(row, k);
            if (cell == null) {
                return null;
            }
            key.add(CellValues.asText(cell).trim());
        }
        return key;
    }

    private static String fold(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }
}
