package com.example.excelops.service.columns;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Column order, visibility and row de-duplication for one sheet.
 * {@code order} is the full column universe of the sheet: columns missing from it are not shown.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ColumnConfig(
        List<String> order,
        Map<String, Boolean> visible,
        DedupeConfig dedupe
) {

    public ColumnConfig {
        order = order == null ? List.of() : order.stream()
                .filter(Objects::nonNull)
                .distinct()
                .toList();
        Map<String, Boolean> copy = new LinkedHashMap<>();
        if (visible != null) {
            visible.forEach((k, v) -> {
                if (k != null) {
                    copy.put(k, v == null || v);
                }
            });
        }
        visible = Collections.unmodifiableMap(copy);
        dedupe = dedupe == null ? DedupeConfig.disabled() : dedupe;
    }

    public static ColumnConfig empty() {
        return new ColumnConfig(List.of(), Map.of(), DedupeConfig.disabled());
    }

    /**
     * Every column shown, in dataset order.
     */
    public static ColumnConfig allVisible(List<String> columns) {
        return empty().reconcile(columns);
    }

    public boolean isVisible(String column) {
        return visible.getOrDefault(column, Boolean.TRUE);
    }

    /**
     * Brings the config in line with a new column set: new columns are appended as visible,
     * columns that no longer exist are dropped, and a stale dedupe column is cleared.
     */
    public ColumnConfig reconcile(List<String> columns) {
        LinkedHashSet<String> current = new LinkedHashSet<>(columns);
        List<String> newOrder = new ArrayList<>();
        for (String c : order) {
            if (current.contains(c)) {
                newOrder.add(c);
            }
        }
        for (String c : current) {
            if (!newOrder.contains(c)) {
                newOrder.add(c);
            }
        }
        Map<String, Boolean> newVisible = new LinkedHashMap<>();
        for (String c : newOrder) {
            newVisible.put(c, isVisible(c));
        }
        DedupeConfig newDedupe = current.contains(dedupe.column())
                ? dedupe
                : new DedupeConfig(dedupe.enabled(), "");
        return new ColumnConfig(newOrder, newVisible, newDedupe);
    }

    public ColumnConfig withVisibility(String column, boolean shown) {
        Map<String, Boolean> copy = new LinkedHashMap<>(visible);
        copy.put(column, shown);
        return new ColumnConfig(order, copy, dedupe);
    }

    public ColumnConfig withOrder(List<String> newOrder) {
        return new ColumnConfig(newOrder, visible, dedupe);
    }

    public ColumnConfig withDedupe(DedupeConfig newDedupe) {
        return new ColumnConfig(order, visible, newDedupe);
    }
}
