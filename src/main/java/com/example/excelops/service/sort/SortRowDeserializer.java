package com.example.excelops.service.sort;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import java.io.IOException;

/**
 * Reads the three-element {@code [join, column, order]} form, the older two-element
 * {@code [column, order]} form (join defaults to AND), and plain objects.
 */
class SortRowDeserializer extends StdDeserializer<SortRow> {

    public SortRowDeserializer() {
        super(SortRow.class);
    }

    @Override
    public SortRow deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        JsonNode node = context.readTree(parser);
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isArray()) {
            if (node.size() == 2) {
                return new SortRow("AND", text(node.get(0)), SortDirection.parse(text(node.get(1))));
            }
            return new SortRow(text(node.get(0)), text(node.get(1)), SortDirection.parse(text(node.get(2))));
        }
        if (node.isObject()) {
            String order = text(node.has("order") ? node.get("order") : node.get("direction"));
            String column = text(node.has("col") ? node.get("col") : node.get("column"));
            return new SortRow(text(node.get("join")), column, SortDirection.parse(order));
        }
        return (SortRow) context.handleUnexpectedToken(SortRow.class, parser);
    }

    private static String text(JsonNode node) {
        return node == null || node.isNull() ? null : node.asText();
    }
}
