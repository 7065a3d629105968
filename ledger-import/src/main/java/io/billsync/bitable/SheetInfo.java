package io.billsync.bitable;

import com.fasterxml.jackson.databind.JsonNode;

/** A sheet of a spreadsheet, as listed by the describe endpoint. */
public record SheetInfo(String sheetId, String title) {
    static SheetInfo from(JsonNode node) {
        return new SheetInfo(text(node, "sheet_id"), text(node, "title"));
    }

    private static String text(JsonNode node, String field) {
        JsonNode v = node.get(field);
        return v != null && v.isTextual() ? v.asText() : null;
    }
}
