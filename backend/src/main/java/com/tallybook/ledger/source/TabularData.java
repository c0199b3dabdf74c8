package com.tallybook.ledger.source;

import java.util.List;
import java.util.Map;

/**
 * A fully materialized sheet: header names plus one map per data row, keyed by header.
 * Missing cells map to null.
 */
public record TabularData(List<String> headers, List<Map<String, String>> rows) {

    public TabularData {
        headers = List.copyOf(headers);
        rows = List.copyOf(rows);
    }

    public int rowCount() {
        return rows.size();
    }

    public boolean hasColumn(String column) {
        return column != null && headers.contains(column);
    }
}
