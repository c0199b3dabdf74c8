package com.tallybook.ledger.dto;

import com.tallybook.ledger.matching.MatchCandidate;

import java.math.BigDecimal;
import java.util.List;

public class ImportPreviewResponse {

    public record PreviewValue(String partner, BigDecimal value) {}

    public record PreviewRow(int rowNo, String name, String normalizedName, String period,
                             List<MatchCandidate> matches, List<PreviewValue> values) {}

    public record PreviewConflict(int rowNo, String name, String partner, String period,
                                  BigDecimal existingValue, BigDecimal newValue) {}

    private int totalRows;
    private List<PreviewRow> rows;
    private List<PreviewConflict> conflicts;

    public ImportPreviewResponse() {}

    public ImportPreviewResponse(int totalRows, List<PreviewRow> rows, List<PreviewConflict> conflicts) {
        this.totalRows = totalRows;
        this.rows = rows;
        this.conflicts = conflicts;
    }

    public int getTotalRows() { return totalRows; }
    public void setTotalRows(int totalRows) { this.totalRows = totalRows; }
    public List<PreviewRow> getRows() { return rows; }
    public void setRows(List<PreviewRow> rows) { this.rows = rows; }
    public List<PreviewConflict> getConflicts() { return conflicts; }
    public void setConflicts(List<PreviewConflict> conflicts) { this.conflicts = conflicts; }
}
