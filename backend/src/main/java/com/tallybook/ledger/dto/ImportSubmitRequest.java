package com.tallybook.ledger.dto;

import com.fasterxml.jackson.annotation.JsonAlias;

public class ImportSubmitRequest {
    @JsonAlias({"data_ref", "temp_id"})
    private String dataRef;

    @JsonAlias({"column_mapping"})
    private ColumnMapping mapping;

    @JsonAlias({"conflict_mode"})
    private String conflictMode = "skip";

    @JsonAlias({"fallback_period", "global_month"})
    private String fallbackPeriod;

    public ImportSubmitRequest() {}

    public ImportSubmitRequest(String dataRef, ColumnMapping mapping, String conflictMode, String fallbackPeriod) {
        this.dataRef = dataRef;
        this.mapping = mapping;
        this.conflictMode = conflictMode;
        this.fallbackPeriod = fallbackPeriod;
    }

    public String getDataRef() { return dataRef; }
    public void setDataRef(String dataRef) { this.dataRef = dataRef; }
    public ColumnMapping getMapping() { return mapping; }
    public void setMapping(ColumnMapping mapping) { this.mapping = mapping; }
    public String getConflictMode() { return conflictMode; }
    public void setConflictMode(String conflictMode) { this.conflictMode = conflictMode; }
    public String getFallbackPeriod() { return fallbackPeriod; }
    public void setFallbackPeriod(String fallbackPeriod) { this.fallbackPeriod = fallbackPeriod; }
}
