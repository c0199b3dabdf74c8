package com.tallybook.ledger.dto;

import java.time.Instant;

public class ImportTaskSummaryDTO {
    private String id;
    private String status;
    private Integer total;
    private Integer success;
    private Integer failed;
    private String filename;
    private String conflictMode;
    private Instant createdAt;
    private Instant finishedAt;

    public ImportTaskSummaryDTO() {}

    public ImportTaskSummaryDTO(String id, String status, Integer total, Integer success, Integer failed, String filename, String conflictMode, Instant createdAt, Instant finishedAt) {
        this.id = id;
        this.status = status;
        this.total = total;
        this.success = success;
        this.failed = failed;
        this.filename = filename;
        this.conflictMode = conflictMode;
        this.createdAt = createdAt;
        this.finishedAt = finishedAt;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }
    public Integer getTotal() { return total; }
    public void setTotal(Integer total) { this.total = total; }
    public Integer getSuccess() { return success; }
    public void setSuccess(Integer success) { this.success = success; }
    public Integer getFailed() { return failed; }
    public void setFailed(Integer failed) { this.failed = failed; }
    public String getFilename() { return filename; }
    public void setFilename(String filename) { this.filename = filename; }
    public String getConflictMode() { return conflictMode; }
    public void setConflictMode(String conflictMode) { this.conflictMode = conflictMode; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
    public Instant getFinishedAt() { return finishedAt; }
    public void setFinishedAt(Instant finishedAt) { this.finishedAt = finishedAt; }
}
