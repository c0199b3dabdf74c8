package com.tallybook.ledger.model;

import jakarta.persistence.*;
import java.time.Instant;

@Entity
@Table(name = "import_tasks", indexes = {
        @Index(name = "idx_import_task_created", columnList = "created_at")
})
public class ImportTask {
    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "data_ref", length = 128, nullable = false)
    private String dataRef;

    @Column(length = 255)
    private String filename;

    @Lob
    @Column(name = "mapping")
    private String mapping; // JSON of the submitted column mapping

    @Column(name = "conflict_mode", length = 16, nullable = false)
    @Enumerated(EnumType.STRING)
    private ConflictMode conflictMode = ConflictMode.SKIP;

    @Column(name = "fallback_period", length = 32)
    private String fallbackPeriod;

    @Column(length = 16, nullable = false)
    @Enumerated(EnumType.STRING)
    private ImportTaskStatus status = ImportTaskStatus.PENDING;

    @Column(name = "rows_total")
    private Integer total = 0;

    @Column(name = "rows_success")
    private Integer success = 0;

    @Column(name = "rows_failed")
    private Integer failed = 0;

    @Column(name = "values_skipped")
    private Integer skipped = 0;

    @Column(name = "rows_excluded")
    private Integer excluded = 0;

    @Column(name = "error_message", length = 2000)
    private String errorMessage;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public String getDataRef() { return dataRef; }
    public void setDataRef(String dataRef) { this.dataRef = dataRef; }
    public String getFilename() { return filename; }
    public void setFilename(String filename) { this.filename = filename; }
    public String getMapping() { return mapping; }
    public void setMapping(String mapping) { this.mapping = mapping; }
    public ConflictMode getConflictMode() { return conflictMode; }
    public void setConflictMode(ConflictMode conflictMode) { this.conflictMode = conflictMode; }
    public String getFallbackPeriod() { return fallbackPeriod; }
    public void setFallbackPeriod(String fallbackPeriod) { this.fallbackPeriod = fallbackPeriod; }
    public ImportTaskStatus getStatus() { return status; }
    public void setStatus(ImportTaskStatus status) { this.status = status; }
    public Integer getTotal() { return total; }
    public void setTotal(Integer total) { this.total = total; }
    public Integer getSuccess() { return success; }
    public void setSuccess(Integer success) { this.success = success; }
    public Integer getFailed() { return failed; }
    public void setFailed(Integer failed) { this.failed = failed; }
    public Integer getSkipped() { return skipped; }
    public void setSkipped(Integer skipped) { this.skipped = skipped; }
    public Integer getExcluded() { return excluded; }
    public void setExcluded(Integer excluded) { this.excluded = excluded; }
    public String getErrorMessage() { return errorMessage; }
    public void setErrorMessage(String errorMessage) { this.errorMessage = errorMessage; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
    public Instant getStartedAt() { return startedAt; }
    public void setStartedAt(Instant startedAt) { this.startedAt = startedAt; }
    public Instant getFinishedAt() { return finishedAt; }
    public void setFinishedAt(Instant finishedAt) { this.finishedAt = finishedAt; }
}
