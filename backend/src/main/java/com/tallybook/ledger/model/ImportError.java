package com.tallybook.ledger.model;

import jakarta.persistence.*;
import java.time.Instant;

@Entity
@Table(name = "import_errors", uniqueConstraints = {
        @UniqueConstraint(name = "uk_import_error_task_row", columnNames = {"task_id", "row_no"})
})
public class ImportError {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "task_id", length = 36, nullable = false)
    private String taskId;

    @Column(name = "row_no", nullable = false)
    private Integer rowNumber;

    @Lob
    @Column(name = "raw_row")
    private String rawRow;

    @Column(name = "error_message", length = 2000)
    private String errorMessage;

    @Column(name = "created_at")
    private Instant createdAt;

    public ImportError() {}

    public ImportError(String taskId, Integer rowNumber, String rawRow, String errorMessage) {
        this.taskId = taskId;
        this.rowNumber = rowNumber;
        this.rawRow = rawRow;
        this.errorMessage = errorMessage;
        this.createdAt = Instant.now();
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public String getTaskId() { return taskId; }
    public void setTaskId(String taskId) { this.taskId = taskId; }
    public Integer getRowNumber() { return rowNumber; }
    public void setRowNumber(Integer rowNumber) { this.rowNumber = rowNumber; }
    public String getRawRow() { return rawRow; }
    public void setRawRow(String rawRow) { this.rawRow = rawRow; }
    public String getErrorMessage() { return errorMessage; }
    public void setErrorMessage(String errorMessage) { this.errorMessage = errorMessage; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
