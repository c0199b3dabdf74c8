package com.tallybook.ledger.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class ImportTaskStatusDTO {
    private String taskId;
    private String status;
    private Integer total;
    private Integer success;
    private Integer failed;
    private Integer skipped;
    private Integer excluded;
    private String errorMessage;
    private Instant createdAt;
    private Instant updatedAt;
    private List<ImportErrorDTO> errors = new ArrayList<>();

    public ImportTaskStatusDTO() {}

    public String getTaskId() { return taskId; }
    public void setTaskId(String taskId) { this.taskId = taskId; }
    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }
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
    public List<ImportErrorDTO> getErrors() { return errors; }
    public void setErrors(List<ImportErrorDTO> errors) { this.errors = errors; }
}
