package com.tallybook.ledger.service;

import com.tallybook.ledger.config.ImportSettings;
import com.tallybook.ledger.dto.ImportErrorDTO;
import com.tallybook.ledger.dto.ImportTaskStatusDTO;
import com.tallybook.ledger.dto.ImportTaskSummaryDTO;
import com.tallybook.ledger.model.ImportError;
import com.tallybook.ledger.model.ImportTask;
import com.tallybook.ledger.repository.ImportErrorRepository;
import com.tallybook.ledger.repository.ImportTaskRepository;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

@Service
@Transactional(readOnly = true)
public class ImportTaskQueryService {

    private static final int MAX_PAGE_SIZE = 200;

    private final ImportTaskRepository taskRepository;
    private final ImportErrorRepository errorRepository;
    private final ImportSettings settings;

    public ImportTaskQueryService(ImportTaskRepository taskRepository, ImportErrorRepository errorRepository, ImportSettings settings) {
        this.taskRepository = taskRepository;
        this.errorRepository = errorRepository;
        this.settings = settings;
    }

    /** Task counters plus the first errors by row number; empty when the id is unknown. */
    public Optional<ImportTaskStatusDTO> getStatus(String taskId) {
        if (taskId == null || taskId.isBlank()) return Optional.empty();
        return taskRepository.findById(taskId).map(task -> {
            List<ImportError> errors = errorRepository.findByTaskIdOrderByRowNumberAsc(
                    taskId, PageRequest.of(0, Math.max(1, settings.getErrorPageSize())));
            ImportTaskStatusDTO dto = new ImportTaskStatusDTO();
            dto.setTaskId(task.getId());
            dto.setStatus(statusName(task));
            dto.setTotal(task.getTotal());
            dto.setSuccess(task.getSuccess());
            dto.setFailed(task.getFailed());
            dto.setSkipped(task.getSkipped());
            dto.setExcluded(task.getExcluded());
            dto.setErrorMessage(task.getErrorMessage());
            dto.setCreatedAt(task.getCreatedAt());
            dto.setUpdatedAt(task.getUpdatedAt());
            dto.setErrors(errors.stream()
                    .map(e -> new ImportErrorDTO(e.getRowNumber(), e.getRawRow(), e.getErrorMessage()))
                    .toList());
            return dto;
        });
    }

    public Page<ImportTaskSummaryDTO> listRecent(int page, int size) {
        int safeSize = Math.min(Math.max(1, size), MAX_PAGE_SIZE);
        return taskRepository.findAllByOrderByCreatedAtDesc(PageRequest.of(Math.max(0, page), safeSize))
                .map(t -> new ImportTaskSummaryDTO(t.getId(), statusName(t), t.getTotal(), t.getSuccess(), t.getFailed(),
                        t.getFilename(), t.getConflictMode() == null ? null : t.getConflictMode().wireValue(),
                        t.getCreatedAt(), t.getFinishedAt()));
    }

    private static String statusName(ImportTask task) {
        return task.getStatus() == null ? null : task.getStatus().name().toLowerCase(Locale.ROOT);
    }
}
