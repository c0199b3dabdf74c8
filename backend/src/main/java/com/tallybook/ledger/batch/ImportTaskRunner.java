package com.tallybook.ledger.batch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tallybook.ledger.config.ImportSettings;
import com.tallybook.ledger.model.ImportError;
import com.tallybook.ledger.model.ImportTask;
import com.tallybook.ledger.model.ImportTaskStatus;
import com.tallybook.ledger.repository.ImportErrorRepository;
import com.tallybook.ledger.repository.ImportTaskRepository;
import com.tallybook.ledger.source.TabularData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs import tasks on the shared worker pool.
 *
 * <p>A task moves PENDING → PROCESSING → COMPLETED, or PROCESSING → FAILED when
 * something outside a single row breaks (unreadable file, store unavailable).
 * Rows are visited in order on one worker thread; a failing row is recorded as an
 * {@link ImportError} and the loop moves on. Counters and buffered errors are
 * written every {@code checkpoint-interval} rows and after the last row.
 * Rows already committed stay committed when a task fails.
 */
@Component
public class ImportTaskRunner {
    private static final Logger log = LoggerFactory.getLogger(ImportTaskRunner.class);

    private static final int MAX_MESSAGE_LENGTH = 2000;

    private final ImportTaskRepository taskRepository;
    private final ImportErrorRepository errorRepository;
    private final Executor executor;
    private final ObjectMapper objectMapper;
    private final ImportSettings settings;

    public ImportTaskRunner(ImportTaskRepository taskRepository,
                            ImportErrorRepository errorRepository,
                            @Qualifier("importTaskExecutor") Executor importTaskExecutor,
                            ObjectMapper objectMapper,
                            ImportSettings settings) {
        this.taskRepository = taskRepository;
        this.errorRepository = errorRepository;
        this.executor = importTaskExecutor;
        this.objectMapper = objectMapper;
        this.settings = settings;
    }

    /** Persists the task in PENDING state so it can be polled before a worker picks it up. */
    public ImportTask createPending(ImportTask task) {
        Instant now = Instant.now();
        if (task.getId() == null) task.setId(UUID.randomUUID().toString());
        task.setStatus(ImportTaskStatus.PENDING);
        task.setTotal(0);
        task.setSuccess(0);
        task.setFailed(0);
        task.setSkipped(0);
        task.setExcluded(0);
        task.setCreatedAt(now);
        task.setUpdatedAt(now);
        return taskRepository.save(task);
    }

    /**
     * Queues the task on the worker pool.
     *
     * @throws RejectedExecutionException when the pool no longer accepts work; the task is marked FAILED first
     */
    public void submit(String taskId, RowSource source, RowProcessor processor) {
        log.info("[ImportTask][Queued] taskId={}", taskId);
        try {
            executor.execute(() -> run(taskId, source, processor));
        } catch (RejectedExecutionException e) {
            log.error("[ImportTask][Rejected] taskId={} error={}", taskId, e.getMessage());
            markFailed(taskId, e, new Progress(), new ArrayList<>());
            throw e;
        }
    }

    void run(String taskId, RowSource source, RowProcessor processor) {
        Progress progress = new Progress();
        List<ImportError> pendingErrors = new ArrayList<>();
        long t0 = System.currentTimeMillis();
        try {
            ImportTask task = taskRepository.findById(taskId)
                    .orElseThrow(() -> new IllegalStateException("Import task not found: " + taskId));
            if (task.getStatus() != null && task.getStatus().isFinished()) {
                log.warn("[ImportTask][Ignored] taskId={} already {}", taskId, task.getStatus());
                return;
            }
            task.setStatus(ImportTaskStatus.PROCESSING);
            task.setStartedAt(Instant.now());
            task.setUpdatedAt(Instant.now());
            task = taskRepository.save(task);

            TabularData data = source.load();
            int total = data.rowCount();
            task.setTotal(total);
            task = taskRepository.save(task);
            log.info("[ImportTask][Start] taskId={} total={} thread={}", taskId, total, Thread.currentThread().getName());

            int interval = settings.getCheckpointInterval();
            for (int i = 0; i < total; i++) {
                int rowNo = i + 1;
                Map<String, String> row = data.rows().get(i);
                RowOutcome outcome;
                try {
                    outcome = processor.process(rowNo, row);
                } catch (Exception rowEx) {
                    log.warn("[ImportTask][RowFailed] taskId={} rowNo={} error={}", taskId, rowNo, rowEx.toString());
                    outcome = RowOutcome.error(messageOf(rowEx));
                }
                progress.add(outcome);
                if (outcome.isError()) {
                    pendingErrors.add(new ImportError(taskId, rowNo, toJson(row), truncate(outcome.reason())));
                }
                if (rowNo % interval == 0 || rowNo == total) {
                    task = checkpoint(task, progress, pendingErrors);
                    log.debug("[ImportTask][Checkpoint] taskId={} row={}/{} success={} failed={}",
                            taskId, rowNo, total, progress.success, progress.failed);
                }
            }

            progress.applyTo(task);
            task.setStatus(ImportTaskStatus.COMPLETED);
            task.setFinishedAt(Instant.now());
            task.setUpdatedAt(Instant.now());
            taskRepository.save(task);
            log.info("[ImportTask][Done] taskId={} total={} success={} failed={} skipped={} excluded={} durationMs={}",
                    taskId, total, progress.success, progress.failed, progress.skipped, progress.excluded,
                    System.currentTimeMillis() - t0);
        } catch (Exception e) {
            log.error("[ImportTask][Failed] taskId={} error={}", taskId, e.getMessage(), e);
            markFailed(taskId, e, progress, pendingErrors);
        }
    }

    private ImportTask checkpoint(ImportTask task, Progress progress, List<ImportError> pendingErrors) {
        if (!pendingErrors.isEmpty()) {
            errorRepository.saveAll(pendingErrors);
            pendingErrors.clear();
        }
        progress.applyTo(task);
        task.setUpdatedAt(Instant.now());
        return taskRepository.save(task);
    }

    private void markFailed(String taskId, Exception cause, Progress progress, List<ImportError> pendingErrors) {
        try {
            if (!pendingErrors.isEmpty()) {
                errorRepository.saveAll(pendingErrors);
                pendingErrors.clear();
            }
            taskRepository.findById(taskId).ifPresent(task -> {
                progress.applyTo(task);
                task.setStatus(ImportTaskStatus.FAILED);
                task.setErrorMessage(truncate(messageOf(cause)));
                task.setFinishedAt(Instant.now());
                task.setUpdatedAt(Instant.now());
                taskRepository.save(task);
            });
        } catch (Exception saveEx) {
            log.error("[ImportTask][Failed] taskId={} could not record failure: {}", taskId, saveEx.getMessage(), saveEx);
        }
    }

    private String toJson(Map<String, String> row) {
        try {
            return objectMapper.writeValueAsString(row);
        } catch (JsonProcessingException e) {
            return String.valueOf(row);
        }
    }

    private static String messageOf(Exception e) {
        String msg = e.getMessage();
        return (msg == null || msg.isBlank()) ? e.getClass().getSimpleName() : msg;
    }

    private static String truncate(String s) {
        if (s == null || s.length() <= MAX_MESSAGE_LENGTH) return s;
        return s.substring(0, MAX_MESSAGE_LENGTH);
    }

    private static final class Progress {
        int success;
        int failed;
        int skipped;
        int excluded;

        void add(RowOutcome outcome) {
            switch (outcome.kind()) {
                case SUCCESS -> success++;
                case EXCLUDED -> excluded++;
                case ERROR -> failed++;
            }
            skipped += outcome.skipped();
        }

        void applyTo(ImportTask task) {
            task.setSuccess(success);
            task.setFailed(failed);
            task.setSkipped(skipped);
            task.setExcluded(excluded);
        }
    }
}
