package com.tallybook.ledger.controller;

import com.tallybook.ledger.dto.ImportPreviewResponse;
import com.tallybook.ledger.dto.ImportSubmitRequest;
import com.tallybook.ledger.dto.ImportTaskStatusDTO;
import com.tallybook.ledger.dto.ImportTaskSummaryDTO;
import com.tallybook.ledger.model.ImportTask;
import com.tallybook.ledger.service.ImportOrchestrator;
import com.tallybook.ledger.service.ImportPreviewService;
import com.tallybook.ledger.service.ImportTaskQueryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.Map;

@RestController
@RequestMapping("/api/import")
@CrossOrigin(origins = "*")
public class ImportController {
    private static final Logger log = LoggerFactory.getLogger(ImportController.class);

    private final ImportOrchestrator orchestrator;
    private final ImportTaskQueryService queryService;
    private final ImportPreviewService previewService;

    public ImportController(ImportOrchestrator orchestrator, ImportTaskQueryService queryService, ImportPreviewService previewService) {
        this.orchestrator = orchestrator;
        this.queryService = queryService;
        this.previewService = previewService;
    }

    @PostMapping("/tasks")
    public ResponseEntity<?> submit(@RequestBody ImportSubmitRequest request) {
        try {
            ImportTask task = orchestrator.submit(request);
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("taskId", task.getId()));
        } catch (IllegalArgumentException ex) {
            log.info("[Import][Rejected] dataRef={} reason={}", request != null ? request.getDataRef() : null, ex.getMessage());
            return ResponseEntity.badRequest().body(Map.of(
                    "success", false,
                    "message", ex.getMessage()
            ));
        }
    }

    @GetMapping("/tasks/{taskId}")
    public ImportTaskStatusDTO status(@PathVariable String taskId) {
        return queryService.getStatus(taskId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Import task not found"));
    }

    @GetMapping("/tasks")
    public Page<ImportTaskSummaryDTO> list(@RequestParam(defaultValue = "0") int page,
                                           @RequestParam(defaultValue = "20") int size) {
        return queryService.listRecent(page, size);
    }

    @PostMapping("/preview")
    public ResponseEntity<?> preview(@RequestBody ImportSubmitRequest request) {
        try {
            ImportPreviewResponse response = previewService.preview(request);
            return ResponseEntity.ok(response);
        } catch (IllegalArgumentException ex) {
            return ResponseEntity.badRequest().body(Map.of(
                    "success", false,
                    "message", ex.getMessage()
            ));
        }
    }
}
