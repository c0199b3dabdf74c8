package com.tallybook.ledger.service;

import com.tallybook.ledger.dto.ColumnMapping;
import com.tallybook.ledger.dto.ImportErrorDTO;
import com.tallybook.ledger.dto.ImportPreviewResponse;
import com.tallybook.ledger.dto.ImportSubmitRequest;
import com.tallybook.ledger.dto.ImportTaskStatusDTO;
import com.tallybook.ledger.dto.ValueColumnGroup;
import com.tallybook.ledger.model.PriceRecord;
import com.tallybook.ledger.model.Product;
import com.tallybook.ledger.repository.ImportErrorRepository;
import com.tallybook.ledger.repository.ImportTaskRepository;
import com.tallybook.ledger.repository.PriceRecordRepository;
import com.tallybook.ledger.repository.ProductRepository;
import com.tallybook.ledger.source.StagedFileLocator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

@SpringBootTest
@ActiveProfiles("test")
class ImportOrchestratorIntegrationTest {

    @Autowired private ImportOrchestrator orchestrator;
    @Autowired private ImportTaskQueryService queryService;
    @Autowired private ImportPreviewService previewService;
    @Autowired private StagedFileLocator fileLocator;
    @Autowired private ProductRepository productRepository;
    @Autowired private PriceRecordRepository priceRecordRepository;
    @Autowired private ImportTaskRepository taskRepository;
    @Autowired private ImportErrorRepository errorRepository;

    @BeforeEach
    void cleanStore() {
        priceRecordRepository.deleteAll();
        productRepository.deleteAll();
        errorRepository.deleteAll();
        taskRepository.deleteAll();
    }

    private String stage(String csv) throws Exception {
        String ref = UUID.randomUUID().toString().replace("-", "");
        Path dir = fileLocator.stagingDir();
        Files.createDirectories(dir);
        Files.writeString(dir.resolve(ref + "_quotes.csv"), csv, StandardCharsets.UTF_8);
        return ref;
    }

    private List<PriceRecord> recordsFor(Long productId) {
        return priceRecordRepository.findAll().stream()
                .filter(r -> productId.equals(r.getProduct().getId()))
                .sorted(Comparator.comparing(PriceRecord::getPeriod))
                .toList();
    }

    private static ColumnMapping mapping() {
        return new ColumnMapping("Product", "Date", List.of(new ValueColumnGroup("Price", "Acme", "bid")), null);
    }

    private ImportTaskStatusDTO runToEnd(String ref, String mode) throws InterruptedException {
        String taskId = orchestrator.submit(new ImportSubmitRequest(ref, mapping(), mode, null)).getId();
        long deadline = System.currentTimeMillis() + 15_000;
        while (System.currentTimeMillis() < deadline) {
            ImportTaskStatusDTO status = queryService.getStatus(taskId).orElseThrow();
            if ("completed".equals(status.getStatus()) || "failed".equals(status.getStatus())) {
                return status;
            }
            Thread.sleep(50);
        }
        throw new AssertionError("Task did not finish: " + taskId);
    }

    @Test
    void threeRowScenarioCreatesOneProductAndTwoRecords() throws Exception {
        String ref = stage("Product,Price,Date\n"
                + "Widget A,10,2024-03-15\n"
                + "widget a (export),12,2024-04-02\n"
                + ",9,2024-03-15\n");

        ImportTaskStatusDTO status = runToEnd(ref, "skip");

        assertThat(status.getStatus()).isEqualTo("completed");
        assertThat(status.getTotal()).isEqualTo(3);
        assertThat(status.getSuccess()).isEqualTo(2);
        assertThat(status.getFailed()).isZero();
        assertThat(status.getExcluded()).isEqualTo(1);
        assertThat(productRepository.count()).isEqualTo(1);
        Product widget = productRepository.findByNormalizedName("widget a").orElseThrow();
        assertThat(widget.getName()).isEqualTo("Widget A");
        List<PriceRecord> records = recordsFor(widget.getId());
        assertThat(records).extracting(PriceRecord::getPeriod).containsExactly("2024-03", "2024-04");
        assertThat(records.get(0).getPriceType()).isEqualTo("bid");
        assertThat(records.get(0).getQuantity()).isEqualTo(1);
    }

    @Test
    void skipReimportKeepsValueAndCountsOneSkip() throws Exception {
        runToEnd(stage("Product,Price,Date\nGadget,20,2024-05-01\n"), "skip");

        ImportTaskStatusDTO second = runToEnd(stage("Product,Price,Date\nGadget,25,2024-05-20\n"), "skip");

        assertThat(second.getSkipped()).isEqualTo(1);
        assertThat(second.getSuccess()).isZero();
        Product gadget = productRepository.findByNormalizedName("gadget").orElseThrow();
        List<PriceRecord> records = recordsFor(gadget.getId());
        assertThat(records).hasSize(1);
        assertThat(records.get(0).getPrice()).isEqualByComparingTo("20");
    }

    @Test
    void overwriteReimportReplacesValueInPlace() throws Exception {
        runToEnd(stage("Product,Price,Date\nGadget,20,2024-05-01\n"), "skip");

        ImportTaskStatusDTO second = runToEnd(stage("Product,Price,Date\nGadget,25,2024-05-20\n"), "overwrite");

        assertThat(second.getSuccess()).isEqualTo(1);
        Product gadget = productRepository.findByNormalizedName("gadget").orElseThrow();
        List<PriceRecord> records = recordsFor(gadget.getId());
        assertThat(records).hasSize(1);
        assertThat(records).extracting(PriceRecord::getCompany, PriceRecord::getPeriod).containsExactly(tuple("Acme", "2024-05"));
        assertThat(records.get(0).getPrice()).isEqualByComparingTo("25");
        assertThat(records.get(0).getNote()).startsWith("Updated on ");
    }

    @Test
    void errorListIsCappedAndOrderedByRow() throws Exception {
        StringBuilder csv = new StringBuilder("Product,Price,Date\n");
        for (int i = 1; i <= 150; i++) {
            csv.append("Item ").append(i).append(",-1,2024-01-01\n");
        }

        ImportTaskStatusDTO status = runToEnd(stage(csv.toString()), "skip");

        assertThat(status.getStatus()).isEqualTo("completed");
        assertThat(status.getFailed()).isEqualTo(150);
        assertThat(status.getErrors()).hasSize(100);
        assertThat(status.getErrors()).extracting(ImportErrorDTO::getRowNo).isSorted();
        assertThat(status.getErrors().get(0).getRowNo()).isEqualTo(1);
        assertThat(status.getErrors().get(0).getErrorMessage()).isEqualTo("price must be greater than 0");
        assertThat(productRepository.count()).isZero();
    }

    @Test
    void missingMappedColumnFailsTheTask() throws Exception {
        ImportTaskStatusDTO status = runToEnd(stage("Name,Cost\nGadget,20\n"), "skip");

        assertThat(status.getStatus()).isEqualTo("failed");
        assertThat(status.getErrorMessage()).contains("Product");
    }

    @Test
    void previewReportsMatchesAndSkippedConflictsWithoutWriting() throws Exception {
        runToEnd(stage("Product,Price,Date\nGadget,20,2024-05-01\n"), "skip");
        String ref = stage("Product,Price,Date\ngadget (boxed),25,2024-05-20\nNew Thing,5,2024-05-20\n");

        ImportPreviewResponse preview = previewService.preview(new ImportSubmitRequest(ref, mapping(), "skip", null));

        assertThat(preview.getTotalRows()).isEqualTo(2);
        assertThat(preview.getRows().get(0).normalizedName()).isEqualTo("gadget");
        assertThat(preview.getRows().get(0).matches()).hasSize(1);
        assertThat(preview.getRows().get(1).matches()).isEmpty();
        assertThat(preview.getConflicts()).hasSize(1);
        assertThat(preview.getConflicts().get(0).existingValue()).isEqualByComparingTo("20");
        assertThat(productRepository.count()).isEqualTo(1);
    }
}
