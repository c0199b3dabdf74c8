package com.tallybook.ledger.repository;

import com.tallybook.ledger.batch.ImportTaskRunner;
import com.tallybook.ledger.model.ConflictMode;
import com.tallybook.ledger.model.ImportError;
import com.tallybook.ledger.model.ImportTask;
import com.tallybook.ledger.model.ImportTaskStatus;
import com.tallybook.ledger.model.PriceRecord;
import com.tallybook.ledger.model.Product;
import com.tallybook.ledger.service.ProductCatalogService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.domain.PageRequest;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs against the Flyway migration instead of the Hibernate-generated schema,
 * so a column the entities map but the migration lacks fails here.
 */
@SpringBootTest(properties = {
        "spring.datasource.url=jdbc:h2:mem:tallybook_migrated;MODE=MySQL;DB_CLOSE_DELAY=-1",
        "spring.flyway.enabled=true",
        "spring.jpa.hibernate.ddl-auto=none"
})
@ActiveProfiles("test")
class MigratedSchemaRepositoryTest {

    @Autowired private ProductCatalogService catalogService;
    @Autowired private ProductRepository productRepository;
    @Autowired private PriceRecordRepository priceRecordRepository;
    @Autowired private ImportTaskRunner taskRunner;
    @Autowired private ImportTaskRepository taskRepository;
    @Autowired private ImportErrorRepository errorRepository;

    @Test
    void entitiesRoundTripThroughMigratedTables() {
        Product bolt = catalogService.findOrCreate("Hex Bolt M8", "hex bolt m8");
        PriceRecord record = new PriceRecord(bolt, "Acme", "2024-06", new BigDecimal("0.3500"));
        record.setPriceType("bid");
        record.setQuantity(100);
        record.setNote("Imported on 2024-06-03");
        priceRecordRepository.saveAndFlush(record);

        ImportTask task = new ImportTask();
        task.setDataRef("ref-migrated");
        task.setFilename("quotes.csv");
        task.setMapping("{\"nameColumn\":\"Product\"}");
        task.setConflictMode(ConflictMode.OVERWRITE);
        String taskId = taskRunner.createPending(task).getId();
        errorRepository.saveAndFlush(new ImportError(taskId, 3, "{\"Product\":\"x\"}", "price must be greater than 0"));

        PriceRecord stored = priceRecordRepository.findByProductIdAndCompanyAndPeriod(bolt.getId(), "Acme", "2024-06").orElseThrow();
        assertThat(stored.getPrice()).isEqualByComparingTo("0.35");
        assertThat(stored.getCreatedAt()).isNotNull();
        assertThat(productRepository.findAllKeys())
                .extracting(ProductRepository.ProductKeyProjection::getNormalizedName)
                .contains("hex bolt m8");
        ImportTask storedTask = taskRepository.findById(taskId).orElseThrow();
        assertThat(storedTask.getStatus()).isEqualTo(ImportTaskStatus.PENDING);
        assertThat(storedTask.getConflictMode()).isEqualTo(ConflictMode.OVERWRITE);
        assertThat(errorRepository.findByTaskIdOrderByRowNumberAsc(taskId, PageRequest.of(0, 100)))
                .extracting(ImportError::getRowNumber).containsExactly(3);
    }

    @Test
    void caseAndAccentVariantsStayDistinct() {
        Product accented = catalogService.findOrCreate("Café Filter", "café filter");
        Product plain = catalogService.findOrCreate("Cafe Filter", "cafe filter");
        assertThat(accented.getId()).isNotEqualTo(plain.getId());

        priceRecordRepository.saveAndFlush(new PriceRecord(plain, "ACME", "2024-07", new BigDecimal("5")));
        priceRecordRepository.saveAndFlush(new PriceRecord(plain, "Acme", "2024-07", new BigDecimal("6")));

        assertThat(priceRecordRepository.findByProductIdAndCompanyAndPeriod(plain.getId(), "Acme", "2024-07")
                .orElseThrow().getPrice()).isEqualByComparingTo("6");
    }

    @Test
    void keyColumnsUseBinaryCollation() throws Exception {
        String ddl = new ClassPathResource("db/migration/V1__import_schema.sql")
                .getContentAsString(StandardCharsets.UTF_8);

        for (String column : List.of("normalized_name VARCHAR(255)", "company VARCHAR(128)", "period VARCHAR(7)")) {
            assertThat(ddl).as(column).contains(column + " COLLATE utf8mb4_bin");
        }
    }
}
