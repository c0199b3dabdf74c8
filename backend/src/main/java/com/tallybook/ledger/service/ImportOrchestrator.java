package com.tallybook.ledger.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tallybook.ledger.batch.ImportTaskRunner;
import com.tallybook.ledger.batch.RowOutcome;
import com.tallybook.ledger.batch.RowProcessor;
import com.tallybook.ledger.batch.RowSource;
import com.tallybook.ledger.config.ImportSettings;
import com.tallybook.ledger.dto.ColumnMapping;
import com.tallybook.ledger.dto.ImportSubmitRequest;
import com.tallybook.ledger.dto.ValueColumnGroup;
import com.tallybook.ledger.matching.MatchCandidate;
import com.tallybook.ledger.matching.ProductMatcher;
import com.tallybook.ledger.model.ConflictMode;
import com.tallybook.ledger.model.ImportTask;
import com.tallybook.ledger.model.PriceRecord;
import com.tallybook.ledger.model.Product;
import com.tallybook.ledger.repository.PriceRecordRepository;
import com.tallybook.ledger.repository.ProductRepository;
import com.tallybook.ledger.source.StagedFileLocator;
import com.tallybook.ledger.source.TabularData;
import com.tallybook.ledger.source.TabularSources;
import com.tallybook.ledger.util.LenientNumberParser;
import com.tallybook.ledger.util.PeriodResolver;
import com.tallybook.ledger.util.ProductNameNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Validates import submissions and turns each sheet row into catalog products and price records.
 * The row loop itself belongs to {@link ImportTaskRunner}; this class supplies the per-row work.
 */
@Service
public class ImportOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(ImportOrchestrator.class);

    static final String NON_POSITIVE_PRICE = "price must be greater than 0";

    /** Everything the row function needs, fixed at submission time. */
    public record ImportPlan(String taskId, ColumnMapping mapping, ConflictMode conflictMode, String fallbackPeriod) {}

    private record ParsedValue(ValueColumnGroup group, BigDecimal value) {}

    private final ImportTaskRunner taskRunner;
    private final StagedFileLocator fileLocator;
    private final TabularSources tabularSources;
    private final ProductMatcher productMatcher;
    private final ProductCatalogService catalogService;
    private final ConflictResolver conflictResolver;
    private final ProductRepository productRepository;
    private final PriceRecordRepository priceRecordRepository;
    private final ImportSettings settings;
    private final ObjectMapper objectMapper;
    private final TransactionTemplate rowTransaction;

    public ImportOrchestrator(ImportTaskRunner taskRunner,
                              StagedFileLocator fileLocator,
                              TabularSources tabularSources,
                              ProductMatcher productMatcher,
                              ProductCatalogService catalogService,
                              ConflictResolver conflictResolver,
                              ProductRepository productRepository,
                              PriceRecordRepository priceRecordRepository,
                              ImportSettings settings,
                              ObjectMapper objectMapper,
                              PlatformTransactionManager transactionManager) {
        this.taskRunner = taskRunner;
        this.fileLocator = fileLocator;
        this.tabularSources = tabularSources;
        this.productMatcher = productMatcher;
        this.catalogService = catalogService;
        this.conflictResolver = conflictResolver;
        this.productRepository = productRepository;
        this.priceRecordRepository = priceRecordRepository;
        this.settings = settings;
        this.objectMapper = objectMapper;
        this.rowTransaction = new TransactionTemplate(transactionManager);
    }

    /**
     * Validates the request, persists a pending task and queues it.
     *
     * @return the pending task
     * @throws ImportSubmissionException when the mapping is incomplete or the data reference is unusable
     */
    public ImportTask submit(ImportSubmitRequest request) {
        if (request == null) throw new ImportSubmissionException("Request body is required");
        ColumnMapping mapping = request.getMapping();
        validateMapping(mapping);
        Path staged = locateStagedFile(request.getDataRef());

        ConflictMode mode = ConflictMode.from(request.getConflictMode());
        ImportTask task = new ImportTask();
        task.setDataRef(request.getDataRef());
        task.setFilename(fileLocator.originalFilename(staged, request.getDataRef()));
        task.setMapping(toJson(mapping));
        task.setConflictMode(mode);
        task.setFallbackPeriod(blankToNull(request.getFallbackPeriod()));
        task = taskRunner.createPending(task);

        ImportPlan plan = new ImportPlan(task.getId(), mapping, mode, task.getFallbackPeriod());
        log.info("[Import][Submit] taskId={} dataRef={} file={} mode={} groups={}",
                task.getId(), task.getDataRef(), task.getFilename(), mode.wireValue(), mapping.getValueGroups().size());
        taskRunner.submit(task.getId(), rowSource(staged, mapping), rowProcessor(plan));
        return task;
    }

    void validateMapping(ColumnMapping mapping) {
        if (mapping == null) {
            throw new ImportSubmissionException("Column mapping is required");
        }
        if (isBlank(mapping.getNameColumn())) {
            throw new ImportSubmissionException("Product name column is required");
        }
        List<ValueColumnGroup> groups = mapping.getValueGroups();
        if (groups == null || groups.isEmpty()) {
            throw new ImportSubmissionException("At least one price column is required");
        }
        for (int i = 0; i < groups.size(); i++) {
            ValueColumnGroup g = groups.get(i);
            if (g == null || isBlank(g.getColumn()) || isBlank(g.getPartner())) {
                throw new ImportSubmissionException("Price column #" + (i + 1) + " needs both a column and a company");
            }
        }
    }

    Path locateStagedFile(String dataRef) {
        if (isBlank(dataRef)) {
            throw new ImportSubmissionException("dataRef is required");
        }
        Path staged;
        try {
            staged = fileLocator.locate(dataRef.trim())
                    .orElseThrow(() -> new ImportSubmissionException("No staged file found for dataRef: " + dataRef));
        } catch (IOException e) {
            throw new UncheckedIOException("Staging directory is not readable", e);
        }
        if (!tabularSources.supports(staged)) {
            throw new ImportSubmissionException("Unsupported file type: " + staged.getFileName());
        }
        return staged;
    }

    RowSource rowSource(Path staged, ColumnMapping mapping) {
        return () -> {
            TabularData data = tabularSources.read(staged);
            requireColumn(data, mapping.getNameColumn());
            for (ValueColumnGroup g : mapping.getValueGroups()) {
                requireColumn(data, g.getColumn());
            }
            return data;
        };
    }

    RowProcessor rowProcessor(ImportPlan plan) {
        return (rowNo, row) -> rowTransaction.execute(status -> processRow(plan, row));
    }

    /**
     * Applies one row. Runs inside the caller's transaction; a returned error writes nothing.
     */
    public RowOutcome processRow(ImportPlan plan, Map<String, String> row) {
        ColumnMapping mapping = plan.mapping();
        String rawName = cell(row, mapping.getNameColumn());
        String key = ProductNameNormalizer.normalize(rawName);
        if (key.isEmpty()) {
            return switch (settings.getBlankNamePolicy()) {
                case EXCLUDE -> RowOutcome.excluded(0);
                case ERROR -> RowOutcome.error("product name is empty");
            };
        }

        List<ParsedValue> values = new ArrayList<>();
        for (ValueColumnGroup group : mapping.getValueGroups()) {
            BigDecimal value = LenientNumberParser.parse(cell(row, group.getColumn()));
            if (value == null) continue;
            if (value.signum() <= 0) {
                return RowOutcome.error(NON_POSITIVE_PRICE);
            }
            values.add(new ParsedValue(group, value));
        }
        if (values.isEmpty()) {
            return RowOutcome.excluded(0);
        }

        Product product = resolveProduct(rawName, key);
        String period = PeriodResolver.resolvePeriod(
                mapping.getDateColumn() == null ? null : cell(row, mapping.getDateColumn()),
                plan.fallbackPeriod());
        if (period.isEmpty()) {
            period = YearMonth.now().toString();
        }
        Integer quantity = isBlank(mapping.getQuantityColumn())
                ? 1
                : LenientNumberParser.parseInteger(cell(row, mapping.getQuantityColumn()), 1);

        int written = 0;
        int skipped = 0;
        for (ParsedValue pv : values) {
            String company = pv.group().getPartner().trim();
            PriceRecord existing = priceRecordRepository
                    .findByProductIdAndCompanyAndPeriod(product.getId(), company, period)
                    .orElse(null);
            switch (conflictResolver.resolve(existing, plan.conflictMode())) {
                case INSERT -> {
                    PriceRecord record = new PriceRecord(product, company, period, pv.value());
                    record.setPriceType(valueType(pv.group()));
                    record.setQuantity(quantity);
                    record.setNote(conflictResolver.importNote());
                    record.setSourceTaskId(plan.taskId());
                    priceRecordRepository.save(record);
                    written++;
                }
                case UPDATE -> {
                    existing.setPrice(pv.value());
                    existing.setPriceType(valueType(pv.group()));
                    existing.setQuantity(quantity);
                    existing.setNote(conflictResolver.updateNote());
                    existing.setSourceTaskId(plan.taskId());
                    priceRecordRepository.save(existing);
                    written++;
                }
                case SKIP -> skipped++;
            }
        }
        return written > 0 ? RowOutcome.success(skipped) : RowOutcome.excluded(skipped);
    }

    private Product resolveProduct(String rawName, String key) {
        List<MatchCandidate> candidates = productMatcher.match(key, settings.getMatchThreshold(), settings.getMatchLimit());
        Long productId;
        if (!candidates.isEmpty()) {
            MatchCandidate top = candidates.get(0);
            if (!top.isExact()) {
                log.debug("[Import][Match] raw='{}' key='{}' -> productId={} score={}", rawName, key, top.productId(), top.score());
            }
            productId = top.productId();
        } else {
            productId = catalogService.findOrCreate(rawName, key).getId();
        }
        return productRepository.getReferenceById(productId);
    }

    private String valueType(ValueColumnGroup group) {
        return isBlank(group.getValueType()) ? settings.getDefaultPriceType() : group.getValueType().trim();
    }

    private static void requireColumn(TabularData data, String column) throws IOException {
        if (!data.hasColumn(column)) {
            throw new IOException("Column not found in file: " + column);
        }
    }

    private String toJson(ColumnMapping mapping) {
        try {
            return objectMapper.writeValueAsString(mapping);
        } catch (JsonProcessingException e) {
            throw new ImportSubmissionException("Column mapping cannot be serialized: " + e.getOriginalMessage());
        }
    }

    static String cell(Map<String, String> row, String column) {
        if (column == null) return "";
        String v = row.get(column);
        return v == null ? "" : v.trim();
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private static String blankToNull(String s) {
        return isBlank(s) ? null : s.trim();
    }
}
