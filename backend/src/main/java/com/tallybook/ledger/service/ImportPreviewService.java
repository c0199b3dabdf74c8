package com.tallybook.ledger.service;

import com.tallybook.ledger.config.ImportSettings;
import com.tallybook.ledger.dto.ColumnMapping;
import com.tallybook.ledger.dto.ImportPreviewResponse;
import com.tallybook.ledger.dto.ImportPreviewResponse.PreviewConflict;
import com.tallybook.ledger.dto.ImportPreviewResponse.PreviewRow;
import com.tallybook.ledger.dto.ImportPreviewResponse.PreviewValue;
import com.tallybook.ledger.dto.ImportSubmitRequest;
import com.tallybook.ledger.dto.ValueColumnGroup;
import com.tallybook.ledger.matching.MatchCandidate;
import com.tallybook.ledger.matching.ProductMatcher;
import com.tallybook.ledger.model.ConflictMode;
import com.tallybook.ledger.model.PriceRecord;
import com.tallybook.ledger.repository.PriceRecordRepository;
import com.tallybook.ledger.source.TabularData;
import com.tallybook.ledger.source.TabularSources;
import com.tallybook.ledger.util.LenientNumberParser;
import com.tallybook.ledger.util.PeriodResolver;
import com.tallybook.ledger.util.ProductNameNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Dry run of a mapping over the head of a staged file. Nothing is written.
 */
@Service
public class ImportPreviewService {
    private static final Logger log = LoggerFactory.getLogger(ImportPreviewService.class);

    private final ImportOrchestrator orchestrator;
    private final TabularSources tabularSources;
    private final ProductMatcher productMatcher;
    private final PriceRecordRepository priceRecordRepository;
    private final ConflictResolver conflictResolver;
    private final ImportSettings settings;

    public ImportPreviewService(ImportOrchestrator orchestrator,
                                TabularSources tabularSources,
                                ProductMatcher productMatcher,
                                PriceRecordRepository priceRecordRepository,
                                ConflictResolver conflictResolver,
                                ImportSettings settings) {
        this.orchestrator = orchestrator;
        this.tabularSources = tabularSources;
        this.productMatcher = productMatcher;
        this.priceRecordRepository = priceRecordRepository;
        this.conflictResolver = conflictResolver;
        this.settings = settings;
    }

    @Transactional(readOnly = true)
    public ImportPreviewResponse preview(ImportSubmitRequest request) {
        if (request == null) throw new ImportSubmissionException("Request body is required");
        ColumnMapping mapping = request.getMapping();
        orchestrator.validateMapping(mapping);
        Path staged = orchestrator.locateStagedFile(request.getDataRef());
        TabularData data;
        try {
            data = tabularSources.read(staged);
        } catch (IOException e) {
            log.warn("[Import][Preview] dataRef={} unreadable: {}", request.getDataRef(), e.getMessage());
            throw new ImportSubmissionException("Staged file cannot be read: " + e.getMessage());
        }
        ConflictMode mode = ConflictMode.from(request.getConflictMode());
        String fallback = request.getFallbackPeriod();
        String currentMonth = YearMonth.now().toString();

        int limit = Math.min(data.rowCount(), Math.max(0, settings.getPreviewRows()));
        List<PreviewRow> rows = new ArrayList<>(limit);
        List<PreviewConflict> conflicts = new ArrayList<>();
        for (int i = 0; i < limit; i++) {
            int rowNo = i + 1;
            Map<String, String> row = data.rows().get(i);
            String rawName = ImportOrchestrator.cell(row, mapping.getNameColumn());
            String key = ProductNameNormalizer.normalize(rawName);
            String period = PeriodResolver.resolvePeriod(
                    mapping.getDateColumn() == null ? null : ImportOrchestrator.cell(row, mapping.getDateColumn()), fallback);
            if (period.isEmpty()) period = currentMonth;
            List<MatchCandidate> matches = key.isEmpty()
                    ? List.of()
                    : productMatcher.match(key, settings.getMatchThreshold(), settings.getMatchLimit());

            List<PreviewValue> values = new ArrayList<>();
            for (ValueColumnGroup group : mapping.getValueGroups()) {
                BigDecimal value = LenientNumberParser.parse(ImportOrchestrator.cell(row, group.getColumn()));
                String company = group.getPartner().trim();
                values.add(new PreviewValue(company, value));
                if (value == null || matches.isEmpty()) continue;
                PriceRecord existing = priceRecordRepository
                        .findByProductIdAndCompanyAndPeriod(matches.get(0).productId(), company, period)
                        .orElse(null);
                if (existing != null && conflictResolver.resolve(existing, mode) == ConflictAction.SKIP) {
                    conflicts.add(new PreviewConflict(rowNo, rawName, company, period, existing.getPrice(), value));
                }
            }
            rows.add(new PreviewRow(rowNo, rawName, key, period, matches, values));
        }
        log.info("[Import][Preview] dataRef={} rows={} previewed={} conflicts={}",
                request.getDataRef(), data.rowCount(), limit, conflicts.size());
        return new ImportPreviewResponse(data.rowCount(), rows, conflicts);
    }
}
