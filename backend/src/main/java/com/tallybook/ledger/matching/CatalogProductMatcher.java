package com.tallybook.ledger.matching;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Exact lookup first; the similarity fallback only runs when no product carries the key.
 */
public class CatalogProductMatcher implements ProductMatcher {
    private static final Logger log = LoggerFactory.getLogger(CatalogProductMatcher.class);

    private final ProductMatcher exact;
    private final ProductMatcher fallback;

    public CatalogProductMatcher(ProductMatcher exact, ProductMatcher fallback) {
        this.exact = exact;
        this.fallback = fallback;
    }

    @Override
    public List<MatchCandidate> match(String normalizedKey, int threshold, int limit) {
        if (normalizedKey == null || normalizedKey.isEmpty()) return List.of();
        List<MatchCandidate> hit = exact.match(normalizedKey, threshold, limit);
        if (!hit.isEmpty()) {
            return hit;
        }
        List<MatchCandidate> fuzzy = fallback.match(normalizedKey, threshold, limit);
        if (log.isDebugEnabled()) {
            log.debug("[Matcher][Fuzzy] key='{}' threshold={} candidates={}", normalizedKey, threshold, fuzzy.size());
        }
        return fuzzy;
    }
}
