package com.tallybook.ledger.matching;

import java.util.List;

/**
 * Finds catalog products for a normalized key, best first.
 */
public interface ProductMatcher {

    int DEFAULT_THRESHOLD = 90;
    int DEFAULT_LIMIT = 3;

    List<MatchCandidate> match(String normalizedKey, int threshold, int limit);

    default List<MatchCandidate> match(String normalizedKey) {
        return match(normalizedKey, DEFAULT_THRESHOLD, DEFAULT_LIMIT);
    }
}
