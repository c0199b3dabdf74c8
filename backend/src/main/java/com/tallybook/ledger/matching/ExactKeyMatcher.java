package com.tallybook.ledger.matching;

import com.tallybook.ledger.repository.ProductRepository;

import java.util.List;

/** Index lookup on the unique normalized name. */
public class ExactKeyMatcher implements ProductMatcher {

    private final ProductRepository productRepository;

    public ExactKeyMatcher(ProductRepository productRepository) {
        this.productRepository = productRepository;
    }

    @Override
    public List<MatchCandidate> match(String normalizedKey, int threshold, int limit) {
        if (normalizedKey == null || normalizedKey.isEmpty() || limit <= 0) return List.of();
        return productRepository.findByNormalizedName(normalizedKey)
                .map(p -> List.of(new MatchCandidate(p.getId(), p.getName(), p.getNormalizedName(), MatchCandidate.EXACT_SCORE)))
                .orElse(List.of());
    }
}
