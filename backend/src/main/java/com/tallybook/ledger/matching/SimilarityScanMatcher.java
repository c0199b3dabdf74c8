package com.tallybook.ledger.matching;

import com.tallybook.ledger.repository.ProductRepository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Scores every catalog product against the key. Cost grows linearly with the
 * catalog, once per unmatched row; an indexed approximate structure can replace
 * it behind {@link ProductMatcher}.
 */
public class SimilarityScanMatcher implements ProductMatcher {

    private final ProductRepository productRepository;
    private final SimilarityAlgorithm algorithm;

    public SimilarityScanMatcher(ProductRepository productRepository, SimilarityAlgorithm algorithm) {
        this.productRepository = productRepository;
        this.algorithm = algorithm;
    }

    @Override
    public List<MatchCandidate> match(String normalizedKey, int threshold, int limit) {
        if (normalizedKey == null || normalizedKey.isEmpty() || limit <= 0) return List.of();
        List<MatchCandidate> scored = new ArrayList<>();
        for (ProductRepository.ProductKeyProjection p : productRepository.findAllKeys()) {
            String candidateKey = p.getNormalizedName() != null && !p.getNormalizedName().isEmpty()
                    ? p.getNormalizedName()
                    : p.getName();
            int score = algorithm.score(normalizedKey, candidateKey);
            if (score >= threshold) {
                scored.add(new MatchCandidate(p.getId(), p.getName(), p.getNormalizedName(), score));
            }
        }
        // List.sort is stable: equal scores keep catalog order
        scored.sort(Comparator.comparingInt(MatchCandidate::score).reversed());
        return scored.size() > limit ? List.copyOf(scored.subList(0, limit)) : scored;
    }
}
