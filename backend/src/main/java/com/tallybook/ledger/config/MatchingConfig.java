package com.tallybook.ledger.config;

import com.tallybook.ledger.matching.*;
import com.tallybook.ledger.repository.ProductRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Locale;

@Configuration
public class MatchingConfig {
    private static final Logger log = LoggerFactory.getLogger(MatchingConfig.class);

    @Bean
    public SimilarityAlgorithm similarityAlgorithm(@Value("${tallybook.matching.algorithm:indel}") String algorithm) {
        String name = algorithm == null ? "" : algorithm.trim().toLowerCase(Locale.ROOT);
        SimilarityAlgorithm chosen = switch (name) {
            case "levenshtein" -> new LevenshteinRatioSimilarity();
            case "indel", "" -> new IndelRatioSimilarity();
            default -> throw new IllegalArgumentException("Unknown tallybook.matching.algorithm: " + algorithm);
        };
        log.info("[Matcher][Config] similarity algorithm={}", chosen.getName());
        return chosen;
    }

    @Bean
    public ProductMatcher productMatcher(ProductRepository productRepository, SimilarityAlgorithm similarityAlgorithm) {
        return new CatalogProductMatcher(
                new ExactKeyMatcher(productRepository),
                new SimilarityScanMatcher(productRepository, similarityAlgorithm));
    }
}
