package com.tallybook.ledger.matching;

/**
 * Symmetric string similarity on a 0-100 scale.
 * Identical strings score 100; strings sharing nothing score 0.
 */
public interface SimilarityAlgorithm {

    int score(String a, String b);

    String getName();
}
