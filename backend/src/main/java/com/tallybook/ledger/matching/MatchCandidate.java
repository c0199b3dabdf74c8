package com.tallybook.ledger.matching;

public record MatchCandidate(Long productId, String name, String normalizedName, int score) {

    public static final int EXACT_SCORE = 100;

    public boolean isExact() {
        return score == EXACT_SCORE;
    }
}
