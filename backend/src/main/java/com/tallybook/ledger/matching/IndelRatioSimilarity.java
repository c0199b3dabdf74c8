package com.tallybook.ledger.matching;

/**
 * Ratio based on insert/delete edit distance: {@code 200 * LCS / (|a| + |b|)}.
 * Matches the "ratio" scoring commonly used for fuzzy name lookups.
 */
public class IndelRatioSimilarity implements SimilarityAlgorithm {

    @Override
    public int score(String a, String b) {
        String s1 = a == null ? "" : a;
        String s2 = b == null ? "" : b;
        if (s1.equals(s2)) return 100;
        int total = s1.length() + s2.length();
        if (total == 0 || s1.isEmpty() || s2.isEmpty()) return 0;
        int lcs = longestCommonSubsequence(s1, s2);
        return (int) Math.round(200.0 * lcs / total);
    }

    @Override
    public String getName() {
        return "indel";
    }

    private static int longestCommonSubsequence(String s1, String s2) {
        if (s1.length() < s2.length()) {
            String t = s1;
            s1 = s2;
            s2 = t;
        }
        int[] prev = new int[s2.length() + 1];
        int[] curr = new int[s2.length() + 1];
        for (int i = 1; i <= s1.length(); i++) {
            char c = s1.charAt(i - 1);
            for (int j = 1; j <= s2.length(); j++) {
                curr[j] = c == s2.charAt(j - 1)
                        ? prev[j - 1] + 1
                        : Math.max(prev[j], curr[j - 1]);
            }
            int[] t = prev;
            prev = curr;
            curr = t;
        }
        return prev[s2.length()];
    }
}
