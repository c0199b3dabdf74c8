package com.tallybook.ledger.matching;

/**
 * {@code 100 * (1 - distance / maxLength)} over the classic Levenshtein distance.
 */
public class LevenshteinRatioSimilarity implements SimilarityAlgorithm {

    @Override
    public int score(String a, String b) {
        String s1 = a == null ? "" : a;
        String s2 = b == null ? "" : b;
        if (s1.equals(s2)) return 100;
        if (s1.isEmpty() || s2.isEmpty()) return 0;
        int distance = distance(s1, s2);
        int maxLength = Math.max(s1.length(), s2.length());
        return (int) Math.round(100.0 * (1.0 - (double) distance / maxLength));
    }

    @Override
    public String getName() {
        return "levenshtein";
    }

    // Wagner-Fischer with two rows
    private static int distance(String s1, String s2) {
        if (s1.length() > s2.length()) {
            String t = s1;
            s1 = s2;
            s2 = t;
        }
        int m = s1.length();
        int[] previousRow = new int[m + 1];
        int[] currentRow = new int[m + 1];
        for (int i = 0; i <= m; i++) previousRow[i] = i;

        for (int j = 1; j <= s2.length(); j++) {
            currentRow[0] = j;
            for (int i = 1; i <= m; i++) {
                int cost = s1.charAt(i - 1) == s2.charAt(j - 1) ? 0 : 1;
                currentRow[i] = Math.min(
                        Math.min(currentRow[i - 1] + 1, previousRow[i] + 1),
                        previousRow[i - 1] + cost);
            }
            int[] t = previousRow;
            previousRow = currentRow;
            currentRow = t;
        }
        return previousRow[m];
    }
}
