package com.wtbmonitor.market.matching;

/**
 * Sequence similarity in [0, 1]: {@code 2 * LCS(a, b) / (|a| + |b|)} over characters.
 */
public final class SimilarityScorer {

    private SimilarityScorer() {
    }

    public static double ratio(String a, String b) {
        if (a == null || b == null || a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        if (a.equals(b)) {
            return 1.0;
        }
        int lcs = longestCommonSubsequence(a, b);
        return (2.0 * lcs) / (a.length() + b.length());
    }

    static int longestCommonSubsequence(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int i = 1; i <= a.length(); i++) {
            char ca = a.charAt(i - 1);
            for (int j = 1; j <= b.length(); j++) {
                if (ca == b.charAt(j - 1)) {
                    current[j] = previous[j - 1] + 1;
                } else {
                    current[j] = Math.max(previous[j], current[j - 1]);
                }
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }
}
