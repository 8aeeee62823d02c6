package com.orderintake.core.match;

import org.apache.commons.text.similarity.LongestCommonSubsequence;

import java.util.Locale;

/**
 * Normalized longest-common-subsequence ratio: {@code 2 * LCS / (|a| + |b|)}, compared
 * case-insensitively. Two empty strings score {@code 1.0}.
 */
public final class LcsRatioScorer implements SimilarityScorer {

    private final LongestCommonSubsequence lcs = new LongestCommonSubsequence();

    @Override
    public double score(String left, String right) {
        if (left == null || right == null) {
            return 0.0;
        }
        String a = left.toLowerCase(Locale.ROOT);
        String b = right.toLowerCase(Locale.ROOT);
        int total = a.length() + b.length();
        if (total == 0) {
            return 1.0;
        }
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        int common = lcs.apply(a, b);
        return 2.0 * common / total;
    }
}
