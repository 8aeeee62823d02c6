package com.orderintake.core.match;

/**
 * Scores how alike two strings are.
 * <p>
 * Implementations return a ratio in {@code [0, 1]} where {@code 1.0} means identical and must be
 * symmetric. Thresholds used by the pipeline are expressed against this ratio, so the algorithm
 * can be swapped without touching callers.
 */
@FunctionalInterface
public interface SimilarityScorer {

    double score(String left, String right);
}
