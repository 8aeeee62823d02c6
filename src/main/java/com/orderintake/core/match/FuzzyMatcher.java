package com.orderintake.core.match;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Picks the closest strings out of a candidate list using a {@link SimilarityScorer}.
 * Results are ordered best first; equal scores keep the candidate order.
 */
public final class FuzzyMatcher {

    private final SimilarityScorer scorer;

    public FuzzyMatcher(SimilarityScorer scorer) {
        this.scorer = Objects.requireNonNull(scorer, "scorer");
    }

    public static FuzzyMatcher lcsRatio() {
        return new FuzzyMatcher(new LcsRatioScorer());
    }

    public SimilarityScorer scorer() {
        return scorer;
    }

    /**
     * @param word       phrase to look up
     * @param candidates strings to compare against, in priority order
     * @param limit      maximum number of results
     * @param cutoff     minimum similarity for a candidate to qualify
     * @return up to {@code limit} qualifying candidates, best first (possibly empty)
     */
    public List<String> closeMatches(String word, List<String> candidates, int limit, double cutoff) {
        if (word == null || candidates == null || candidates.isEmpty() || limit <= 0) {
            return List.of();
        }
        List<Scored> scored = new ArrayList<>();
        for (int i = 0; i < candidates.size(); i++) {
            String candidate = candidates.get(i);
            if (candidate == null) {
                continue;
            }
            double score = scorer.score(word, candidate);
            if (score >= cutoff) {
                scored.add(new Scored(candidate, score, i));
            }
        }
        scored.sort(Comparator.comparingDouble(Scored::score).reversed()
            .thenComparingInt(Scored::position));

        List<String> result = new ArrayList<>();
        for (Scored entry : scored) {
            if (result.size() >= limit) {
                break;
            }
            result.add(entry.value());
        }
        return List.copyOf(result);
    }

    public Optional<String> bestMatch(String word, List<String> candidates, double cutoff) {
        List<String> matches = closeMatches(word, candidates, 1, cutoff);
        return matches.isEmpty() ? Optional.empty() : Optional.of(matches.get(0));
    }

    private record Scored(String value, double score, int position) {
    }
}
