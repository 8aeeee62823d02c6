package com.orderintake.config;

/**
 * Tunable thresholds of the extraction pipeline.
 *
 * @param matchThreshold     similarity required for an authoritative catalog lookup
 * @param candidateThreshold similarity required for a line phrase to match a catalog name
 * @param suggestionCutoff   similarity required for a replacement suggestion
 * @param suggestionLimit    maximum number of replacement suggestions per item
 * @param keepConfidence     minimum confidence for an extracted line to become an order item
 */
public record ExtractionSettings(double matchThreshold,
                                 double candidateThreshold,
                                 double suggestionCutoff,
                                 int suggestionLimit,
                                 double keepConfidence) {

    public static final double DEFAULT_MATCH_THRESHOLD = 0.8;
    public static final double DEFAULT_CANDIDATE_THRESHOLD = 0.6;
    public static final double DEFAULT_SUGGESTION_CUTOFF = 0.6;
    public static final int DEFAULT_SUGGESTION_LIMIT = 2;
    public static final double DEFAULT_KEEP_CONFIDENCE = 0.7;

    public ExtractionSettings {
        requireRatio(matchThreshold, "matchThreshold");
        requireRatio(candidateThreshold, "candidateThreshold");
        requireRatio(suggestionCutoff, "suggestionCutoff");
        requireRatio(keepConfidence, "keepConfidence");
        if (suggestionLimit < 0) {
            throw new IllegalArgumentException("suggestionLimit must be >= 0");
        }
    }

    public static ExtractionSettings defaults() {
        return new ExtractionSettings(
            DEFAULT_MATCH_THRESHOLD,
            DEFAULT_CANDIDATE_THRESHOLD,
            DEFAULT_SUGGESTION_CUTOFF,
            DEFAULT_SUGGESTION_LIMIT,
            DEFAULT_KEEP_CONFIDENCE
        );
    }

    private static void requireRatio(double value, String name) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(name + " must be within [0, 1] but was " + value);
        }
    }
}
