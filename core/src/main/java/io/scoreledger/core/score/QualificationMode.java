package io.scoreledger.core.score;

/**
 * What the qualification gate counts.
 */
public enum QualificationMode {
    /** Categories with at least one present normalized value. */
    CATEGORIES,
    /** Present per-source values, summed over all categories. */
    SOURCES
}
