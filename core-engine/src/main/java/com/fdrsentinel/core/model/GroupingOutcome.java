package com.fdrsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Which branch of segment grouping produced the segments of a run.
 *
 * @since 1.0.0
 */
public enum GroupingOutcome {

    /** Rows above the threshold (or in the anomaly mask) formed at least one segment. */
    THRESHOLD_SEGMENTS,

    /** Every score was equal; the top-scoring rows are listed for review. */
    DEGENERATE_DISTRIBUTION,

    /** The threshold pass found nothing; the top-scoring rows are listed for review. */
    REVIEW_FALLBACK;

    @JsonValue
    public String getLabel() {
        return name().toLowerCase(Locale.ROOT);
    }
}
