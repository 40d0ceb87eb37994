package com.fdrsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Severity tier of a segment, compared against the score distribution.
 *
 * @since 1.0.0
 */
public enum Severity {

    /** Peak at or above the anomaly threshold. */
    HIGH("high"),

    /** Peak at or above the medium percentile. */
    MEDIUM("med"),

    LOW("low");

    private final String label;

    Severity(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
