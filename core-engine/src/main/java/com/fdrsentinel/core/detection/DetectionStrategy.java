package com.fdrsentinel.core.detection;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * The two detection pipelines.
 *
 * @since 1.0.0
 */
public enum DetectionStrategy {

    /** Windowed reconstruction-error scoring. */
    RECONSTRUCTION,

    /** Row-level rolling robust z-scores plus an isolation forest. */
    ROBUST;

    /**
     * @param name case-insensitive strategy name
     * @throws IllegalArgumentException if the name is unknown
     */
    public static DetectionStrategy fromName(String name) {
        for (DetectionStrategy strategy : values()) {
            if (strategy.name().equalsIgnoreCase(name == null ? "" : name.trim())) {
                return strategy;
            }
        }
        throw new IllegalArgumentException("Unknown detection strategy: '" + name
                + "'. Supported strategies: " + Arrays.stream(values())
                        .map(s -> s.name().toLowerCase(Locale.ROOT))
                        .collect(Collectors.joining(", ")));
    }
}
