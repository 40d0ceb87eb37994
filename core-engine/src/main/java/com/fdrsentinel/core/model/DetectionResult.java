package com.fdrsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Complete output of one detection run.
 *
 * <p>
 * {@link #getBackend()} names the scoring backend that actually ran, whether
 * or not debug output was requested.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "summary", "segments", "timeline", "debugInfo" })
public final class DetectionResult {

    @JsonProperty("summary")
    private final Summary summary;

    @JsonProperty("segments")
    private final List<Segment> segments;

    @JsonProperty("timeline")
    private final Timeline timeline;

    @JsonProperty("debugInfo")
    private final DebugInfo debugInfo;

    @JsonIgnore
    private final String backend;

    public DetectionResult(Summary summary, List<Segment> segments, Timeline timeline,
            DebugInfo debugInfo, String backend) {
        this.summary = Objects.requireNonNull(summary, "summary must not be null");
        this.segments = List.copyOf(Objects.requireNonNull(segments, "segments must not be null"));
        this.timeline = Objects.requireNonNull(timeline, "timeline must not be null");
        this.debugInfo = debugInfo;
        this.backend = Objects.requireNonNull(backend, "backend must not be null");
    }

    public Summary getSummary() {
        return summary;
    }

    public List<Segment> getSegments() {
        return segments;
    }

    public Timeline getTimeline() {
        return timeline;
    }

    @JsonIgnore
    public Optional<DebugInfo> debugInfo() {
        return Optional.ofNullable(debugInfo);
    }

    @JsonProperty("debugInfo")
    public DebugInfo getDebugInfo() {
        return debugInfo;
    }

    @JsonIgnore
    public String getBackend() {
        return backend;
    }
}
