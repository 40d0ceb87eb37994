package com.fdrsentinel.core.attribution;

import com.fdrsentinel.core.model.Segment;

import java.util.List;

/**
 * Segments with their drivers and statistics, plus the per-row flagged mask
 * (anomaly mask unioned with every segment's time range).
 *
 * @since 1.0.0
 */
public final class Attribution {

    private final List<Segment> segments;
    private final boolean[] flagged;

    Attribution(List<Segment> segments, boolean[] flagged) {
        this.segments = List.copyOf(segments);
        this.flagged = flagged;
    }

    public List<Segment> getSegments() {
        return segments;
    }

    public boolean[] getFlagged() {
        return flagged.clone();
    }

    public int flaggedCount() {
        int count = 0;
        for (boolean f : flagged) {
            if (f) {
                count++;
            }
        }
        return count;
    }
}
