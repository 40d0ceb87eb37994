package com.fdrsentinel.core.model;

import java.util.Objects;

/**
 * Fixed-length windows cut from a scaled matrix, flattened time-major
 * ({@code [t0f0, t0f1, ..., t1f0, ...]}). Window {@code w} covers rows
 * {@code [start(w), start(w) + windowLength)}.
 *
 * @since 1.0.0
 */
public final class WindowSet {

    private final int windowLength;
    private final int stride;
    private final int featureCount;
    private final int[] starts;
    private final double[][] windows;

    public WindowSet(int windowLength, int stride, int featureCount, int[] starts, double[][] windows) {
        this.windowLength = windowLength;
        this.stride = stride;
        this.featureCount = featureCount;
        this.starts = Objects.requireNonNull(starts, "starts must not be null").clone();
        this.windows = Objects.requireNonNull(windows, "windows must not be null");
        if (starts.length != windows.length) {
            throw new IllegalArgumentException("Expected one start offset per window");
        }
    }

    public int getWindowLength() {
        return windowLength;
    }

    public int getStride() {
        return stride;
    }

    public int getFeatureCount() {
        return featureCount;
    }

    public int size() {
        return windows.length;
    }

    public int start(int window) {
        return starts[window];
    }

    /**
     * @return the flattened windows; callers must not modify them
     */
    public double[][] getWindows() {
        return windows;
    }

    /**
     * @return the first {@code count} windows
     */
    public double[][] head(int count) {
        double[][] head = new double[Math.min(count, windows.length)][];
        System.arraycopy(windows, 0, head, 0, head.length);
        return head;
    }
}
