package com.fdrsentinel.core.preprocess;

import com.fdrsentinel.core.error.InsufficientDataException;
import com.fdrsentinel.core.model.WindowSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cuts a scaled matrix into overlapping fixed-length windows at offsets
 * {@code 0, S, 2S, ...} while {@code start + L <= rows}.
 *
 * <p>
 * A series shorter than {@code L} is windowed with {@code L = max(5, rows)}
 * and {@code S = 1}.
 * </p>
 *
 * @since 1.0.0
 */
public final class Windower {

    private static final Logger LOG = LoggerFactory.getLogger(Windower.class);

    static final int MIN_SHRUNK_LENGTH = 5;

    private Windower() {
        // utility class
    }

    /**
     * @param scaled       row-major scaled values
     * @param windowLength requested window length {@code L}
     * @param stride       requested stride {@code S}
     * @return windows flattened time-major
     * @throws InsufficientDataException if no window fits
     */
    public static WindowSet window(double[][] scaled, int windowLength, int stride) {
        if (windowLength <= 0 || stride <= 0) {
            throw new IllegalArgumentException("windowLength and stride must be positive");
        }
        int rows = scaled.length;
        int length = windowLength;
        int step = stride;
        if (rows < length) {
            length = Math.max(MIN_SHRUNK_LENGTH, rows);
            step = 1;
            LOG.warn("Series of {} row(s) is shorter than window {}; using window {} stride 1",
                    rows, windowLength, length);
        }

        int count = windowCount(rows, length, step);
        if (count == 0) {
            throw new InsufficientDataException("Unable to build windows for anomaly detection.");
        }

        int features = scaled[0].length;
        int[] starts = new int[count];
        double[][] windows = new double[count][length * features];
        for (int w = 0; w < count; w++) {
            int start = w * step;
            starts[w] = start;
            for (int t = 0; t < length; t++) {
                System.arraycopy(scaled[start + t], 0, windows[w], t * features, features);
            }
        }
        LOG.info("Built {} window(s) of length {} stride {}", count, length, step);
        return new WindowSet(length, step, features, starts, windows);
    }

    /**
     * @return {@code floor((rows - L) / S) + 1}, or 0 when {@code rows < L}
     */
    public static int windowCount(int rows, int windowLength, int stride) {
        return rows < windowLength ? 0 : (rows - windowLength) / stride + 1;
    }
}
