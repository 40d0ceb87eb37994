package com.fdrsentinel.core.segmentation;

import java.util.Objects;

/**
 * Inclusive row range {@code [startRow, endRow]} of one segment. Review spans
 * are single rows picked by the fallback pass.
 *
 * @since 1.0.0
 */
public final class RowSpan {

    private final int startRow;
    private final int endRow;
    private final boolean review;

    public RowSpan(int startRow, int endRow, boolean review) {
        if (startRow < 0 || endRow < startRow) {
            throw new IllegalArgumentException("Invalid row span [" + startRow + ", " + endRow + "]");
        }
        this.startRow = startRow;
        this.endRow = endRow;
        this.review = review;
    }

    public static RowSpan review(int row) {
        return new RowSpan(row, row, true);
    }

    public int startRow() {
        return startRow;
    }

    public int endRow() {
        return endRow;
    }

    public boolean review() {
        return review;
    }

    public int length() {
        return endRow - startRow + 1;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RowSpan other)) {
            return false;
        }
        return startRow == other.startRow && endRow == other.endRow && review == other.review;
    }

    @Override
    public int hashCode() {
        return Objects.hash(startRow, endRow, review);
    }

    @Override
    public String toString() {
        return (review ? "review" : "span") + "[" + startRow + ", " + endRow + "]";
    }
}
