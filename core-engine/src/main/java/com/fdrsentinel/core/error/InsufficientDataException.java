package com.fdrsentinel.core.error;

/**
 * Thrown when windowing produces zero windows even after the short-series
 * shrink policy has been applied.
 *
 * @since 1.0.0
 */
public class InsufficientDataException extends FdrAnalysisException {

    private static final long serialVersionUID = 1L;

    public InsufficientDataException(String message) {
        super(message);
    }
}
