package com.fdrsentinel.core.error;

/**
 * Thrown when the required time column is absent from the input table.
 *
 * @since 1.0.0
 */
public class MissingTimeColumnException extends FdrAnalysisException {

    private static final long serialVersionUID = 1L;

    public MissingTimeColumnException(String message) {
        super(message);
    }
}
