package com.fdrsentinel.core.error;

/**
 * Thrown when no interpretation of the time column (plain seconds, duration,
 * absolute timestamp) yields a single valid value.
 *
 * @since 1.0.0
 */
public class TimeParseException extends FdrAnalysisException {

    private static final long serialVersionUID = 1L;

    public TimeParseException(String message) {
        super(message);
    }
}
