package com.fdrsentinel.core.error;

/**
 * Thrown when no usable rows remain after time resolution.
 *
 * @since 1.0.0
 */
public class EmptyInputException extends FdrAnalysisException {

    private static final long serialVersionUID = 1L;

    public EmptyInputException(String message) {
        super(message);
    }
}
