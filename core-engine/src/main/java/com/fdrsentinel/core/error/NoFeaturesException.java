package com.fdrsentinel.core.error;

/**
 * Thrown when feature selection retains no usable numeric column.
 *
 * @since 1.0.0
 */
public class NoFeaturesException extends FdrAnalysisException {

    private static final long serialVersionUID = 1L;

    public NoFeaturesException(String message) {
        super(message);
    }
}
