package com.fdrsentinel.core.error;

/**
 * Base type for every failure the detection pipeline reports.
 *
 * <p>
 * All pipeline errors are unchecked and raised synchronously. The core never
 * catches them: a run either produces a complete
 * {@link com.fdrsentinel.core.model.DetectionResult} or throws one of the
 * subclasses below, and the caller decides how to surface it.
 * </p>
 *
 * @since 1.0.0
 */
public class FdrAnalysisException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public FdrAnalysisException(String message) {
        super(message);
    }

    public FdrAnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
