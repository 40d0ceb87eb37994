/**
 * Error taxonomy of the detection pipeline.
 *
 * <p>
 * Every type extends {@link com.fdrsentinel.core.error.FdrAnalysisException}.
 * Numerically degenerate inputs (zero variance, all-equal scores) are
 * <strong>not</strong> errors; they are handled by explicit fallback
 * branches and still produce a result.
 * </p>
 *
 * @since 1.0.0
 */
package com.fdrsentinel.core.error;
