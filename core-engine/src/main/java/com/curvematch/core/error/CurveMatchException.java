package com.curvematch.core.error;

/**
 * Base type for failures that abort a matching stage.
 *
 * <p>
 * Per-observation problems are never reported through this hierarchy; they
 * are recorded as {@link com.curvematch.core.model.ClassificationOutcome}
 * values instead.
 * </p>
 *
 * @since 1.0.0
 */
public class CurveMatchException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public CurveMatchException(String message) {
        super(message);
    }

    public CurveMatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
