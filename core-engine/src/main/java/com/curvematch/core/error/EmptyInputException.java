package com.curvematch.core.error;

/**
 * Raised when there is nothing to select from: no candidate curves or a grid
 * without points.
 *
 * @since 1.0.0
 */
public class EmptyInputException extends CurveMatchException {

    private static final long serialVersionUID = 1L;

    public EmptyInputException(String message) {
        super(message);
    }
}
