package com.curvematch.core.error;

/**
 * Raised when series lengths or grids do not line up: a measured series or
 * candidate curve whose length differs from the grid, curves sampled on a
 * different grid, or a candidate library of the wrong size.
 *
 * @since 1.0.0
 */
public class ShapeException extends CurveMatchException {

    private static final long serialVersionUID = 1L;

    public ShapeException(String message) {
        super(message);
    }
}
