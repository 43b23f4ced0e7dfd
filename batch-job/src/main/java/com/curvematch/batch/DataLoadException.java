package com.curvematch.batch;

/**
 * Raised when an input table cannot be read or does not have the expected
 * shape: missing file, missing column, unparsable number, or an ideal-function
 * table whose x column differs from the training grid.
 *
 * @since 1.0.0
 */
public class DataLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public DataLoadException(String message) {
        super(message);
    }

    public DataLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
