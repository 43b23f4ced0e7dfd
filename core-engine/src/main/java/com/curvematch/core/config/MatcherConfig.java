package com.curvematch.core.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Tunables for selection and classification, loaded from YAML.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * gridTolerance: 0.0
 * parallelism: 1
 * expectedCandidateCount: 50
 * </pre>
 *
 * <p>
 * Instances are handed to the selector and classifier at construction;
 * nothing reads configuration from global state. Call {@link #validate()}
 * after loading.
 * </p>
 *
 * @since 1.0.0
 */
public class MatcherConfig {

    /** How far past the first/last grid x an observation still resolves. */
    private double gridTolerance = 0.0;

    /** Worker count for scoring and classification; 1 runs sequentially. */
    private int parallelism = 1;

    /** Required candidate library size; 0 disables the check. */
    private int expectedCandidateCount = 0;

    /**
     * @return a configuration with all defaults
     */
    public static MatcherConfig defaults() {
        return new MatcherConfig();
    }

    /**
     * Validate that every value is within its legal range.
     *
     * @throws IllegalStateException if validation fails
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (!(gridTolerance >= 0) || Double.isInfinite(gridTolerance)) {
            errors.add("'gridTolerance' must be a finite value >= 0, got: " + gridTolerance);
        }
        if (parallelism < 1) {
            errors.add("'parallelism' must be >= 1, got: " + parallelism);
        }
        if (expectedCandidateCount < 0) {
            errors.add("'expectedCandidateCount' must be >= 0, got: " + expectedCandidateCount);
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid MatcherConfig: " + String.join("; ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public double getGridTolerance() {
        return gridTolerance;
    }

    public void setGridTolerance(double gridTolerance) {
        this.gridTolerance = gridTolerance;
    }

    public int getParallelism() {
        return parallelism;
    }

    public void setParallelism(int parallelism) {
        this.parallelism = parallelism;
    }

    public int getExpectedCandidateCount() {
        return expectedCandidateCount;
    }

    public void setExpectedCandidateCount(int expectedCandidateCount) {
        this.expectedCandidateCount = expectedCandidateCount;
    }

    @Override
    public String toString() {
        return "MatcherConfig{" +
                "gridTolerance=" + gridTolerance +
                ", parallelism=" + parallelism +
                ", expectedCandidateCount=" + expectedCandidateCount +
                '}';
    }
}
