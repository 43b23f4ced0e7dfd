package com.curvematch.core.model;

import java.util.Optional;

/**
 * An independent (x, y) pair to classify against the chosen candidates.
 *
 * <p>
 * The outcome starts unset and is written exactly once; a second write
 * throws {@link IllegalStateException}. Writes are synchronized so that
 * observations can be classified from worker threads.
 * </p>
 *
 * @since 1.0.0
 */
public final class Observation {

    private final double x;
    private final double y;

    private ClassificationOutcome outcome;

    public Observation(double x, double y) {
        this.x = x;
        this.y = y;
    }

    public double getX() {
        return x;
    }

    public double getY() {
        return y;
    }

    /**
     * Record the final classification.
     *
     * @param outcome the outcome; must not be {@code null}
     * @throws IllegalStateException if an outcome was already recorded
     */
    public synchronized void recordOutcome(ClassificationOutcome outcome) {
        if (outcome == null) {
            throw new NullPointerException("Outcome must not be null");
        }
        if (this.outcome != null) {
            throw new IllegalStateException("Observation (" + x + ", " + y
                    + ") already classified as " + this.outcome);
        }
        this.outcome = outcome;
    }

    /**
     * @return the recorded outcome, or empty while unprocessed
     */
    public synchronized Optional<ClassificationOutcome> getOutcome() {
        return Optional.ofNullable(outcome);
    }

    public synchronized boolean isProcessed() {
        return outcome != null;
    }

    @Override
    public synchronized String toString() {
        return "Observation{x=" + x + ", y=" + y + ", outcome=" + outcome + '}';
    }
}
