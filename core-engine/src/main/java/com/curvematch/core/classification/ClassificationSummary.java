package com.curvematch.core.classification;

import com.curvematch.core.model.ClassificationOutcome;
import com.curvematch.core.model.UnassignedReason;

import java.util.Objects;

/**
 * Counts of classification outcomes for one batch of observations.
 *
 * @since 1.0.0
 */
public final class ClassificationSummary {

    private final int assigned;
    private final int noQualifyingCandidate;
    private final int outsideGrid;

    private ClassificationSummary(Builder b) {
        this.assigned = b.assigned;
        this.noQualifyingCandidate = b.noQualifyingCandidate;
        this.outsideGrid = b.outsideGrid;
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getTotal() {
        return assigned + noQualifyingCandidate + outsideGrid;
    }

    public int getAssigned() {
        return assigned;
    }

    public int getUnassigned() {
        return noQualifyingCandidate + outsideGrid;
    }

    public int getNoQualifyingCandidate() {
        return noQualifyingCandidate;
    }

    public int getOutsideGrid() {
        return outsideGrid;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ClassificationSummary that))
            return false;
        return assigned == that.assigned
                && noQualifyingCandidate == that.noQualifyingCandidate
                && outsideGrid == that.outsideGrid;
    }

    @Override
    public int hashCode() {
        return Objects.hash(assigned, noQualifyingCandidate, outsideGrid);
    }

    @Override
    public String toString() {
        return "ClassificationSummary{" +
                "assigned=" + assigned +
                ", noQualifyingCandidate=" + noQualifyingCandidate +
                ", outsideGrid=" + outsideGrid +
                '}';
    }

    /**
     * Accumulates outcomes one at a time.
     */
    public static class Builder {
        private int assigned;
        private int noQualifyingCandidate;
        private int outsideGrid;

        public Builder add(ClassificationOutcome outcome) {
            Objects.requireNonNull(outcome, "Outcome must not be null");
            if (outcome.isAssigned()) {
                assigned++;
            } else if (outcome.getReason().orElseThrow() == UnassignedReason.OUTSIDE_GRID) {
                outsideGrid++;
            } else {
                noQualifyingCandidate++;
            }
            return this;
        }

        public ClassificationSummary build() {
            return new ClassificationSummary(this);
        }
    }
}
