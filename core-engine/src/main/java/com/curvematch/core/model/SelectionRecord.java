package com.curvematch.core.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * Outcome of selecting the best candidate curve for one measured series.
 *
 * <p>
 * Holds the chosen candidate index, its sum of squared deviations, and the
 * per-point absolute deviations between the series and that candidate.
 * Immutable.
 * </p>
 *
 * @since 1.0.0
 */
public final class SelectionRecord {

    private final SeriesId seriesId;
    private final int candidateIndex;
    private final double sumSquaredDeviations;
    private final double maxDeviation;
    private final double[] deviations;

    /**
     * @param seriesId             the measured series this record belongs to
     * @param candidateIndex       0-based index of the chosen candidate
     * @param sumSquaredDeviations minimal SSD over the candidate library
     * @param deviations           per-point absolute deviations of the chosen
     *                             candidate; must not be empty
     */
    public SelectionRecord(SeriesId seriesId, int candidateIndex,
            double sumSquaredDeviations, double[] deviations) {
        this.seriesId = Objects.requireNonNull(seriesId, "Series id must not be null");
        Objects.requireNonNull(deviations, "Deviations must not be null");
        if (deviations.length == 0) {
            throw new IllegalArgumentException("Deviations must not be empty");
        }
        this.candidateIndex = candidateIndex;
        this.sumSquaredDeviations = sumSquaredDeviations;
        this.deviations = deviations.clone();
        double max = 0.0;
        for (double d : this.deviations) {
            max = Math.max(max, d);
        }
        this.maxDeviation = max;
    }

    public SeriesId getSeriesId() {
        return seriesId;
    }

    public int getCandidateIndex() {
        return candidateIndex;
    }

    public double getSumSquaredDeviations() {
        return sumSquaredDeviations;
    }

    /**
     * @return largest absolute per-point deviation of the chosen candidate
     */
    public double getMaxDeviation() {
        return maxDeviation;
    }

    /**
     * @return a copy of the per-point absolute deviations
     */
    public double[] getDeviations() {
        return deviations.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SelectionRecord that))
            return false;
        return seriesId == that.seriesId
                && candidateIndex == that.candidateIndex
                && Double.compare(sumSquaredDeviations, that.sumSquaredDeviations) == 0
                && Arrays.equals(deviations, that.deviations);
    }

    @Override
    public int hashCode() {
        return Objects.hash(seriesId, candidateIndex, sumSquaredDeviations);
    }

    @Override
    public String toString() {
        return "SelectionRecord{" +
                "series=" + seriesId +
                ", candidateIndex=" + candidateIndex +
                ", sumSquaredDeviations=" + sumSquaredDeviations +
                ", maxDeviation=" + maxDeviation +
                '}';
    }
}
