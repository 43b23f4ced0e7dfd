package com.curvematch.core.model;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * Final result of classifying one {@link Observation}.
 *
 * <p>
 * Either <em>assigned</em> (candidate index, deviation and the series whose
 * chosen candidate matched) or <em>unassigned</em> with an
 * {@link UnassignedReason}. Use the static factories to construct.
 * </p>
 *
 * @since 1.0.0
 */
public final class ClassificationOutcome {

    private final SeriesId seriesId;
    private final int candidateIndex;
    private final double deviation;
    private final UnassignedReason reason;

    private ClassificationOutcome(SeriesId seriesId, int candidateIndex, double deviation,
            UnassignedReason reason) {
        this.seriesId = seriesId;
        this.candidateIndex = candidateIndex;
        this.deviation = deviation;
        this.reason = reason;
    }

    /**
     * @param seriesId       series whose chosen candidate matched
     * @param candidateIndex 0-based candidate index
     * @param deviation      absolute deviation from that candidate
     * @return an assigned outcome
     */
    public static ClassificationOutcome assigned(SeriesId seriesId, int candidateIndex, double deviation) {
        Objects.requireNonNull(seriesId, "Series id must not be null");
        if (candidateIndex < 0) {
            throw new IllegalArgumentException("Candidate index must be >= 0, got: " + candidateIndex);
        }
        return new ClassificationOutcome(seriesId, candidateIndex, deviation, null);
    }

    public static ClassificationOutcome unassigned(UnassignedReason reason) {
        return new ClassificationOutcome(null, -1, Double.NaN,
                Objects.requireNonNull(reason, "Reason must not be null"));
    }

    public boolean isAssigned() {
        return reason == null;
    }

    public OptionalInt getCandidateIndex() {
        return isAssigned() ? OptionalInt.of(candidateIndex) : OptionalInt.empty();
    }

    public OptionalDouble getDeviation() {
        return isAssigned() ? OptionalDouble.of(deviation) : OptionalDouble.empty();
    }

    public Optional<SeriesId> getSeriesId() {
        return Optional.ofNullable(seriesId);
    }

    public Optional<UnassignedReason> getReason() {
        return Optional.ofNullable(reason);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ClassificationOutcome that))
            return false;
        return candidateIndex == that.candidateIndex
                && Double.compare(deviation, that.deviation) == 0
                && seriesId == that.seriesId
                && reason == that.reason;
    }

    @Override
    public int hashCode() {
        return Objects.hash(seriesId, candidateIndex, deviation, reason);
    }

    @Override
    public String toString() {
        if (isAssigned()) {
            return "Assigned{series=" + seriesId + ", candidateIndex=" + candidateIndex
                    + ", deviation=" + deviation + '}';
        }
        return "Unassigned{reason=" + reason + '}';
    }
}
