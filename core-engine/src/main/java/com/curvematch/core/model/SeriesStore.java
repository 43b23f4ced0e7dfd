package com.curvematch.core.model;

import com.curvematch.core.error.EmptyInputException;
import com.curvematch.core.error.ShapeException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * In-memory input of one matching run: the shared {@link Grid}, the four
 * {@link MeasuredSeries}, the candidate library and the observations to
 * classify.
 *
 * <h3>Invariants</h3>
 * <ul>
 * <li>all four series are present and sampled on the store's grid</li>
 * <li>the candidate library is non-empty, every curve is sampled on the same
 * grid, and curve {@code i} carries index {@code i}</li>
 * </ul>
 * <p>
 * Violations surface at {@link Builder#build()} as
 * {@link ShapeException} or {@link EmptyInputException}.
 * </p>
 *
 * @since 1.0.0
 */
public final class SeriesStore {

    private final Grid grid;
    private final Map<SeriesId, MeasuredSeries> measured;
    private final List<CandidateCurve> candidates;
    private final List<Observation> observations;

    private SeriesStore(Builder b) {
        this.grid = b.grid;
        this.measured = Collections.unmodifiableMap(new EnumMap<>(b.measured));
        this.candidates = List.copyOf(b.candidates);
        this.observations = Collections.unmodifiableList(new ArrayList<>(b.observations));
    }

    /**
     * @param grid the grid shared by every series in the store
     * @return a new builder
     */
    public static Builder builder(Grid grid) {
        return new Builder(grid);
    }

    public Grid getGrid() {
        return grid;
    }

    public MeasuredSeries getMeasured(SeriesId id) {
        return measured.get(Objects.requireNonNull(id, "Series id must not be null"));
    }

    /**
     * @return unmodifiable map of the four measured series, in {@code Y1..Y4}
     *         order
     */
    public Map<SeriesId, MeasuredSeries> getMeasuredSeries() {
        return measured;
    }

    /**
     * @return unmodifiable candidate library in index order
     */
    public List<CandidateCurve> getCandidates() {
        return candidates;
    }

    /**
     * @return unmodifiable list of observations; the observations themselves
     *         carry a write-once outcome
     */
    public List<Observation> getObservations() {
        return observations;
    }

    @Override
    public String toString() {
        return "SeriesStore{" +
                "grid=" + grid +
                ", measured=" + measured.size() +
                ", candidates=" + candidates.size() +
                ", observations=" + observations.size() +
                '}';
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link SeriesStore}.
     *
     * <p>
     * Raw y arrays are wrapped against the builder's grid; prebuilt series
     * and curves are checked for grid compatibility.
     * </p>
     */
    public static class Builder {
        private final Grid grid;
        private final EnumMap<SeriesId, MeasuredSeries> measured = new EnumMap<>(SeriesId.class);
        private final List<CandidateCurve> candidates = new ArrayList<>();
        private final List<Observation> observations = new ArrayList<>();

        private Builder(Grid grid) {
            this.grid = Objects.requireNonNull(grid, "Grid must not be null");
        }

        public Builder measured(SeriesId id, double... ys) {
            return measured(new MeasuredSeries(id, grid, ys));
        }

        public Builder measured(MeasuredSeries series) {
            Objects.requireNonNull(series, "Measured series must not be null");
            requireSameGrid(series.getGrid(), "Measured series " + series.getId().label());
            measured.put(series.getId(), series);
            return this;
        }

        /**
         * Append a candidate curve; its index is its position in the library.
         *
         * @param ys y values on the builder's grid
         * @return this builder
         */
        public Builder candidate(double... ys) {
            candidates.add(new CandidateCurve(candidates.size(), grid, ys));
            return this;
        }

        public Builder candidate(CandidateCurve curve) {
            Objects.requireNonNull(curve, "Candidate curve must not be null");
            requireSameGrid(curve.getGrid(), "Candidate curve " + curve.getIndex());
            if (curve.getIndex() != candidates.size()) {
                throw new IllegalArgumentException("Candidate curve index " + curve.getIndex()
                        + " does not match its library position " + candidates.size());
            }
            candidates.add(curve);
            return this;
        }

        public Builder observation(double x, double y) {
            observations.add(new Observation(x, y));
            return this;
        }

        public Builder observation(Observation observation) {
            observations.add(Objects.requireNonNull(observation, "Observation must not be null"));
            return this;
        }

        /**
         * Build and validate the store.
         *
         * @return a validated {@link SeriesStore}
         * @throws ShapeException      if a measured series is missing
         * @throws EmptyInputException if no candidate curve was added
         */
        public SeriesStore build() {
            for (SeriesId id : SeriesId.values()) {
                if (!measured.containsKey(id)) {
                    throw new ShapeException("Measured series " + id.label() + " is missing");
                }
            }
            if (candidates.isEmpty()) {
                throw new EmptyInputException("Candidate library must contain at least one curve");
            }
            return new SeriesStore(this);
        }

        private void requireSameGrid(Grid other, String owner) {
            if (!grid.isCompatibleWith(other)) {
                throw new ShapeException(owner + " is sampled on " + other
                        + " but the store grid is " + grid);
            }
        }
    }
}
