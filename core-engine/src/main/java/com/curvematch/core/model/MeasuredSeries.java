package com.curvematch.core.model;

import java.util.Objects;

/**
 * One of the four measured series: y values sampled on the shared
 * {@link Grid}.
 *
 * <p>
 * Immutable. Construction fails with a
 * {@link com.curvematch.core.error.ShapeException} if the number of values
 * differs from the grid size.
 * </p>
 *
 * @since 1.0.0
 */
public final class MeasuredSeries {

    private final SeriesId id;
    private final Grid grid;
    private final double[] ys;

    public MeasuredSeries(SeriesId id, Grid grid, double... ys) {
        this.id = Objects.requireNonNull(id, "Series id must not be null");
        this.grid = grid;
        this.ys = SampledValues.checked(grid, ys, "Measured series " + id.label());
    }

    public SeriesId getId() {
        return id;
    }

    public Grid getGrid() {
        return grid;
    }

    public int size() {
        return ys.length;
    }

    public double y(int index) {
        return ys[index];
    }

    /**
     * @return a copy of the y values
     */
    public double[] getYs() {
        return ys.clone();
    }

    @Override
    public String toString() {
        return "MeasuredSeries{id=" + id + ", size=" + ys.length + '}';
    }
}
