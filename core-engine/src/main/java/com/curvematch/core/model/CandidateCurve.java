package com.curvematch.core.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * A reference curve from the candidate library.
 *
 * <p>
 * The curve stores only y values; its x coordinates are those of the
 * referenced {@link Grid}. {@code index} is the curve's stable, 0-based
 * position in the library.
 * </p>
 *
 * @since 1.0.0
 */
public final class CandidateCurve {

    private final int index;
    private final Grid grid;
    private final double[] ys;

    /**
     * @param index 0-based library position; must be {@code >= 0}
     * @param grid  the shared grid; must not be {@code null}
     * @param ys    y values, one per grid point
     * @throws com.curvematch.core.error.ShapeException if {@code ys} does not
     *                                                  match the grid size
     */
    public CandidateCurve(int index, Grid grid, double... ys) {
        if (index < 0) {
            throw new IllegalArgumentException("Candidate index must be >= 0, got: " + index);
        }
        this.index = index;
        this.grid = grid;
        this.ys = SampledValues.checked(grid, ys, "Candidate curve " + index);
    }

    public int getIndex() {
        return index;
    }

    /**
     * @return 1-based function number, as used in exported results
     */
    public int getFunctionNumber() {
        return index + 1;
    }

    public Grid getGrid() {
        return grid;
    }

    public int size() {
        return ys.length;
    }

    public double y(int gridIndex) {
        return ys[gridIndex];
    }

    /**
     * @return a copy of the y values
     */
    public double[] getYs() {
        return ys.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof CandidateCurve that))
            return false;
        return index == that.index && Objects.equals(grid, that.grid)
                && Arrays.equals(ys, that.ys);
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, grid);
    }

    @Override
    public String toString() {
        return "CandidateCurve{index=" + index + ", size=" + ys.length + '}';
    }
}
