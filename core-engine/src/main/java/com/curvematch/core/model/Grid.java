package com.curvematch.core.model;

import com.curvematch.core.error.EmptyInputException;
import com.curvematch.core.error.ShapeException;

import java.util.Arrays;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * The shared, strictly increasing x coordinates on which every measured
 * series and every candidate curve is sampled.
 *
 * <p>
 * A single {@code Grid} instance is referenced by all series built from the
 * same input, so "same coordinate domain" is a checked property rather than
 * an assumption about positions. Instances are immutable.
 * </p>
 *
 * @since 1.0.0
 */
public final class Grid {

    private final double[] xs;

    private Grid(double[] xs) {
        this.xs = xs;
    }

    /**
     * Create a grid from the given coordinates (copied).
     *
     * @param xs x coordinates; must not be {@code null}
     * @return a new grid
     * @throws EmptyInputException if {@code xs} is empty
     * @throws ShapeException      if the coordinates are not finite and strictly
     *                             increasing
     */
    public static Grid of(double... xs) {
        Objects.requireNonNull(xs, "Grid coordinates must not be null");
        if (xs.length == 0) {
            throw new EmptyInputException("Grid must contain at least one point");
        }
        double[] copy = xs.clone();
        for (int i = 0; i < copy.length; i++) {
            if (!Double.isFinite(copy[i])) {
                throw new ShapeException("Grid coordinate at index " + i + " is not finite: " + copy[i]);
            }
            if (i > 0 && copy[i] <= copy[i - 1]) {
                throw new ShapeException("Grid must be strictly increasing, but x[" + i + "]="
                        + copy[i] + " <= x[" + (i - 1) + "]=" + copy[i - 1]);
            }
        }
        return new Grid(copy);
    }

    public int size() {
        return xs.length;
    }

    public double x(int index) {
        return xs[index];
    }

    public double first() {
        return xs[0];
    }

    public double last() {
        return xs[xs.length - 1];
    }

    /**
     * @return a copy of the coordinates
     */
    public double[] toArray() {
        return xs.clone();
    }

    /**
     * Whether two grids describe the same coordinate domain.
     *
     * @param other grid to compare against; must not be {@code null}
     * @return {@code true} if both hold identical coordinates
     */
    public boolean isCompatibleWith(Grid other) {
        Objects.requireNonNull(other, "Other grid must not be null");
        return this == other || Arrays.equals(xs, other.xs);
    }

    /**
     * Resolve {@code x} to the index of the nearest grid coordinate.
     *
     * <p>
     * Lookup is nearest-point only; no interpolation is performed. When
     * {@code x} is exactly halfway between two coordinates the lower index
     * wins.
     * </p>
     *
     * @param x         coordinate to resolve
     * @param tolerance how far beyond the first and last coordinate {@code x}
     *                  may lie and still resolve to the edge point; must be
     *                  {@code >= 0}
     * @return the nearest index, or empty if {@code x} is not finite or lies
     *         outside the grid's coverage
     */
    public OptionalInt locate(double x, double tolerance) {
        if (tolerance < 0 || Double.isNaN(tolerance)) {
            throw new IllegalArgumentException("tolerance must be >= 0, got: " + tolerance);
        }
        if (!Double.isFinite(x) || x < first() - tolerance || x > last() + tolerance) {
            return OptionalInt.empty();
        }

        int pos = Arrays.binarySearch(xs, x);
        if (pos >= 0) {
            return OptionalInt.of(pos);
        }

        int insertion = -pos - 1;
        if (insertion == 0) {
            return OptionalInt.of(0);
        }
        if (insertion == xs.length) {
            return OptionalInt.of(xs.length - 1);
        }
        double below = x - xs[insertion - 1];
        double above = xs[insertion] - x;
        return OptionalInt.of(above < below ? insertion : insertion - 1);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Grid grid))
            return false;
        return Arrays.equals(xs, grid.xs);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(xs);
    }

    @Override
    public String toString() {
        return "Grid{size=" + xs.length + ", first=" + first() + ", last=" + last() + '}';
    }
}
