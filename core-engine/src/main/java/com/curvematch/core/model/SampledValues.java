package com.curvematch.core.model;

import com.curvematch.core.error.ShapeException;

import java.util.Objects;

/**
 * Shared construction checks for y sequences sampled on a {@link Grid}.
 */
final class SampledValues {

    private SampledValues() {
        // utility class - not instantiable
    }

    static double[] checked(Grid grid, double[] ys, String owner) {
        Objects.requireNonNull(grid, "Grid must not be null for " + owner);
        Objects.requireNonNull(ys, "Y values must not be null for " + owner);
        if (ys.length != grid.size()) {
            throw new ShapeException(owner + " has " + ys.length
                    + " value(s) but the grid has " + grid.size() + " point(s)");
        }
        double[] copy = ys.clone();
        for (int i = 0; i < copy.length; i++) {
            if (!Double.isFinite(copy[i])) {
                throw new IllegalArgumentException(owner + " has a non-finite value at index "
                        + i + ": " + copy[i]);
            }
        }
        return copy;
    }
}
