package com.curvematch.core.model;

/**
 * Why an observation ended up unassigned.
 *
 * @since 1.0.0
 */
public enum UnassignedReason {

    /** Every chosen candidate deviates by more than its threshold. */
    NO_QUALIFYING_CANDIDATE,

    /** The observation's x lies outside the grid's coverage. */
    OUTSIDE_GRID
}
