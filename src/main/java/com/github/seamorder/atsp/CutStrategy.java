package com.github.seamorder.atsp;

/**
 * Which cycles {@link SubtourEliminationCallback} cuts off when a candidate is not a single tour.
 */
public enum CutStrategy {
    /**
     * Cut only the cycle through the depot. Other cycles are caught in later rounds.
     */
    DEPOT_CYCLE,
    /**
     * Cut every disjoint cycle of the candidate in the same round. Usually needs fewer rounds.
     */
    ALL_CYCLES
}
