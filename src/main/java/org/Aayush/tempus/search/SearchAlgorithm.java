package org.Aayush.tempus.search;

/**
 * Frontier ordering used by {@link TemporalBestFirstSearch}.
 */
public enum SearchAlgorithm {
    /** f = g + h. */
    A_STAR,
    /** f = g; the heuristic is not consulted. */
    UNIFORM_COST,
    /** f = h; the first path reaching a state wins. */
    GREEDY_BEST_FIRST
}
