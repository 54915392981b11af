package org.Aayush.tempus.heuristic;

/**
 * Supported heuristic modes.
 *
 * <p>{@code NONE} disables heuristic guidance (uniform-cost behavior).</p>
 * <p>{@code TEMPORAL_MAX} is the critical-path cost through the delete-relaxed planning graph.</p>
 * <p>{@code TEMPORAL_FF} sums the costs of a relaxed plan extracted from the same graph; it is
 * better informed but not admissible.</p>
 */
public enum HeuristicType {
    NONE,
    TEMPORAL_MAX,
    TEMPORAL_FF
}
