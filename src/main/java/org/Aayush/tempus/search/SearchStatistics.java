package org.Aayush.tempus.search;

import lombok.Builder;
import lombok.Value;

/**
 * Counters for one search run.
 */
@Value
@Builder
public class SearchStatistics {
    /** Nodes taken from the frontier and expanded. */
    int expanded;
    /** Successors pushed onto the frontier. */
    int generated;
    /** Successors whose temporal network became inconsistent. */
    int prunedInconsistent;
    /** Successors dropped by duplicate detection. */
    int prunedDuplicate;
    /** Successors with an infinite heuristic estimate. */
    int deadEnds;
    /** Largest frontier size observed. */
    int peakFrontier;
    long elapsedMillis;
}
