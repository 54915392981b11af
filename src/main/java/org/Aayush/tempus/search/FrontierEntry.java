package org.Aayush.tempus.search;

/**
 * Deterministic frontier entry: lower f first, then lower h, then earlier insertion.
 */
record FrontierEntry(
        int nodeId,
        double f,
        double h,
        long sequence
) implements Comparable<FrontierEntry> {
    @Override
    public int compareTo(FrontierEntry other) {
        int byPriority = Double.compare(this.f, other.f);
        if (byPriority != 0) {
            return byPriority;
        }
        int byHeuristic = Double.compare(this.h, other.h);
        if (byHeuristic != 0) {
            return byHeuristic;
        }
        return Long.compare(this.sequence, other.sequence);
    }
}
