package org.Aayush.tempus.search;

import java.util.PriorityQueue;

/**
 * Priority frontier with insertion-order tie breaking.
 */
final class OpenList {
    private final PriorityQueue<FrontierEntry> queue = new PriorityQueue<>();
    private long nextSequence;
    private int peakSize;

    void push(int nodeId, double f, double h) {
        queue.add(new FrontierEntry(nodeId, f, h, nextSequence++));
        peakSize = Math.max(peakSize, queue.size());
    }

    /**
     * Removes and returns the best entry, or null when empty.
     */
    FrontierEntry poll() {
        return queue.poll();
    }

    boolean isEmpty() {
        return queue.isEmpty();
    }

    int size() {
        return queue.size();
    }

    int peakSize() {
        return peakSize;
    }
}
