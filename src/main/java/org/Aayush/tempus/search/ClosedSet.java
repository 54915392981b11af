package org.Aayush.tempus.search;

import it.unimi.dsi.fastutil.objects.Object2DoubleOpenHashMap;

/**
 * Best rank seen per duplicate-detection key.
 *
 * <p>A null key is never a duplicate.</p>
 */
final class ClosedSet {
    private static final double TOLERANCE = 1e-9;

    private final Object2DoubleOpenHashMap<Object> bestRank = new Object2DoubleOpenHashMap<>();

    ClosedSet() {
        bestRank.defaultReturnValue(Double.POSITIVE_INFINITY);
    }

    /**
     * Records a rank for a key if it improves on the best one seen.
     *
     * @return false when an equal or better node was already recorded.
     */
    boolean admit(Object key, double rank) {
        if (key == null) {
            return true;
        }
        if (rank >= bestRank.getDouble(key) - TOLERANCE) {
            return false;
        }
        bestRank.put(key, rank);
        return true;
    }

    /**
     * Returns whether a popped node has since been superseded by a cheaper one.
     */
    boolean isStale(Object key, double rank) {
        return key != null && rank > bestRank.getDouble(key) + TOLERANCE;
    }

    int size() {
        return bestRank.size();
    }
}
