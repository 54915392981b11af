package org.Aayush.tempus.state;

import java.util.Arrays;
import java.util.BitSet;

/**
 * Search-deduplication key: facts, fluent values and the ids of running actions.
 * Timing is deliberately not part of it.
 */
public final class StateFingerprint {
    private final BitSet facts;
    private final double[] fluents;
    private final int[] running;
    private final int hash;

    StateFingerprint(BitSet facts, double[] fluents, int[] running) {
        this.facts = facts;
        this.fluents = fluents;
        this.running = running;
        this.hash = 31 * (31 * facts.hashCode() + Arrays.hashCode(fluents)) + Arrays.hashCode(running);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof StateFingerprint that)) {
            return false;
        }
        return hash == that.hash
                && facts.equals(that.facts)
                && Arrays.equals(fluents, that.fluents)
                && Arrays.equals(running, that.running);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return "StateFingerprint{facts=" + facts + ", fluents=" + Arrays.toString(fluents) + ", running=" + Arrays.toString(running) + "}";
    }
}
