package org.Aayush.tempus.stn;

import java.util.Objects;

/**
 * Outcome of {@link TemporalNetwork#extend}: the extended network, or the constraint that
 * closed a negative cycle.
 */
public final class Extension {
    private final TemporalNetwork network;
    private final TemporalConstraint conflict;

    private Extension(TemporalNetwork network, TemporalConstraint conflict) {
        this.network = network;
        this.conflict = conflict;
    }

    static Extension consistent(TemporalNetwork network) {
        return new Extension(Objects.requireNonNull(network, "network"), null);
    }

    static Extension inconsistent(TemporalConstraint conflict) {
        return new Extension(null, Objects.requireNonNull(conflict, "conflict"));
    }

    public boolean isConsistent() {
        return network != null;
    }

    /**
     * @return the extended network.
     * @throws IllegalStateException when the extension is inconsistent.
     */
    public TemporalNetwork network() {
        if (network == null) {
            throw new IllegalStateException("extension is inconsistent at " + conflict);
        }
        return network;
    }

    /**
     * @return the constraint whose insertion produced a negative cycle, or null when consistent.
     */
    public TemporalConstraint conflict() {
        return conflict;
    }

    @Override
    public String toString() {
        return isConsistent() ? "Extension[consistent, points=" + network.pointCount() + "]" : "Extension[inconsistent at " + conflict + "]";
    }
}
