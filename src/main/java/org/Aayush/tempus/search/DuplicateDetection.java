package org.Aayush.tempus.search;

import org.Aayush.tempus.state.PendingEffect;
import org.Aayush.tempus.state.State;
import org.Aayush.tempus.state.StateFingerprint;
import org.Aayush.tempus.stn.TemporalNetwork;

import java.util.ArrayList;
import java.util.List;

/**
 * Which search nodes count as the same state for pruning.
 *
 * <p>Fingerprint-only detection treats two nodes with equal facts, fluents and running actions
 * as equal even when their temporal networks differ, so it can drop a node whose schedule
 * would have been the only feasible one. {@link #STATE_AND_SCHEDULE} keeps those apart at the
 * cost of a larger closed set.</p>
 */
public enum DuplicateDetection {
    /** Facts, fluents and running action ids. */
    STATE_FINGERPRINT,
    /** Fingerprint plus the elapsed time of each running action at the last happening. */
    STATE_AND_SCHEDULE,
    /** No pruning; only a budget bounds the search. */
    NONE;

    /**
     * Closed-set key of a node, or null when nothing is deduplicated.
     */
    Object keyOf(State state, TemporalNetwork network) {
        switch (this) {
            case STATE_FINGERPRINT:
                return state.fingerprint();
            case STATE_AND_SCHEDULE:
                double now = network.earliest(state.lastPoint());
                List<Double> elapsed = new ArrayList<>(state.pending().size());
                for (PendingEffect running : state.pending()) {
                    elapsed.add(now - network.earliest(running.startPoint()));
                }
                return new ScheduleKey(state.fingerprint(), elapsed);
            default:
                return null;
        }
    }

    private record ScheduleKey(StateFingerprint fingerprint, List<Double> elapsed) {
    }
}
