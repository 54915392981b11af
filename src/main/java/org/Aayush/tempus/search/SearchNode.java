package org.Aayush.tempus.search;

import org.Aayush.tempus.state.Happening;
import org.Aayush.tempus.state.State;
import org.Aayush.tempus.stn.TemporalNetwork;

/**
 * One reached state with the temporal network of the path leading to it.
 *
 * @param parentId node id of the parent, {@link #NO_PARENT} for the root.
 * @param happening happening applied to the parent, null for the root.
 */
record SearchNode(
        State state,
        TemporalNetwork network,
        double g,
        double h,
        int parentId,
        Happening happening,
        int depth
) {
    static final int NO_PARENT = -1;

    static SearchNode root(State state, TemporalNetwork network, double h) {
        return new SearchNode(state, network, 0.0d, h, NO_PARENT, null, 0);
    }

    boolean isRoot() {
        return parentId == NO_PARENT;
    }
}
