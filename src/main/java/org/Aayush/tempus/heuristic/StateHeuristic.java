package org.Aayush.tempus.heuristic;

import org.Aayush.tempus.state.State;
import org.Aayush.tempus.stn.TemporalNetwork;

/**
 * Goal-bound estimator of the remaining cost from a search state.
 *
 * <p>Implementations are thread-safe; concurrent calls must not share scratch buffers.</p>
 */
@FunctionalInterface
public interface StateHeuristic {

    /**
     * Estimates remaining cost to the bound goal.
     *
     * @param state state to evaluate.
     * @param network temporal network of the node owning the state.
     * @return non-negative estimate, 0 for goal states, {@link Double#POSITIVE_INFINITY} for dead ends.
     */
    double estimate(State state, TemporalNetwork network);
}
