package org.Aayush.tempus.heuristic;

import org.Aayush.tempus.state.GroundFormula;

/**
 * Heuristic provider contract used by the temporal search.
 *
 * <p>Providers are immutable and thread-safe. Binding returns an immutable goal-bound
 * estimator suitable for concurrent evaluation of successors.</p>
 */
public interface HeuristicProvider {

    /**
     * @return heuristic mode of this provider.
     */
    HeuristicType type();

    /**
     * Binds a goal condition and returns a reusable estimator.
     *
     * @param goal ground goal formula over the provider's fact table.
     * @return estimator bound to the goal.
     */
    StateHeuristic bindGoal(GroundFormula goal);
}
