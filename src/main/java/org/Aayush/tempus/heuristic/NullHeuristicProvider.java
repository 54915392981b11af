package org.Aayush.tempus.heuristic;

import org.Aayush.tempus.state.GroundFormula;

import java.util.Objects;

/**
 * Null heuristic provider.
 *
 * <p>Always returns zero estimates and therefore turns A* into uniform-cost search.</p>
 */
public final class NullHeuristicProvider implements HeuristicProvider {
    private static final StateHeuristic ZERO = (state, network) -> 0.0d;

    @Override
    public HeuristicType type() {
        return HeuristicType.NONE;
    }

    @Override
    public StateHeuristic bindGoal(GroundFormula goal) {
        Objects.requireNonNull(goal, "goal");
        return ZERO;
    }
}
