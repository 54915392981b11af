package org.Aayush.tempus.heuristic;

import org.Aayush.tempus.state.GroundFormula;
import org.Aayush.tempus.state.TransitionModel;

/**
 * Relaxed-plan heuristic: extracts supporters backwards from the goal and sums the cost of
 * each distinct action used.
 */
public final class TemporalRelaxedPlanHeuristicProvider extends RelaxedHeuristicProvider {

    TemporalRelaxedPlanHeuristicProvider(TransitionModel model, RelaxedPlanningGraph graph) {
        super(model, graph);
    }

    @Override
    public HeuristicType type() {
        return HeuristicType.TEMPORAL_FF;
    }

    @Override
    double relaxedEstimate(RelaxedPlanningGraph.Layers layers, GroundFormula goal) {
        return graph().relaxedPlanCost(layers, goal);
    }
}
