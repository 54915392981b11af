package org.Aayush.tempus.heuristic;

import org.Aayush.tempus.state.GroundFormula;
import org.Aayush.tempus.state.TransitionModel;

/**
 * Critical-path heuristic over the costed relaxed planning graph.
 *
 * <p>Each goal fact costs its cheapest achievement; the estimate is the most expensive of
 * them, so parallelizable work is not double counted.</p>
 */
public final class TemporalMaxHeuristicProvider extends RelaxedHeuristicProvider {

    TemporalMaxHeuristicProvider(TransitionModel model, RelaxedPlanningGraph graph) {
        super(model, graph);
    }

    @Override
    public HeuristicType type() {
        return HeuristicType.TEMPORAL_MAX;
    }

    @Override
    double relaxedEstimate(RelaxedPlanningGraph.Layers layers, GroundFormula goal) {
        return RelaxedPlanningGraph.maxCost(layers, goal);
    }
}
