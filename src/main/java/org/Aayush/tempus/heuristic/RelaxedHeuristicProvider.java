package org.Aayush.tempus.heuristic;

import org.Aayush.tempus.state.GroundFormula;
import org.Aayush.tempus.state.State;
import org.Aayush.tempus.state.TransitionModel;
import org.Aayush.tempus.stn.TemporalNetwork;

import java.util.Objects;

/**
 * Shared binding logic for heuristics computed on the relaxed planning graph.
 *
 * <p>Goal states estimate 0. Any other state estimates at least
 * {@link RelaxedPlanningGraph#STEP_COST}, and a goal unreachable in the relaxation gives
 * {@link Double#POSITIVE_INFINITY}.</p>
 */
abstract class RelaxedHeuristicProvider implements HeuristicProvider {
    private final TransitionModel model;
    private final RelaxedPlanningGraph graph;

    RelaxedHeuristicProvider(TransitionModel model, RelaxedPlanningGraph graph) {
        this.model = Objects.requireNonNull(model, "model");
        this.graph = Objects.requireNonNull(graph, "graph");
    }

    RelaxedPlanningGraph graph() {
        return graph;
    }

    abstract double relaxedEstimate(RelaxedPlanningGraph.Layers layers, GroundFormula goal);

    @Override
    public StateHeuristic bindGoal(GroundFormula goal) {
        Objects.requireNonNull(goal, "goal");
        int factCount = model.facts().factCount();
        goal.forEachFact(fact -> {
            if (fact < 0 || fact >= factCount) {
                throw new HeuristicConfigurationException(
                        HeuristicFactory.REASON_GOAL_FACT_UNKNOWN,
                        "goal references fact id " + fact + " outside [0, " + factCount + ")"
                );
            }
        });
        return new BoundRelaxedHeuristic(goal);
    }

    private final class BoundRelaxedHeuristic implements StateHeuristic {
        private final GroundFormula goal;

        private BoundRelaxedHeuristic(GroundFormula goal) {
            this.goal = goal;
        }

        @Override
        public double estimate(State state, TemporalNetwork network) {
            if (!state.hasPending() && state.satisfies(goal)) {
                return 0.0d;
            }
            double estimate = relaxedEstimate(graph.expand(state), goal);
            if (estimate == Double.POSITIVE_INFINITY) {
                return estimate;
            }
            return Math.max(estimate, RelaxedPlanningGraph.STEP_COST);
        }
    }
}
