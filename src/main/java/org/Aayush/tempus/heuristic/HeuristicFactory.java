package org.Aayush.tempus.heuristic;

import lombok.experimental.UtilityClass;
import org.Aayush.tempus.state.ActionCost;
import org.Aayush.tempus.state.TransitionModel;

/**
 * Strict heuristic factory.
 *
 * <p>Centralizes validation so all heuristic providers are created against the same
 * grounded model and cost function, with deterministic failure reason codes.</p>
 */
@UtilityClass
public final class HeuristicFactory {
    public static final String REASON_TYPE_REQUIRED = "H01_TYPE_REQUIRED";
    public static final String REASON_MODEL_REQUIRED = "H01_TRANSITION_MODEL_REQUIRED";
    public static final String REASON_COST_REQUIRED = "H01_ACTION_COST_REQUIRED";
    public static final String REASON_GOAL_FACT_UNKNOWN = "H02_GOAL_FACT_UNKNOWN";

    /**
     * Creates a heuristic provider.
     *
     * @param type requested heuristic type.
     * @param model grounded transition model.
     * @param actionCost cost charged per started action, shared with the search.
     * @return initialized heuristic provider.
     */
    public static HeuristicProvider create(HeuristicType type, TransitionModel model, ActionCost actionCost) {
        if (type == null) {
            throw new HeuristicConfigurationException(
                    REASON_TYPE_REQUIRED,
                    "heuristic type must be explicitly specified (NONE, TEMPORAL_MAX, TEMPORAL_FF)"
            );
        }
        if (model == null) {
            throw new HeuristicConfigurationException(
                    REASON_MODEL_REQUIRED,
                    "transition model must be provided"
            );
        }
        if (actionCost == null) {
            throw new HeuristicConfigurationException(
                    REASON_COST_REQUIRED,
                    "action cost function must be provided"
            );
        }

        return switch (type) {
            case NONE -> new NullHeuristicProvider();
            case TEMPORAL_MAX -> new TemporalMaxHeuristicProvider(model, graphOf(model, actionCost));
            case TEMPORAL_FF -> new TemporalRelaxedPlanHeuristicProvider(model, graphOf(model, actionCost));
        };
    }

    private static RelaxedPlanningGraph graphOf(TransitionModel model, ActionCost actionCost) {
        return new RelaxedPlanningGraph(model.actions(), actionCost, model.facts().factCount());
    }
}
