package org.Aayush.tempus.heuristic;

import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntList;
import org.Aayush.tempus.state.ActionCost;
import org.Aayush.tempus.state.DurationWindow;
import org.Aayush.tempus.state.GroundAction;
import org.Aayush.tempus.state.GroundActionTable;
import org.Aayush.tempus.state.GroundFormula;
import org.Aayush.tempus.state.PendingEffect;
import org.Aayush.tempus.state.State;

import java.util.Arrays;
import java.util.BitSet;

/**
 * Delete-relaxed planning graph with costed layers.
 *
 * <p>Facts true in the state cost 0. End effects of running actions are already paid for
 * and cost {@link #STEP_COST}. An action enters once its start condition is reachable; its
 * start effects appear after {@link #STEP_COST} and its end effects after its own cost. Layers
 * are expanded until no fact gets cheaper.</p>
 *
 * <p>Every action costs at least {@link #STEP_COST}, including instantaneous actions the search
 * charges nothing for. An estimate can therefore exceed the true remaining cost by up to the step
 * cost for each such action it counts.</p>
 *
 * <p>Immutable; every evaluation allocates its own buffers.</p>
 */
final class RelaxedPlanningGraph {
    /** Cost of a relaxed step that the cost model charges nothing for. */
    static final double STEP_COST = 0.001d;

    static final int SUPPORT_NONE = -3;
    static final int SUPPORT_PENDING = -2;
    static final int SUPPORT_STATE = -1;

    private static final double TOLERANCE = 1e-12;

    private final GroundActionTable actions;
    private final ActionCost actionCost;
    private final int factCount;

    RelaxedPlanningGraph(GroundActionTable actions, ActionCost actionCost, int factCount) {
        this.actions = actions;
        this.actionCost = actionCost;
        this.factCount = factCount;
    }

    /**
     * Fact costs and best supporters for one state.
     */
    static final class Layers {
        final double[] factCost;
        final int[] supporter;
        final double[] actionCost;

        Layers(double[] factCost, int[] supporter, double[] actionCost) {
            this.factCost = factCost;
            this.supporter = supporter;
            this.actionCost = actionCost;
        }
    }

    Layers expand(State state) {
        double[] factCost = new double[factCount];
        int[] supporter = new int[factCount];
        Arrays.fill(factCost, Double.POSITIVE_INFINITY);
        Arrays.fill(supporter, SUPPORT_NONE);
        state.forEachFact(fact -> {
            factCost[fact] = 0.0d;
            supporter[fact] = SUPPORT_STATE;
        });
        for (PendingEffect running : state.pending()) {
            IntList adds = actions.get(running.actionId()).getEffectsAtEnd().adds();
            for (int i = 0; i < adds.size(); i++) {
                int fact = adds.getInt(i);
                if (STEP_COST < factCost[fact]) {
                    factCost[fact] = STEP_COST;
                    supporter[fact] = SUPPORT_PENDING;
                }
            }
        }

        int actionCount = actions.size();
        double[] costs = new double[actionCount];
        for (int id = 0; id < actionCount; id++) {
            GroundAction action = actions.get(id);
            DurationWindow window = action.durationIn(state);
            double duration = Double.isNaN(window.min()) ? 0.0d : window.min();
            costs[id] = Math.max(actionCost.of(action, duration), STEP_COST);
        }

        boolean changed = true;
        for (int layer = 0; changed && layer <= factCount + 1; layer++) {
            changed = false;
            for (int id = 0; id < actionCount; id++) {
                GroundAction action = actions.get(id);
                double reached = action.getConditionAtStart().relaxedCost(factCost);
                if (reached == Double.POSITIVE_INFINITY) {
                    continue;
                }
                double startCost = reached + (action.isDurative() ? STEP_COST : costs[id]);
                changed |= lower(action.getEffectsAtStart().adds(), startCost, id, factCost, supporter);
                changed |= lower(action.getEffectsAtEnd().adds(), reached + costs[id], id, factCost, supporter);
            }
        }
        return new Layers(factCost, supporter, costs);
    }

    private static boolean lower(IntList adds, double cost, int actionId, double[] factCost, int[] supporter) {
        boolean changed = false;
        for (int i = 0; i < adds.size(); i++) {
            int fact = adds.getInt(i);
            if (cost < factCost[fact] - TOLERANCE) {
                factCost[fact] = cost;
                supporter[fact] = actionId;
                changed = true;
            }
        }
        return changed;
    }

    /**
     * Critical-path cost of a goal: the max over its cheapest supporting facts.
     */
    static double maxCost(Layers layers, GroundFormula goal) {
        return goal.relaxedCost(layers.factCost);
    }

    /**
     * Sum of the costs of the distinct actions in a relaxed plan for the goal, or infinity
     * when the goal is unreachable.
     */
    double relaxedPlanCost(Layers layers, GroundFormula goal) {
        if (goal.relaxedCost(layers.factCost) == Double.POSITIVE_INFINITY) {
            return Double.POSITIVE_INFINITY;
        }
        IntArrayFIFOQueue open = new IntArrayFIFOQueue();
        goal.collectSupport(layers.factCost, open::enqueue);
        BitSet seenFacts = new BitSet(factCount);
        BitSet planned = new BitSet(actions.size());
        double total = 0.0d;
        while (!open.isEmpty()) {
            int fact = open.dequeueInt();
            if (seenFacts.get(fact)) {
                continue;
            }
            seenFacts.set(fact);
            int support = layers.supporter[fact];
            if (support == SUPPORT_PENDING) {
                total += STEP_COST;
            } else if (support >= 0 && !planned.get(support)) {
                planned.set(support);
                total += layers.actionCost[support];
                actions.get(support).getConditionAtStart().collectSupport(layers.factCost, open::enqueue);
            }
        }
        return total;
    }
}
