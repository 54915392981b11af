package org.Aayush.tempus.search;

import org.Aayush.tempus.task.Atom;

import java.util.List;

/**
 * One scheduled action of a plan.
 *
 * @param actionId ground action id in the model that produced the plan.
 * @param start earliest feasible start time.
 * @param duration committed duration, 0 for instantaneous actions.
 */
public record PlanStep(int actionId, String name, List<String> arguments, double start, double duration) {

    public PlanStep {
        arguments = List.copyOf(arguments);
    }

    public double end() {
        return start + duration;
    }

    /**
     * Canonical text such as {@code (pick-up robot1 package1 depot)}.
     */
    public String signature() {
        return Atom.signature(name, arguments);
    }
}
