package org.Aayush.tempus.search;

import lombok.Value;
import org.Aayush.tempus.state.ScheduledAction;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Time-stamped sequence of ground actions, ordered by start time.
 */
@Value
public class Plan {
    List<PlanStep> steps;
    /** Latest finish time over all steps. */
    double makespan;
    /** Path cost under the cost model used by the search. */
    double cost;

    public Plan(List<PlanStep> steps, double makespan, double cost) {
        this.steps = List.copyOf(steps);
        this.makespan = makespan;
        this.cost = cost;
    }

    public int size() {
        return steps.size();
    }

    /**
     * Steps as absolute-time schedule entries, suitable for replay.
     */
    public List<ScheduledAction> schedule() {
        List<ScheduledAction> schedule = new ArrayList<>(steps.size());
        for (PlanStep step : steps) {
            schedule.add(new ScheduledAction(step.actionId(), step.start(), step.duration()));
        }
        return schedule;
    }

    /**
     * Conventional timed-plan text, one {@code start: (action args) [duration]} line per step.
     */
    public String format() {
        StringBuilder out = new StringBuilder();
        for (PlanStep step : steps) {
            out.append(String.format(Locale.ROOT, "%.3f: %s [%.3f]%n", step.start(), step.signature(), step.duration()));
        }
        return out.toString();
    }
}
