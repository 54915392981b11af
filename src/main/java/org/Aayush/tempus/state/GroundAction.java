package org.Aayush.tempus.state;

import lombok.Builder;
import lombok.Value;
import org.Aayush.tempus.task.Atom;

import java.util.List;

/**
 * Fully instantiated action. Ids are dense indexes into the {@link GroundActionTable};
 * pending effects, happenings and plan steps refer to actions by id.
 */
@Value
@Builder
public class GroundAction {
    int id;
    String name;
    List<String> arguments;
    boolean durative;
    /** Lower duration bound; constant when it reads no changing fluent. */
    GroundExpression minDuration;
    /** Upper duration bound, null when unbounded. */
    GroundExpression maxDuration;
    GroundFormula conditionAtStart;
    GroundFormula conditionOverAll;
    GroundFormula conditionAtEnd;
    GroundEffects effectsAtStart;
    GroundEffects effectsAtEnd;

    /**
     * Evaluates the duration window against the fluent values of a state.
     */
    public DurationWindow durationIn(State state) {
        if (!durative) {
            return DurationWindow.INSTANT;
        }
        double min = state.evaluate(minDuration);
        double max = maxDuration == null ? Double.POSITIVE_INFINITY : state.evaluate(maxDuration);
        return new DurationWindow(min, max);
    }

    /**
     * Canonical text such as {@code (deliver robot1 package1 depot)}.
     */
    public String signature() {
        return Atom.signature(name, arguments);
    }

    @Override
    public String toString() {
        return signature();
    }
}
