package org.Aayush.tempus.task;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Lifted action with the five temporal condition/effect groups.
 *
 * <p>A plain {@code :action} is stored with {@code durative=false}, the instantaneous
 * duration, and its precondition and effect classified as "at start".</p>
 */
@Value
@Builder(toBuilder = true)
public class Action {
    String name;
    @Singular
    List<TypedParameter> parameters;
    boolean durative;
    DurationConstraint duration;
    @Singular("conditionAtStart")
    List<Formula> conditionsAtStart;
    @Singular("conditionOverAll")
    List<Formula> conditionsOverAll;
    @Singular("conditionAtEnd")
    List<Formula> conditionsAtEnd;
    @Singular("effectAtStart")
    List<Effect> effectsAtStart;
    @Singular("effectAtEnd")
    List<Effect> effectsAtEnd;

    /**
     * Instantiates this action for one parameter binding.
     *
     * @param binding parameter name to object name.
     * @return action with every variable substituted.
     */
    public Action substitute(Map<String, String> binding) {
        ActionBuilder builder = Action.builder()
                .name(name)
                .parameters(parameters)
                .durative(durative)
                .duration(duration.substitute(binding));
        conditionsAtStart.forEach(f -> builder.conditionAtStart(f.substitute(binding)));
        conditionsOverAll.forEach(f -> builder.conditionOverAll(f.substitute(binding)));
        conditionsAtEnd.forEach(f -> builder.conditionAtEnd(f.substitute(binding)));
        effectsAtStart.forEach(e -> builder.effectAtStart(e.substitute(binding)));
        effectsAtEnd.forEach(e -> builder.effectAtEnd(e.substitute(binding)));
        return builder.build();
    }

    public int arity() {
        return parameters.size();
    }
}
