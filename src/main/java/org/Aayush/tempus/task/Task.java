package org.Aayush.tempus.task;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable planning task: the parsed domain merged with one problem instance.
 *
 * <p>Created once by the parser and shared read-only by grounding, heuristics and every
 * search node (including worker threads).</p>
 */
@Value
@Builder
public class Task {
    String domainName;
    String problemName;
    @Singular
    Set<String> requirements;
    TypeHierarchy types;
    /** Predicates by name, in declaration order. */
    Map<String, PredicateSignature> predicates;
    /** Functions by name, in declaration order. */
    Map<String, FunctionSignature> functions;
    /** Domain constants followed by problem objects. */
    @Singular
    List<PddlObject> objects;
    @Singular
    List<Action> actions;
    @Singular
    List<Atom> initialFacts;
    @Singular
    List<FluentAssignment> initialFluents;
    Formula goal;
    Metric metric;

    public Optional<Action> action(String name) {
        for (Action action : actions) {
            if (action.getName().equals(name)) {
                return Optional.of(action);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns objects whose type equals or specializes {@code type}, in declaration order.
     */
    public List<PddlObject> objectsOfType(String type) {
        List<PddlObject> matching = new ArrayList<>();
        for (PddlObject object : objects) {
            if (types.isSubtypeOf(object.type(), type)) {
                matching.add(object);
            }
        }
        return matching;
    }

    public Optional<Metric> metric() {
        return Optional.ofNullable(metric);
    }
}
