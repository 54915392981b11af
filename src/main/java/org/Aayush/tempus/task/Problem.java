package org.Aayush.tempus.task;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Parsed problem instance. Symbols are validated against the domain it names.
 */
@Value
@Builder
public class Problem {
    String name;
    String domainName;
    @Singular
    List<PddlObject> objects;
    @Singular
    List<Atom> initialFacts;
    @Singular
    List<FluentAssignment> initialFluents;
    Formula goal;
    Metric metric;

    /**
     * Merges this problem with its domain into a planning task.
     */
    public Task toTask(Domain domain) {
        Task.TaskBuilder builder = Task.builder()
                .domainName(domain.getName())
                .problemName(name)
                .requirements(domain.getRequirements())
                .types(domain.getTypes())
                .predicates(domain.getPredicates())
                .functions(domain.getFunctions())
                .objects(domain.getConstants())
                .objects(objects)
                .actions(domain.getActions())
                .initialFacts(initialFacts)
                .initialFluents(initialFluents)
                .goal(goal)
                .metric(metric);
        return builder.build();
    }
}
