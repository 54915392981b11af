package org.Aayush.tempus.task;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Parsed domain definition, independent of any problem instance.
 */
@Value
@Builder
public class Domain {
    String name;
    @Singular
    Set<String> requirements;
    TypeHierarchy types;
    Map<String, PredicateSignature> predicates;
    Map<String, FunctionSignature> functions;
    @Singular
    List<PddlObject> constants;
    @Singular
    List<Action> actions;
}
