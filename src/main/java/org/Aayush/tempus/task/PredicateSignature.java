package org.Aayush.tempus.task;

import java.util.List;

/**
 * Declared predicate name with its typed parameter list.
 */
public record PredicateSignature(String name, List<TypedParameter> parameters) {
    public PredicateSignature {
        parameters = List.copyOf(parameters);
    }

    public int arity() {
        return parameters.size();
    }
}
