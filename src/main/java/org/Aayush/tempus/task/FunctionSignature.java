package org.Aayush.tempus.task;

import java.util.List;

/**
 * Declared numeric fluent signature.
 */
public record FunctionSignature(String name, List<TypedParameter> parameters) {
    public FunctionSignature {
        parameters = List.copyOf(parameters);
    }

    public int arity() {
        return parameters.size();
    }
}
