package org.Aayush.tempus.task;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Predicate application. Arguments starting with {@code ?} are variables, anything else is
 * an object name.
 */
public record Atom(String predicate, List<String> arguments) {
    public Atom {
        arguments = List.copyOf(arguments);
    }

    public boolean isGround() {
        for (String argument : arguments) {
            if (isVariable(argument)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Substitutes bound variables; unbound variables are kept as-is.
     */
    public Atom substitute(Map<String, String> binding) {
        List<String> grounded = new ArrayList<>(arguments.size());
        for (String argument : arguments) {
            grounded.add(binding.getOrDefault(argument, argument));
        }
        return new Atom(predicate, grounded);
    }

    /**
     * Canonical signature used as interning key, e.g. {@code (at robot1 depot)}.
     */
    public String signature() {
        return signature(predicate, arguments);
    }

    public static String signature(String head, List<String> arguments) {
        StringBuilder builder = new StringBuilder(head.length() + 8 * arguments.size() + 2);
        builder.append('(').append(head);
        for (String argument : arguments) {
            builder.append(' ').append(argument);
        }
        return builder.append(')').toString();
    }

    public static boolean isVariable(String term) {
        return term.startsWith("?");
    }

    @Override
    public String toString() {
        return signature();
    }
}
