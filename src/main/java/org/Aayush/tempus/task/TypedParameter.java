package org.Aayush.tempus.task;

/**
 * One typed parameter of a predicate, function or action.
 *
 * @param name variable name including the leading {@code ?}.
 * @param type declared type name.
 */
public record TypedParameter(String name, String type) {
    @Override
    public String toString() {
        return name + " - " + type;
    }
}
