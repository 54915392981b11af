package org.Aayush.tempus.pddl;

import java.util.List;

/**
 * Node of the parenthesized-list tree: either an atom or a list of children.
 *
 * @param atom lower-cased token text for atoms, null for lists.
 * @param children list elements, empty for atoms.
 * @param line 1-based line where the node starts.
 */
record SExpression(String atom, List<SExpression> children, int line) {

    static SExpression atom(String text, int line) {
        return new SExpression(text, List.of(), line);
    }

    static SExpression list(List<SExpression> children, int line) {
        return new SExpression(null, List.copyOf(children), line);
    }

    boolean isAtom() {
        return atom != null;
    }

    boolean isList() {
        return atom == null;
    }

    int size() {
        return children.size();
    }

    SExpression get(int index) {
        return children.get(index);
    }

    /**
     * Returns the atom text of the first element, or null if the list is empty or starts with a list.
     */
    String head() {
        if (atom != null || children.isEmpty() || !children.get(0).isAtom()) {
            return null;
        }
        return children.get(0).atom();
    }

    boolean isAtom(String text) {
        return text.equals(atom);
    }

    @Override
    public String toString() {
        if (atom != null) {
            return atom;
        }
        StringBuilder builder = new StringBuilder("(");
        for (int i = 0; i < children.size(); i++) {
            if (i > 0) {
                builder.append(' ');
            }
            builder.append(children.get(i));
        }
        return builder.append(')').toString();
    }
}
