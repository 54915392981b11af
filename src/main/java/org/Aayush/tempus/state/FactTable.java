package org.Aayush.tempus.state;

import org.Aayush.tempus.core.id.IDMapper;
import org.Aayush.tempus.task.Atom;
import org.Aayush.tempus.task.NumericExpression;

import java.util.Objects;

/**
 * Dense ids of every ground fact and changing fluent of a grounded task.
 */
public final class FactTable {
    private final IDMapper facts;
    private final IDMapper fluents;

    public FactTable(IDMapper facts, IDMapper fluents) {
        this.facts = Objects.requireNonNull(facts, "facts");
        this.fluents = Objects.requireNonNull(fluents, "fluents");
    }

    public int factCount() {
        return facts.size();
    }

    public int fluentCount() {
        return fluents.size();
    }

    /**
     * @return fact id, or {@link IDMapper#NOT_FOUND} when the atom is outside the fact universe.
     */
    public int factId(Atom atom) {
        return facts.indexOf(atom.signature());
    }

    public int factId(String signature) {
        return facts.indexOf(signature);
    }

    /**
     * @return fluent id, or {@link IDMapper#NOT_FOUND} for static or unknown fluents.
     */
    public int fluentId(NumericExpression.FluentTerm fluent) {
        return fluents.indexOf(fluent.signature());
    }
}
