package org.Aayush.tempus.state;

import java.util.Arrays;
import java.util.BitSet;
import java.util.Collections;
import java.util.List;
import java.util.function.IntConsumer;

/**
 * Immutable search state: true facts, fluent values and the durative actions still running.
 *
 * <p>The state also records which time point holds the most recent happening and the next
 * free time point id, so the temporal network of the owning search node can be extended
 * consistently.</p>
 */
public final class State {
    private final BitSet facts;
    private final double[] fluents;
    /** Sorted by action id. */
    private final PendingEffect[] pending;
    private final int lastPoint;
    private final int nextPoint;
    private StateFingerprint fingerprint;

    State(BitSet facts, double[] fluents, PendingEffect[] pending, int lastPoint, int nextPoint) {
        this.facts = facts;
        this.fluents = fluents;
        this.pending = pending;
        this.lastPoint = lastPoint;
        this.nextPoint = nextPoint;
    }

    public boolean holds(int factId) {
        return facts.get(factId);
    }

    public boolean satisfies(GroundFormula formula) {
        return formula.holds(facts, fluents);
    }

    /**
     * Value of a fluent, NaN when undefined.
     */
    public double fluent(int fluentId) {
        return fluents[fluentId];
    }

    public double evaluate(GroundExpression expression) {
        return expression.evaluate(fluents, Double.NaN);
    }

    public void forEachFact(IntConsumer visitor) {
        for (int fact = facts.nextSetBit(0); fact >= 0; fact = facts.nextSetBit(fact + 1)) {
            visitor.accept(fact);
        }
    }

    public int factCount() {
        return facts.cardinality();
    }

    public BitSet factsCopy() {
        return (BitSet) facts.clone();
    }

    double[] fluentsView() {
        return fluents;
    }

    BitSet factsView() {
        return facts;
    }

    public List<PendingEffect> pending() {
        return Collections.unmodifiableList(Arrays.asList(pending));
    }

    PendingEffect[] pendingView() {
        return pending;
    }

    public boolean hasPending() {
        return pending.length > 0;
    }

    public boolean isRunning(int actionId) {
        return pendingFor(actionId) != null;
    }

    /**
     * Returns the running instance of an action, or null.
     */
    public PendingEffect pendingFor(int actionId) {
        for (PendingEffect entry : pending) {
            if (entry.actionId() == actionId) {
                return entry;
            }
        }
        return null;
    }

    /**
     * Time point of the most recent happening; the origin for the initial state.
     */
    public int lastPoint() {
        return lastPoint;
    }

    /**
     * First time point id not yet used along the path to this state.
     */
    public int nextPoint() {
        return nextPoint;
    }

    public StateFingerprint fingerprint() {
        StateFingerprint current = fingerprint;
        if (current == null) {
            int[] running = new int[pending.length];
            for (int i = 0; i < pending.length; i++) {
                running[i] = pending[i].actionId();
            }
            current = new StateFingerprint(facts, fluents, running);
            fingerprint = current;
        }
        return current;
    }

    @Override
    public String toString() {
        return "State{facts=" + facts + ", fluents=" + Arrays.toString(fluents) + ", pending=" + Arrays.toString(pending) + "}";
    }
}
