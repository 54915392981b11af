package org.Aayush.tempus.state;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import org.Aayush.tempus.task.Effect;

import java.util.BitSet;
import java.util.List;

/**
 * Effects of one happening over dense ids.
 *
 * <p>Deletes are applied before adds, so an atom both added and deleted ends up true.
 * Numeric updates read the values from before the happening.</p>
 */
public final class GroundEffects {
    public static final GroundEffects NONE = new GroundEffects(new int[0], new int[0], List.of());

    private final int[] adds;
    private final int[] deletes;
    private final List<NumericEffect> numeric;

    public GroundEffects(int[] adds, int[] deletes, List<NumericEffect> numeric) {
        this.adds = adds.clone();
        this.deletes = deletes.clone();
        this.numeric = List.copyOf(numeric);
    }

    /**
     * Update of one fluent.
     */
    public record NumericEffect(Effect.NumericOperator operator, int fluentId, GroundExpression value) {
    }

    /**
     * Applies the effects in place.
     *
     * @param facts fact set to update.
     * @param fluents fluent values to update.
     * @param before fluent values before the happening; may be the same array when no numeric effect exists.
     * @param duration value bound to {@code ?duration}.
     */
    void applyTo(BitSet facts, double[] fluents, double[] before, double duration) {
        for (int fact : deletes) {
            facts.clear(fact);
        }
        for (int fact : adds) {
            facts.set(fact);
        }
        for (NumericEffect effect : numeric) {
            double operand = effect.value().evaluate(before, duration);
            fluents[effect.fluentId()] = effect.operator().apply(before[effect.fluentId()], operand);
        }
    }

    public IntList adds() {
        return IntLists.unmodifiable(IntArrayList.wrap(adds));
    }

    public IntList deletes() {
        return IntLists.unmodifiable(IntArrayList.wrap(deletes));
    }

    public List<NumericEffect> numeric() {
        return numeric;
    }

    public boolean isEmpty() {
        return adds.length == 0 && deletes.length == 0 && numeric.isEmpty();
    }

    public int size() {
        return adds.length + deletes.length + numeric.size();
    }
}
