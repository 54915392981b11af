package org.Aayush.tempus.state;

import org.Aayush.tempus.task.Formula;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.function.IntConsumer;

/**
 * Condition over dense fact and fluent ids.
 *
 * <p>Besides exact evaluation, formulas answer delete-relaxed queries: the cost of making
 * them true given a cost per fact, and the facts that support the cheapest way of doing so.
 * Negative literals and numeric comparisons are assumed free in the relaxation.</p>
 */
public interface GroundFormula {

    GroundFormula TRUE = new Constant(true);
    GroundFormula FALSE = new Constant(false);

    boolean holds(BitSet facts, double[] fluents);

    /**
     * Delete-relaxed cost: conjunction takes the max, disjunction the min.
     *
     * @param factCost cost of each fact, {@link Double#POSITIVE_INFINITY} when unreached.
     */
    double relaxedCost(double[] factCost);

    /**
     * Emits the positive facts along the cheapest relaxed support of this formula.
     */
    void collectSupport(double[] factCost, IntConsumer sink);

    /**
     * Emits every positive fact this formula mentions.
     */
    void forEachFact(IntConsumer sink);

    record Constant(boolean value) implements GroundFormula {
        @Override
        public boolean holds(BitSet facts, double[] fluents) {
            return value;
        }

        @Override
        public double relaxedCost(double[] factCost) {
            return value ? 0.0d : Double.POSITIVE_INFINITY;
        }

        @Override
        public void collectSupport(double[] factCost, IntConsumer sink) {
        }

        @Override
        public void forEachFact(IntConsumer sink) {
        }
    }

    record Fact(int factId) implements GroundFormula {
        @Override
        public boolean holds(BitSet facts, double[] fluents) {
            return facts.get(factId);
        }

        @Override
        public double relaxedCost(double[] factCost) {
            return factCost[factId];
        }

        @Override
        public void collectSupport(double[] factCost, IntConsumer sink) {
            sink.accept(factId);
        }

        @Override
        public void forEachFact(IntConsumer sink) {
            sink.accept(factId);
        }
    }

    record Not(GroundFormula operand) implements GroundFormula {
        @Override
        public boolean holds(BitSet facts, double[] fluents) {
            return !operand.holds(facts, fluents);
        }

        @Override
        public double relaxedCost(double[] factCost) {
            return 0.0d;
        }

        @Override
        public void collectSupport(double[] factCost, IntConsumer sink) {
        }

        @Override
        public void forEachFact(IntConsumer sink) {
        }
    }

    record And(List<GroundFormula> operands) implements GroundFormula {
        public And {
            operands = List.copyOf(operands);
        }

        @Override
        public boolean holds(BitSet facts, double[] fluents) {
            for (GroundFormula operand : operands) {
                if (!operand.holds(facts, fluents)) {
                    return false;
                }
            }
            return true;
        }

        @Override
        public double relaxedCost(double[] factCost) {
            double cost = 0.0d;
            for (GroundFormula operand : operands) {
                cost = Math.max(cost, operand.relaxedCost(factCost));
                if (cost == Double.POSITIVE_INFINITY) {
                    break;
                }
            }
            return cost;
        }

        @Override
        public void collectSupport(double[] factCost, IntConsumer sink) {
            for (GroundFormula operand : operands) {
                operand.collectSupport(factCost, sink);
            }
        }

        @Override
        public void forEachFact(IntConsumer sink) {
            for (GroundFormula operand : operands) {
                operand.forEachFact(sink);
            }
        }
    }

    record Or(List<GroundFormula> operands) implements GroundFormula {
        public Or {
            operands = List.copyOf(operands);
        }

        @Override
        public boolean holds(BitSet facts, double[] fluents) {
            for (GroundFormula operand : operands) {
                if (operand.holds(facts, fluents)) {
                    return true;
                }
            }
            return false;
        }

        @Override
        public double relaxedCost(double[] factCost) {
            double cost = Double.POSITIVE_INFINITY;
            for (GroundFormula operand : operands) {
                cost = Math.min(cost, operand.relaxedCost(factCost));
            }
            return cost;
        }

        @Override
        public void collectSupport(double[] factCost, IntConsumer sink) {
            GroundFormula cheapest = null;
            double best = Double.POSITIVE_INFINITY;
            for (GroundFormula operand : operands) {
                double cost = operand.relaxedCost(factCost);
                if (cost < best) {
                    best = cost;
                    cheapest = operand;
                }
            }
            if (cheapest != null) {
                cheapest.collectSupport(factCost, sink);
            }
        }

        @Override
        public void forEachFact(IntConsumer sink) {
            for (GroundFormula operand : operands) {
                operand.forEachFact(sink);
            }
        }
    }

    record Comparison(Formula.Comparator comparator, GroundExpression left, GroundExpression right) implements GroundFormula {
        @Override
        public boolean holds(BitSet facts, double[] fluents) {
            return comparator.test(left.evaluate(fluents, Double.NaN), right.evaluate(fluents, Double.NaN));
        }

        @Override
        public double relaxedCost(double[] factCost) {
            return 0.0d;
        }

        @Override
        public void collectSupport(double[] factCost, IntConsumer sink) {
        }

        @Override
        public void forEachFact(IntConsumer sink) {
        }
    }

    /**
     * Conjunction that drops {@code true} operands and collapses on {@code false}.
     */
    static GroundFormula and(List<GroundFormula> operands) {
        List<GroundFormula> kept = new ArrayList<>(operands.size());
        for (GroundFormula operand : operands) {
            if (operand instanceof Constant constant && !constant.value()) {
                return FALSE;
            }
            if (!(operand instanceof Constant)) {
                kept.add(operand);
            }
        }
        if (kept.isEmpty()) {
            return TRUE;
        }
        return kept.size() == 1 ? kept.get(0) : new And(kept);
    }

    /**
     * Disjunction that drops {@code false} operands and collapses on {@code true}.
     */
    static GroundFormula or(List<GroundFormula> operands) {
        List<GroundFormula> kept = new ArrayList<>(operands.size());
        for (GroundFormula operand : operands) {
            if (operand instanceof Constant constant) {
                if (constant.value()) {
                    return TRUE;
                }
                continue;
            }
            kept.add(operand);
        }
        if (kept.isEmpty()) {
            return FALSE;
        }
        return kept.size() == 1 ? kept.get(0) : new Or(kept);
    }

    static GroundFormula not(GroundFormula operand) {
        if (operand instanceof Constant constant) {
            return constant.value() ? FALSE : TRUE;
        }
        return new Not(operand);
    }
}
