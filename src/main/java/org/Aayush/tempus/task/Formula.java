package org.Aayush.tempus.task;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Lifted condition tree: {@code and}, {@code or}, {@code not}, atoms and numeric comparisons.
 *
 * <p>Formulas are immutable and shared by reference between actions and groups.</p>
 */
public interface Formula {

    Formula TRUE = new And(List.of());

    Formula substitute(Map<String, String> binding);

    /**
     * Numeric comparison operators.
     */
    enum Comparator {
        LESS("<"),
        LESS_OR_EQUAL("<="),
        EQUAL("="),
        GREATER_OR_EQUAL(">="),
        GREATER(">");

        private static final double TOLERANCE = 1e-9;

        private final String symbol;

        Comparator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        public boolean test(double left, double right) {
            if (Double.isNaN(left) || Double.isNaN(right)) {
                return false;
            }
            return switch (this) {
                case LESS -> left < right - TOLERANCE;
                case LESS_OR_EQUAL -> left <= right + TOLERANCE;
                case EQUAL -> Math.abs(left - right) <= TOLERANCE;
                case GREATER_OR_EQUAL -> left >= right - TOLERANCE;
                case GREATER -> left > right + TOLERANCE;
            };
        }

        public static Comparator fromSymbol(String symbol) {
            for (Comparator comparator : values()) {
                if (comparator.symbol.equals(symbol)) {
                    return comparator;
                }
            }
            return null;
        }
    }

    record AtomFormula(Atom atom) implements Formula {
        @Override
        public Formula substitute(Map<String, String> binding) {
            return new AtomFormula(atom.substitute(binding));
        }

        @Override
        public String toString() {
            return atom.toString();
        }
    }

    record Not(Formula operand) implements Formula {
        @Override
        public Formula substitute(Map<String, String> binding) {
            return new Not(operand.substitute(binding));
        }

        @Override
        public String toString() {
            return "(not " + operand + ")";
        }
    }

    record And(List<Formula> operands) implements Formula {
        public And {
            operands = List.copyOf(operands);
        }

        @Override
        public Formula substitute(Map<String, String> binding) {
            return new And(substituteAll(operands, binding));
        }

        @Override
        public String toString() {
            return join("and", operands);
        }
    }

    record Or(List<Formula> operands) implements Formula {
        public Or {
            operands = List.copyOf(operands);
        }

        @Override
        public Formula substitute(Map<String, String> binding) {
            return new Or(substituteAll(operands, binding));
        }

        @Override
        public String toString() {
            return join("or", operands);
        }
    }

    record Comparison(Comparator comparator, NumericExpression left, NumericExpression right) implements Formula {
        @Override
        public Formula substitute(Map<String, String> binding) {
            return new Comparison(comparator, left.substitute(binding), right.substitute(binding));
        }

        @Override
        public String toString() {
            return "(" + comparator.symbol() + " " + left + " " + right + ")";
        }
    }

    private static List<Formula> substituteAll(List<Formula> formulas, Map<String, String> binding) {
        List<Formula> result = new ArrayList<>(formulas.size());
        for (Formula formula : formulas) {
            result.add(formula.substitute(binding));
        }
        return result;
    }

    private static String join(String head, List<Formula> operands) {
        StringBuilder builder = new StringBuilder("(").append(head);
        for (Formula operand : operands) {
            builder.append(' ').append(operand);
        }
        return builder.append(')').toString();
    }
}
