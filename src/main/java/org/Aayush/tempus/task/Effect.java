package org.Aayush.tempus.task;

import java.util.Map;

/**
 * Lifted effect: a literal add/delete or a numeric fluent update.
 */
public interface Effect {

    Effect substitute(Map<String, String> binding);

    /**
     * Adds ({@code positive}) or deletes an atom.
     */
    record Literal(Atom atom, boolean positive) implements Effect {
        @Override
        public Effect substitute(Map<String, String> binding) {
            return new Literal(atom.substitute(binding), positive);
        }

        @Override
        public String toString() {
            return positive ? atom.toString() : "(not " + atom + ")";
        }
    }

    /**
     * Numeric update operators.
     */
    enum NumericOperator {
        ASSIGN("assign"),
        INCREASE("increase"),
        DECREASE("decrease"),
        SCALE_UP("scale-up"),
        SCALE_DOWN("scale-down");

        private final String keyword;

        NumericOperator(String keyword) {
            this.keyword = keyword;
        }

        public String keyword() {
            return keyword;
        }

        public double apply(double current, double operand) {
            return switch (this) {
                case ASSIGN -> operand;
                case INCREASE -> current + operand;
                case DECREASE -> current - operand;
                case SCALE_UP -> current * operand;
                case SCALE_DOWN -> current / operand;
            };
        }

        public static NumericOperator fromKeyword(String keyword) {
            for (NumericOperator operator : values()) {
                if (operator.keyword.equals(keyword)) {
                    return operator;
                }
            }
            return null;
        }
    }

    record NumericUpdate(
            NumericOperator operator,
            NumericExpression.FluentTerm target,
            NumericExpression value
    ) implements Effect {
        @Override
        public Effect substitute(Map<String, String> binding) {
            return new NumericUpdate(operator, target.substitute(binding), value.substitute(binding));
        }

        @Override
        public String toString() {
            return "(" + operator.keyword() + " " + target + " " + value + ")";
        }
    }
}
