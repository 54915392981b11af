package org.Aayush.tempus.task;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Lifted numeric expression over fluents, constants and {@code ?duration}.
 */
public interface NumericExpression {

    /**
     * Substitutes action parameters inside fluent terms.
     */
    NumericExpression substitute(Map<String, String> binding);

    /**
     * Binary arithmetic operators.
     */
    enum Operator {
        ADD("+"),
        SUBTRACT("-"),
        MULTIPLY("*"),
        DIVIDE("/");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        public double apply(double left, double right) {
            return switch (this) {
                case ADD -> left + right;
                case SUBTRACT -> left - right;
                case MULTIPLY -> left * right;
                case DIVIDE -> left / right;
            };
        }

        public static Operator fromSymbol(String symbol) {
            for (Operator operator : values()) {
                if (operator.symbol.equals(symbol)) {
                    return operator;
                }
            }
            return null;
        }
    }

    record Constant(double value) implements NumericExpression {
        @Override
        public NumericExpression substitute(Map<String, String> binding) {
            return this;
        }

        @Override
        public String toString() {
            return Double.toString(value);
        }
    }

    /**
     * Reference to a numeric fluent such as {@code (processing-time ?i)}.
     */
    record FluentTerm(String function, List<String> arguments) implements NumericExpression {
        public FluentTerm {
            arguments = List.copyOf(arguments);
        }

        @Override
        public FluentTerm substitute(Map<String, String> binding) {
            List<String> grounded = new ArrayList<>(arguments.size());
            for (String argument : arguments) {
                grounded.add(binding.getOrDefault(argument, argument));
            }
            return new FluentTerm(function, grounded);
        }

        public String signature() {
            return Atom.signature(function, arguments);
        }

        @Override
        public String toString() {
            return signature();
        }
    }

    record Binary(Operator operator, NumericExpression left, NumericExpression right) implements NumericExpression {
        @Override
        public NumericExpression substitute(Map<String, String> binding) {
            return new Binary(operator, left.substitute(binding), right.substitute(binding));
        }

        @Override
        public String toString() {
            return "(" + operator.symbol() + " " + left + " " + right + ")";
        }
    }

    record Negation(NumericExpression operand) implements NumericExpression {
        @Override
        public NumericExpression substitute(Map<String, String> binding) {
            return new Negation(operand.substitute(binding));
        }

        @Override
        public String toString() {
            return "(- " + operand + ")";
        }
    }

    /**
     * The {@code ?duration} variable inside durative-action conditions and effects.
     */
    record DurationVariable() implements NumericExpression {
        @Override
        public NumericExpression substitute(Map<String, String> binding) {
            return this;
        }

        @Override
        public String toString() {
            return "?duration";
        }
    }
}
