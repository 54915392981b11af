package org.Aayush.tempus.state;

import org.Aayush.tempus.task.NumericExpression;

/**
 * Numeric expression over dense fluent ids. An undefined fluent evaluates to NaN, which
 * propagates through arithmetic and fails every comparison.
 */
public interface GroundExpression {

    /**
     * Evaluates against fluent values.
     *
     * @param fluents fluent values indexed by fluent id.
     * @param duration value of {@code ?duration}, NaN outside durative actions.
     */
    double evaluate(double[] fluents, double duration);

    record Constant(double value) implements GroundExpression {
        @Override
        public double evaluate(double[] fluents, double duration) {
            return value;
        }

        @Override
        public String toString() {
            return Double.toString(value);
        }
    }

    record Fluent(int fluentId) implements GroundExpression {
        @Override
        public double evaluate(double[] fluents, double duration) {
            return fluents[fluentId];
        }

        @Override
        public String toString() {
            return "f" + fluentId;
        }
    }

    record Binary(NumericExpression.Operator operator, GroundExpression left, GroundExpression right) implements GroundExpression {
        @Override
        public double evaluate(double[] fluents, double duration) {
            return operator.apply(left.evaluate(fluents, duration), right.evaluate(fluents, duration));
        }
    }

    record Negation(GroundExpression operand) implements GroundExpression {
        @Override
        public double evaluate(double[] fluents, double duration) {
            return -operand.evaluate(fluents, duration);
        }
    }

    record Duration() implements GroundExpression {
        @Override
        public double evaluate(double[] fluents, double duration) {
            return duration;
        }
    }
}
