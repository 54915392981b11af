package org.Aayush.tempus.task;

import java.util.Map;
import java.util.OptionalDouble;

/**
 * Duration window of an action as unevaluated bounds on {@code ?duration}.
 *
 * <p>{@code (= ?duration e)} stores the same expression as both bounds. A null bound is
 * unconstrained on that side. Expressions are evaluated when the action is grounded, or
 * when it starts if they read fluents that effects can change.</p>
 *
 * @param lower lower bound expression, or null.
 * @param upper upper bound expression, or null.
 */
public record DurationConstraint(NumericExpression lower, NumericExpression upper) {

    public static final DurationConstraint INSTANTANEOUS = fixed(new NumericExpression.Constant(0.0d));

    public static DurationConstraint fixed(NumericExpression value) {
        return new DurationConstraint(value, value);
    }

    /**
     * Returns whether both bounds are the same literal constant.
     */
    public boolean isConstant() {
        return constantValue().isPresent();
    }

    /**
     * Returns the literal duration when both bounds are the same constant.
     */
    public OptionalDouble constantValue() {
        if (lower instanceof NumericExpression.Constant lowerConstant
                && upper instanceof NumericExpression.Constant upperConstant
                && Double.compare(lowerConstant.value(), upperConstant.value()) == 0) {
            return OptionalDouble.of(lowerConstant.value());
        }
        return OptionalDouble.empty();
    }

    public boolean isFixed() {
        return lower != null && lower == upper;
    }

    public DurationConstraint substitute(Map<String, String> binding) {
        if (isFixed()) {
            return fixed(lower.substitute(binding));
        }
        return new DurationConstraint(
                lower == null ? null : lower.substitute(binding),
                upper == null ? null : upper.substitute(binding)
        );
    }
}
