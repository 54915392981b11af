package org.Aayush.tempus.task;

/**
 * Initial value of one ground fluent, from {@code (= (f a b) 4.5)} in {@code :init}.
 */
public record FluentAssignment(NumericExpression.FluentTerm fluent, double value) {
}
