package org.Aayush.tempus.task;

/**
 * Optional {@code :metric} of a problem. Stored for callers; the search optimizes its own
 * configured cost model.
 */
public record Metric(Direction direction, NumericExpression expression) {

    public enum Direction {
        MINIMIZE,
        MAXIMIZE
    }
}
