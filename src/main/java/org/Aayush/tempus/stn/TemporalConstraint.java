package org.Aayush.tempus.stn;

/**
 * Interval bound {@code lower <= time(to) - time(from) <= upper}.
 *
 * <p>Use {@link Double#NEGATIVE_INFINITY} / {@link Double#POSITIVE_INFINITY} for an open side.</p>
 */
public record TemporalConstraint(int from, int to, double lower, double upper) {
    public static final double UNBOUNDED = Double.POSITIVE_INFINITY;

    public TemporalConstraint {
        if (from < 0 || to < 0) {
            throw new IllegalArgumentException("time points must be non-negative: " + from + " -> " + to);
        }
        if (Double.isNaN(lower) || Double.isNaN(upper)) {
            throw new IllegalArgumentException("bounds must not be NaN");
        }
    }

    /**
     * {@code time(to) - time(from) >= minimumGap}, unbounded above.
     */
    public static TemporalConstraint after(int from, int to, double minimumGap) {
        return new TemporalConstraint(from, to, minimumGap, UNBOUNDED);
    }

    /**
     * {@code time(to) - time(from)} within {@code [lower, upper]}.
     */
    public static TemporalConstraint between(int from, int to, double lower, double upper) {
        return new TemporalConstraint(from, to, lower, upper);
    }

    @Override
    public String toString() {
        return "t" + to + " - t" + from + " in [" + lower + ", " + upper + "]";
    }
}
