package org.Aayush.tempus.state;

/**
 * Evaluated duration bounds of a ground action at the moment it starts.
 */
public record DurationWindow(double min, double max) {
    public static final DurationWindow INSTANT = new DurationWindow(0.0d, 0.0d);

    /**
     * Returns whether an action with this window may start.
     *
     * @param durative true for durative actions, which need a positive upper bound.
     */
    public boolean isValid(boolean durative) {
        if (Double.isNaN(min) || Double.isNaN(max) || min < 0.0d || min > max) {
            return false;
        }
        return !durative || max > 0.0d;
    }
}
