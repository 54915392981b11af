package org.Aayush.tempus.state;

/**
 * A started durative action whose end happening has not been applied yet.
 *
 * @param actionId ground action id.
 * @param startPoint time point of the start happening.
 * @param endPoint time point reserved for the end happening.
 * @param duration duration bound to {@code ?duration} in the end effects.
 */
public record PendingEffect(int actionId, int startPoint, int endPoint, double duration) {
}
