package org.Aayush.tempus.state;

/**
 * Result of applying a happening: the successor state and the timing it requires.
 *
 * @param duration duration committed by a start, 0 for ends and instantaneous actions.
 */
public record Transition(State successor, StnDelta delta, Happening happening, double duration) {
}
