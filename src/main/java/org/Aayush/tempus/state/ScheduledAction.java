package org.Aayush.tempus.state;

/**
 * Ground action placed at an absolute start time, as read back from a plan.
 */
public record ScheduledAction(int actionId, double start, double duration) {
}
