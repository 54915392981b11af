package org.Aayush.tempus.state;

/**
 * Cost charged for starting a ground action with a given committed duration.
 */
@FunctionalInterface
public interface ActionCost {

    double of(GroundAction action, double duration);
}
