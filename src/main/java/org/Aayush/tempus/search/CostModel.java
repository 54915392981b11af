package org.Aayush.tempus.search;

import org.Aayush.tempus.state.ActionCost;
import org.Aayush.tempus.state.GroundAction;

/**
 * Path cost charged when an action starts. Ends are free.
 */
public enum CostModel implements ActionCost {
    /** Committed duration; instantaneous actions cost nothing. */
    DURATION {
        @Override
        public double of(GroundAction action, double duration) {
            return duration;
        }
    },
    /** One per started action. */
    UNIT {
        @Override
        public double of(GroundAction action, double duration) {
            return 1.0d;
        }
    }
}
