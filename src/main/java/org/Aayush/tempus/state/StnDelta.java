package org.Aayush.tempus.state;

import org.Aayush.tempus.stn.Extension;
import org.Aayush.tempus.stn.TemporalConstraint;
import org.Aayush.tempus.stn.TemporalNetwork;

import java.util.List;

/**
 * Time points and constraints a transition adds to the network of its source node.
 */
public record StnDelta(int newPoints, List<TemporalConstraint> constraints) {
    public StnDelta {
        constraints = List.copyOf(constraints);
    }

    public Extension applyTo(TemporalNetwork network) {
        return network.extend(newPoints, constraints);
    }
}
