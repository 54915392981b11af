package org.Aayush.tempus.planner;

import lombok.Builder;
import lombok.Value;

/**
 * Static description of the planner build and its configured strategy.
 */
@Value
@Builder
public class PlannerInfo {
    String version;
    /** Human-readable search strategy, e.g. {@code A_STAR + TEMPORAL_MAX}. */
    String algorithm;
    boolean supportsDurativeActions;
    boolean supportsNumericFluents;
}
