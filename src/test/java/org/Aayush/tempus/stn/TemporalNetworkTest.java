package org.Aayush.tempus.stn;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Temporal Network Tests")
class TemporalNetworkTest {

    private static final double EPS = 1e-9;

    private static TemporalNetwork consistent(Extension extension) {
        assertTrue(extension.isConsistent(), () -> "expected consistent extension, conflict " + extension.conflict());
        return extension.network();
    }

    @Nested
    @DisplayName("Consistency")
    class Consistency {

        @Test
        @DisplayName("Chained durations stay consistent and give earliest times")
        void testChainedDurations() {
            TemporalNetwork network = TemporalNetwork.create();
            // action a: points 1 -> 2, action b: points 3 -> 4 starting after a ends
            network = consistent(network.extend(2, List.of(TemporalConstraint.between(1, 2, 2.0, 2.0))));
            network = consistent(network.extend(2, List.of(
                    TemporalConstraint.after(2, 3, 0.0),
                    TemporalConstraint.between(3, 4, 1.5, 1.5)
            )));

            assertEquals(5, network.pointCount());
            assertEquals(0.0, network.earliest(1), EPS);
            assertEquals(2.0, network.earliest(2), EPS);
            assertEquals(2.0, network.earliest(3), EPS);
            assertEquals(3.5, network.earliest(4), EPS);
            assertEquals(3.5, network.makespan(), EPS);
            assertEquals(Double.POSITIVE_INFINITY, network.latest(4));
        }

        @Test
        @DisplayName("Random positive-duration chains without contradictions are always consistent")
        void testRandomChainsConsistent() {
            Random random = new Random(42L);
            for (int trial = 0; trial < 50; trial++) {
                TemporalNetwork network = TemporalNetwork.create();
                int last = TemporalNetwork.ORIGIN;
                for (int step = 0; step < 20; step++) {
                    int start = network.pointCount();
                    double duration = 0.1 + random.nextDouble() * 5.0;
                    network = consistent(network.extend(2, List.of(
                            TemporalConstraint.after(last, start, random.nextBoolean() ? 0.0 : 0.001),
                            TemporalConstraint.between(start, start + 1, duration, duration)
                    )));
                    assertEquals(duration, network.earliest(start + 1) - network.earliest(start), 1e-6);
                    last = start;
                }
            }
        }

        @Test
        @DisplayName("Schedule satisfies every inserted constraint")
        void testScheduleSatisfiesConstraints() {
            List<TemporalConstraint> constraints = List.of(
                    TemporalConstraint.between(1, 2, 3.0, 3.0),
                    TemporalConstraint.between(3, 4, 1.0, 4.0),
                    TemporalConstraint.after(2, 4, 0.5),
                    TemporalConstraint.between(TemporalNetwork.ORIGIN, 3, 1.0, 10.0)
            );
            TemporalNetwork network = consistent(TemporalNetwork.create().extend(4, constraints));
            double[] schedule = network.schedule();
            for (TemporalConstraint constraint : constraints) {
                double gap = schedule[constraint.to()] - schedule[constraint.from()];
                assertTrue(gap >= constraint.lower() - EPS, constraint::toString);
                assertTrue(gap <= constraint.upper() + EPS, constraint::toString);
            }
            assertEquals(3.5, schedule[4], EPS);
        }
    }

    @Nested
    @DisplayName("Inconsistency")
    class Inconsistency {

        @Test
        @DisplayName("Mutual strict precedence is a negative cycle")
        void testMutualPrecedence() {
            TemporalNetwork network = consistent(TemporalNetwork.create().extend(2, List.of(
                    TemporalConstraint.after(1, 2, 1.0)
            )));
            TemporalConstraint backwards = TemporalConstraint.after(2, 1, 1.0);
            Extension extension = network.extend(0, List.of(backwards));

            assertFalse(extension.isConsistent());
            assertSame(backwards, extension.conflict());
            assertThrows(IllegalStateException.class, extension::network);
        }

        @Test
        @DisplayName("Deadline shorter than a required duration is rejected")
        void testDeadlineViolation() {
            TemporalNetwork network = consistent(TemporalNetwork.create().extend(2, List.of(
                    TemporalConstraint.between(1, 2, 5.0, 5.0)
            )));
            Extension extension = network.extend(0, List.of(
                    TemporalConstraint.between(TemporalNetwork.ORIGIN, 2, 0.0, 4.0)
            ));
            assertFalse(extension.isConsistent());
        }

        @Test
        @DisplayName("Empty interval is rejected without touching the graph")
        void testEmptyInterval() {
            Extension extension = TemporalNetwork.create().extend(2, List.of(TemporalConstraint.between(1, 2, 3.0, 1.0)));
            assertFalse(extension.isConsistent());
        }

        @Test
        @DisplayName("Failed extension leaves the parent network intact")
        void testParentUntouched() {
            TemporalNetwork parent = consistent(TemporalNetwork.create().extend(2, List.of(
                    TemporalConstraint.between(1, 2, 2.0, 2.0)
            )));
            assertFalse(parent.extend(0, List.of(TemporalConstraint.after(2, 1, 0.5))).isConsistent());
            TemporalNetwork child = consistent(parent.extend(1, List.of(TemporalConstraint.after(2, 3, 1.0))));

            assertEquals(3, parent.pointCount());
            assertEquals(2.0, parent.earliest(2), EPS);
            assertEquals(3.0, child.earliest(3), EPS);
        }
    }

    @Test
    @DisplayName("Rejects constraints on unknown points and negative point counts")
    void testContractViolations() {
        TemporalNetwork network = TemporalNetwork.create();
        assertThrows(IllegalArgumentException.class,
                () -> network.extend(1, List.of(TemporalConstraint.after(1, 2, 0.0))));
        assertThrows(IllegalArgumentException.class, () -> network.extend(-1, List.of()));
        assertThrows(IndexOutOfBoundsException.class, () -> network.earliest(1));
        assertThrows(IllegalArgumentException.class, () -> TemporalConstraint.after(-1, 0, 0.0));
    }
}
