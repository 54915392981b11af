package org.Aayush.tempus.state;

import org.Aayush.tempus.stn.Extension;
import org.Aayush.tempus.stn.TemporalConstraint;
import org.Aayush.tempus.stn.TemporalNetwork;
import org.Aayush.tempus.testutil.Fixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Transition Model Tests")
class TransitionModelTest {

    private TransitionModel model;

    @BeforeEach
    void setUp() {
        model = new TransitionModel(Fixtures.simpleDelivery());
    }

    private GroundAction action(String signature) {
        return model.actions().find(signature).orElseThrow();
    }

    private int fact(String signature) {
        return model.facts().factId(signature);
    }

    @Nested
    @DisplayName("Applicability")
    class Applicability {

        @Test
        @DisplayName("Initial state enables the move out of the depot and both pick-ups")
        void testInitialHappenings() {
            Set<String> enabled = model.enabledHappenings(model.initialState()).stream()
                    .map(Happening::toString)
                    .collect(Collectors.toSet());

            assertEquals(Set.of(
                    "start (move robot1 depot office)",
                    "start (pick-up robot1 package1 depot)",
                    "start (pick-up robot1 package2 depot)"
            ), enabled);
        }

        @Test
        @DisplayName("Over-all condition broken by the start itself disables the action")
        void testOverAllCheckedAfterStart() {
            // connected is never true for a location with itself
            assertFalse(model.canStart(model.initialState(), action("(move robot1 depot depot)")));
            assertFalse(model.canStart(model.initialState(), action("(deliver robot1 package1 depot)")));
        }

        @Test
        @DisplayName("Applying an inapplicable action is a contract violation")
        void testApplyInapplicable() {
            assertThrows(IllegalStateException.class,
                    () -> model.applyStart(model.initialState(), action("(drop robot1 package1 depot)")));
        }

        @Test
        @DisplayName("A running action cannot start again")
        void testNoSelfOverlap() {
            State holding = model.applyStart(model.initialState(), action("(pick-up robot1 package1 depot)")).successor();
            GroundAction deliver = action("(deliver robot1 package1 depot)");
            State delivering = model.applyStart(holding, deliver).successor();

            assertTrue(delivering.isRunning(deliver.getId()));
            assertTrue(delivering.holds(fact("(holding robot1 package1)")));
            assertFalse(model.canStart(delivering, deliver));
        }
    }

    @Nested
    @DisplayName("Effects and timing")
    class EffectsAndTiming {

        @Test
        @DisplayName("Instantaneous action applies effects and allocates two pinned points")
        void testInstantaneousStart() {
            State initial = model.initialState();
            Transition transition = model.applyStart(initial, action("(pick-up robot1 package1 depot)"));
            State next = transition.successor();

            assertTrue(next.holds(fact("(holding robot1 package1)")));
            assertFalse(next.holds(fact("(package-at package1 depot)")));
            assertFalse(next.holds(fact("(hand-empty robot1)")));
            assertFalse(next.hasPending());
            assertEquals(2, transition.delta().newPoints());
            assertEquals(1, next.lastPoint());
            assertEquals(3, next.nextPoint());
            assertEquals(0.0d, transition.duration());
            assertTrue(initial.holds(fact("(hand-empty robot1)")), "parent state must stay untouched");
        }

        @Test
        @DisplayName("Durative start enqueues its end; the end applies at-end effects")
        void testDurativeStartAndEnd() {
            Transition pickUp = model.applyStart(model.initialState(), action("(pick-up robot1 package1 depot)"));
            Transition start = model.applyStart(pickUp.successor(), action("(deliver robot1 package1 depot)"));
            State delivering = start.successor();

            assertEquals(2.0d, start.duration(), 1e-12);
            assertEquals(1, delivering.pending().size());
            PendingEffect running = delivering.pending().get(0);
            assertEquals(3, running.startPoint());
            assertEquals(4, running.endPoint());
            assertFalse(model.isGoal(delivering));

            List<Happening> enabled = model.enabledHappenings(delivering);
            Happening end = enabled.get(enabled.size() - 1);
            assertFalse(end.isStart());

            Transition finish = model.apply(delivering, end);
            State done = finish.successor();
            assertTrue(done.holds(fact("(delivered package1)")));
            assertTrue(done.holds(fact("(hand-empty robot1)")));
            assertFalse(done.holds(fact("(holding robot1 package1)")));
            assertFalse(done.hasPending());
            assertEquals(0, finish.delta().newPoints());
            assertEquals(running.endPoint(), done.lastPoint());

            TemporalNetwork network = pickUp.delta().applyTo(TemporalNetwork.create()).network();
            network = start.delta().applyTo(network).network();
            network = finish.delta().applyTo(network).network();
            assertEquals(2.0d, network.earliest(running.endPoint()) - network.earliest(running.startPoint()), 1e-9);
        }

        @Test
        @DisplayName("Breaking a running action's over-all condition is not applicable")
        void testMutexViolationRejected() {
            Transition pickUp = model.applyStart(model.initialState(), action("(pick-up robot1 package1 depot)"));
            TemporalNetwork network = pickUp.delta().applyTo(TemporalNetwork.create()).network();
            Transition deliver = model.applyStart(pickUp.successor(), action("(deliver robot1 package1 depot)"));
            network = deliver.delta().applyTo(network).network();

            // leaving the depot breaks deliver's over-all (robot-at robot1 depot) while it still runs
            GroundAction move = action("(move robot1 depot office)");
            assertTrue(model.canStart(deliver.successor(), move));
            assertFalse(model.applicable(deliver.successor(), network, move));

            Extension extension = model.applyStart(deliver.successor(), move).delta().applyTo(network);
            assertFalse(extension.isConsistent());
        }

        @Test
        @DisplayName("Concurrent happening keeps running actions ending after it")
        void testRunningActionsEndAfterHappening() {
            Transition pickUp = model.applyStart(model.initialState(), action("(pick-up robot1 package1 depot)"));
            TemporalNetwork network = pickUp.delta().applyTo(TemporalNetwork.create()).network();
            Transition deliver = model.applyStart(pickUp.successor(), action("(deliver robot1 package1 depot)"));
            network = deliver.delta().applyTo(network).network();
            PendingEffect running = deliver.successor().pending().get(0);

            // dropping the package leaves deliver's over-all (robot-at robot1 depot) intact
            GroundAction drop = action("(drop robot1 package1 depot)");
            assertTrue(model.applicable(deliver.successor(), network, drop));
            Transition dropped = model.applyStart(deliver.successor(), drop);
            int dropPoint = dropped.successor().lastPoint();
            assertTrue(dropped.delta().constraints().contains(
                    TemporalConstraint.after(dropPoint, running.endPoint(), 0.0d)));

            network = dropped.delta().applyTo(network).network();
            Extension finish = model.applyEnd(dropped.successor(), running).delta().applyTo(network);
            assertTrue(finish.isConsistent());
            assertEquals(2.0d, finish.network().earliest(running.endPoint()), 1e-9);
        }

        @Test
        @DisplayName("Undoing a pick-up returns to the initial fingerprint")
        void testFingerprintEquality() {
            State initial = model.initialState();
            State holding = model.applyStart(initial, action("(pick-up robot1 package1 depot)")).successor();
            State dropped = model.applyStart(holding, action("(drop robot1 package1 depot)")).successor();

            assertNotEquals(initial.fingerprint(), holding.fingerprint());
            assertEquals(initial.fingerprint(), dropped.fingerprint());
            assertEquals(initial.fingerprint().hashCode(), dropped.fingerprint().hashCode());
            assertNotEquals(initial.nextPoint(), dropped.nextPoint());
        }
    }

    @Nested
    @DisplayName("Replay")
    class Replay {

        private List<ScheduledAction> deliveryPlan() {
            return List.of(
                    new ScheduledAction(action("(pick-up robot1 package1 depot)").getId(), 0.0, 0.0),
                    new ScheduledAction(action("(deliver robot1 package1 depot)").getId(), 0.0, 2.0),
                    new ScheduledAction(action("(pick-up robot1 package2 depot)").getId(), 2.0, 0.0),
                    new ScheduledAction(action("(deliver robot1 package2 depot)").getId(), 2.0, 2.0)
            );
        }

        @Test
        @DisplayName("Replaying the delivery schedule reaches the goal")
        void testReplayReachesGoal() {
            State last = model.replay(deliveryPlan());

            assertTrue(last.holds(fact("(delivered package1)")));
            assertTrue(last.holds(fact("(delivered package2)")));
            assertTrue(model.isGoal(last));
        }

        @Test
        @DisplayName("Replay rejects actions whose conditions do not hold")
        void testReplayRejectsInapplicable() {
            List<ScheduledAction> schedule = List.of(
                    new ScheduledAction(action("(deliver robot1 package1 depot)").getId(), 0.0, 2.0)
            );
            assertThrows(IllegalStateException.class, () -> model.replay(schedule));
        }

        @Test
        @DisplayName("Replay rejects durations outside the action's window")
        void testReplayRejectsWrongDuration() {
            List<ScheduledAction> schedule = List.of(
                    new ScheduledAction(action("(pick-up robot1 package1 depot)").getId(), 0.0, 0.0),
                    new ScheduledAction(action("(deliver robot1 package1 depot)").getId(), 0.0, 1.0)
            );
            assertThrows(IllegalStateException.class, () -> model.replay(schedule));
        }

        @Test
        @DisplayName("Replay rejects overlapping a running action's over-all condition")
        void testReplayRejectsMutexViolation() {
            List<ScheduledAction> schedule = List.of(
                    new ScheduledAction(action("(pick-up robot1 package1 depot)").getId(), 0.0, 0.0),
                    new ScheduledAction(action("(deliver robot1 package1 depot)").getId(), 0.0, 2.0),
                    new ScheduledAction(action("(move robot1 depot office)").getId(), 1.0, 1.0)
            );
            assertThrows(IllegalStateException.class, () -> model.replay(schedule));
        }
    }

    @Test
    @DisplayName("Unreached pending lookup is null")
    void testPendingForAbsent() {
        assertNull(model.initialState().pendingFor(0));
    }
}
