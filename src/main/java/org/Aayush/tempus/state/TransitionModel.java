package org.Aayush.tempus.state;

import lombok.extern.slf4j.Slf4j;
import org.Aayush.tempus.stn.Extension;
import org.Aayush.tempus.stn.TemporalConstraint;
import org.Aayush.tempus.stn.TemporalNetwork;
import org.Aayush.tempus.task.Task;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Temporal transition semantics over a grounded task.
 *
 * <p>Every happening is placed after the previous one in the network. A start adds two time
 * points bound by the action's duration window and enqueues its end; an end applies the
 * action's end effects. Actions still running after a happening end after it. Each of them
 * must keep its over-all condition; if it would not, the happening is also ordered strictly
 * after that action's end, the network turns inconsistent and the happening is not
 * applicable.</p>
 *
 * <p>Thread-safe: all fields are immutable after construction.</p>
 */
@Slf4j
public final class TransitionModel {
    /** Minimum separation forced between a conflicting running action's end and a happening. */
    public static final double MUTEX_SEPARATION = 0.001d;

    private static final PendingEffect[] NO_PENDING = new PendingEffect[0];

    private final Task task;
    private final FactTable facts;
    private final GroundActionTable actions;
    private final State initialState;
    private final GroundFormula goal;

    public TransitionModel(Task task) {
        this.task = Objects.requireNonNull(task, "task");
        Grounder.Grounding grounding = new Grounder().ground(task);
        this.facts = grounding.facts();
        this.actions = grounding.actions();
        this.initialState = grounding.initialState();
        this.goal = grounding.goal();
    }

    public Task task() {
        return task;
    }

    public FactTable facts() {
        return facts;
    }

    public GroundActionTable actions() {
        return actions;
    }

    public State initialState() {
        return initialState;
    }

    public GroundFormula goal() {
        return goal;
    }

    /**
     * Goal test: the goal formula holds and no action is still running.
     */
    public boolean isGoal(State state) {
        return !state.hasPending() && state.satisfies(goal);
    }

    /**
     * Enumerates every happening enabled in a state: starts in action-id order, then ends in
     * action-id order.
     */
    public List<Happening> enabledHappenings(State state) {
        List<Happening> enabled = new ArrayList<>();
        for (GroundAction action : actions.all()) {
            if (tryStart(state, action) != null) {
                enabled.add(Happening.start(action));
            }
        }
        for (PendingEffect running : state.pendingView()) {
            GroundAction action = actions.get(running.actionId());
            if (canEnd(state, running)) {
                enabled.add(Happening.end(action, running));
            }
        }
        return enabled;
    }

    /**
     * Returns whether an action may start in a state, ignoring timing.
     */
    public boolean canStart(State state, GroundAction action) {
        return tryStart(state, action) != null;
    }

    /**
     * Returns whether a running action may end in a state, ignoring timing.
     */
    public boolean canEnd(State state, PendingEffect running) {
        GroundAction action = actions.get(running.actionId());
        return state.satisfies(action.getConditionAtEnd()) && state.satisfies(action.getConditionOverAll());
    }

    /**
     * Full applicability: the start is enabled and its timing keeps the network consistent.
     */
    public boolean applicable(State state, TemporalNetwork network, GroundAction action) {
        Transition transition = tryStart(state, action);
        return transition != null && transition.delta().applyTo(network).isConsistent();
    }

    /**
     * Starts an action.
     *
     * @throws IllegalStateException if the start is not enabled; callers check first.
     */
    public Transition applyStart(State state, GroundAction action) {
        Transition transition = tryStart(state, action);
        if (transition == null) {
            throw new IllegalStateException("action " + action.signature() + " cannot start in this state");
        }
        return transition;
    }

    /**
     * Ends a running action.
     *
     * @throws IllegalStateException if the action is not running or its end conditions fail.
     */
    public Transition applyEnd(State state, PendingEffect running) {
        if (!running.equals(state.pendingFor(running.actionId())) || !canEnd(state, running)) {
            throw new IllegalStateException("action " + actions.get(running.actionId()).signature() + " cannot end in this state");
        }
        GroundAction action = actions.get(running.actionId());
        BitSet nextFacts = state.factsCopy();
        double[] before = state.fluentsView();
        double[] nextFluents = before.clone();
        action.getEffectsAtEnd().applyTo(nextFacts, nextFluents, before, running.duration());

        PendingEffect[] remaining = without(state.pendingView(), running.actionId());
        List<TemporalConstraint> constraints = new ArrayList<>(1 + 2 * remaining.length);
        constraints.add(TemporalConstraint.after(state.lastPoint(), running.endPoint(), 0.0d));
        addMutexOrderings(remaining, nextFacts, nextFluents, running.endPoint(), constraints);

        State successor = new State(nextFacts, nextFluents, remaining, running.endPoint(), state.nextPoint());
        return new Transition(successor, new StnDelta(0, constraints), Happening.end(action, running), 0.0d);
    }

    public Transition apply(State state, Happening happening) {
        return happening.isStart() ? applyStart(state, happening.action()) : applyEnd(state, happening.pending());
    }

    /**
     * Re-applies scheduled actions in time order from the initial state.
     *
     * <p>Ends are applied before starts at equal times. Every happening is pinned to its
     * scheduled time in a fresh network, so a schedule that breaks a duration or mutex
     * ordering is rejected as well.</p>
     *
     * @return the state after the last happening.
     * @throws IllegalStateException if a happening is not enabled or the timing is inconsistent.
     */
    public State replay(List<ScheduledAction> schedule) {
        List<ReplayEvent> events = new ArrayList<>(schedule.size() * 2);
        for (int i = 0; i < schedule.size(); i++) {
            ScheduledAction step = schedule.get(i);
            GroundAction action = actions.get(step.actionId());
            events.add(new ReplayEvent(step.start(), false, i, action));
            if (action.isDurative()) {
                events.add(new ReplayEvent(step.start() + step.duration(), true, i, action));
            }
        }
        events.sort(Comparator.comparingDouble(ReplayEvent::time)
                .thenComparing(ReplayEvent::end, Comparator.reverseOrder())
                .thenComparingInt(ReplayEvent::order));

        State state = initialState;
        TemporalNetwork network = TemporalNetwork.create();
        for (ReplayEvent event : events) {
            Transition transition;
            int point;
            if (event.end()) {
                PendingEffect running = state.pendingFor(event.action().getId());
                if (running == null) {
                    throw new IllegalStateException("replay ends " + event.action().signature() + " which is not running");
                }
                transition = applyEnd(state, running);
                point = running.endPoint();
            } else {
                transition = applyStart(state, event.action());
                point = state.nextPoint();
            }
            List<TemporalConstraint> pinned = new ArrayList<>(transition.delta().constraints());
            pinned.add(TemporalConstraint.between(TemporalNetwork.ORIGIN, point, event.time(), event.time()));
            Extension extension = network.extend(transition.delta().newPoints(), pinned);
            if (!extension.isConsistent()) {
                throw new IllegalStateException("replay timing of " + transition.happening() + " at " + event.time()
                        + " is inconsistent at " + extension.conflict());
            }
            network = extension.network();
            state = transition.successor();
        }
        log.debug("Replayed {} scheduled actions, makespan {}", schedule.size(), network.makespan());
        return state;
    }

    private Transition tryStart(State state, GroundAction action) {
        if (state.isRunning(action.getId()) || !state.satisfies(action.getConditionAtStart())) {
            return null;
        }
        DurationWindow window = action.durationIn(state);
        if (!window.isValid(action.isDurative())) {
            return null;
        }
        BitSet nextFacts = state.factsCopy();
        double[] before = state.fluentsView();
        double[] nextFluents = action.getEffectsAtStart().numeric().isEmpty() ? before : before.clone();
        action.getEffectsAtStart().applyTo(nextFacts, nextFluents, before, window.min());
        if (action.isDurative() && !action.getConditionOverAll().holds(nextFacts, nextFluents)) {
            return null;
        }

        int startPoint = state.nextPoint();
        int endPoint = startPoint + 1;
        List<TemporalConstraint> constraints = new ArrayList<>(2 + 2 * state.pendingView().length);
        constraints.add(TemporalConstraint.after(state.lastPoint(), startPoint, 0.0d));
        constraints.add(TemporalConstraint.between(startPoint, endPoint, window.min(), window.max()));
        addMutexOrderings(state.pendingView(), nextFacts, nextFluents, startPoint, constraints);

        PendingEffect[] pending = action.isDurative()
                ? with(state.pendingView(), new PendingEffect(action.getId(), startPoint, endPoint, window.min()))
                : state.pendingView();
        State successor = new State(nextFacts, nextFluents, pending, startPoint, endPoint + 1);
        return new Transition(successor, new StnDelta(2, constraints), Happening.start(action), window.min());
    }

    private void addMutexOrderings(PendingEffect[] running, BitSet nextFacts, double[] nextFluents, int happeningPoint,
                                   List<TemporalConstraint> sink) {
        for (PendingEffect other : running) {
            sink.add(TemporalConstraint.after(happeningPoint, other.endPoint(), 0.0d));
            GroundAction otherAction = actions.get(other.actionId());
            if (!otherAction.getConditionOverAll().holds(nextFacts, nextFluents)) {
                sink.add(TemporalConstraint.after(other.endPoint(), happeningPoint, MUTEX_SEPARATION));
            }
        }
    }

    private static PendingEffect[] with(PendingEffect[] pending, PendingEffect added) {
        PendingEffect[] result = Arrays.copyOf(pending, pending.length + 1);
        int index = pending.length;
        while (index > 0 && result[index - 1].actionId() > added.actionId()) {
            result[index] = result[index - 1];
            index--;
        }
        result[index] = added;
        return result;
    }

    private static PendingEffect[] without(PendingEffect[] pending, int actionId) {
        if (pending.length == 1) {
            return NO_PENDING;
        }
        PendingEffect[] result = new PendingEffect[pending.length - 1];
        int next = 0;
        for (PendingEffect entry : pending) {
            if (entry.actionId() != actionId) {
                result[next++] = entry;
            }
        }
        return result;
    }

    private record ReplayEvent(double time, boolean end, int order, GroundAction action) {
    }
}
