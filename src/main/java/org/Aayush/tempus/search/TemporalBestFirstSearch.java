package org.Aayush.tempus.search;

import lombok.extern.slf4j.Slf4j;
import org.Aayush.tempus.heuristic.HeuristicFactory;
import org.Aayush.tempus.heuristic.HeuristicType;
import org.Aayush.tempus.heuristic.StateHeuristic;
import org.Aayush.tempus.state.GroundAction;
import org.Aayush.tempus.state.Happening;
import org.Aayush.tempus.state.State;
import org.Aayush.tempus.state.Transition;
import org.Aayush.tempus.state.TransitionModel;
import org.Aayush.tempus.stn.Extension;
import org.Aayush.tempus.stn.TemporalNetwork;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Best-first search over temporal states.
 *
 * <p>Each node owns the temporal network of its path. Expanding a node applies every enabled
 * happening; successors whose network extension is inconsistent are pruned, the rest are
 * deduplicated, scored and pushed. The goal test runs when a node is popped, so with an
 * admissible heuristic the first goal popped by A* is cheapest.</p>
 *
 * <p>With {@code parallelism > 1} successor evaluation runs on a fixed worker pool; results
 * are merged in happening order on the search thread, so plans match sequential runs.</p>
 *
 * <p>Instances are reusable and thread-safe; every {@link #solve()} call owns its frontier.</p>
 */
@Slf4j
public final class TemporalBestFirstSearch {
    private final TransitionModel model;
    private final SearchConfig config;
    private final HeuristicType heuristicType;
    private final StateHeuristic heuristic;

    public TemporalBestFirstSearch(TransitionModel model, SearchConfig config) {
        this.model = Objects.requireNonNull(model, "model");
        this.config = Objects.requireNonNull(config, "config");
        this.heuristicType = config.effectiveHeuristic();
        this.heuristic = HeuristicFactory.create(heuristicType, model, config.getCostModel()).bindGoal(model.goal());
    }

    public HeuristicType heuristicType() {
        return heuristicType;
    }

    public SearchResult solve() {
        log.info("Solving task {} with {} / {} ({} ground actions)",
                model.task().getProblemName(), config.getAlgorithm(), heuristicType, model.actions().size());
        SearchBudget budget = SearchBudget.start(config.getMaxExpansions(), config.getTimeoutMillis());
        ExecutorService workers = config.getParallelism() > 1 ? Executors.newFixedThreadPool(config.getParallelism()) : null;
        Run run = new Run(budget, workers);
        try {
            SearchResult result = run.execute();
            log.info("Search finished: {} after {} expansions in {}ms", result.isSolution() ? "solution" : result.failureReason().orElseThrow(),
                    result.getStatistics().getExpanded(), result.getStatistics().getElapsedMillis());
            return result;
        } finally {
            if (workers != null) {
                workers.shutdownNow();
            }
        }
    }

    /**
     * Successor of one happening, before duplicate detection.
     *
     * @param network null when the extension was inconsistent.
     */
    private record Candidate(Transition transition, TemporalNetwork network, double g, double h) {
    }

    /**
     * Mutable state of a single search call.
     */
    private final class Run {
        private final SearchBudget budget;
        private final ExecutorService workers;
        private final NodeStore nodes = new NodeStore();
        private final OpenList open = new OpenList();
        private final ClosedSet closed = new ClosedSet();
        private int expanded;
        private int generated;
        private int prunedInconsistent;
        private int prunedDuplicate;
        private int deadEnds;

        private Run(SearchBudget budget, ExecutorService workers) {
            this.budget = budget;
            this.workers = workers;
        }

        SearchResult execute() {
            State initial = model.initialState();
            TemporalNetwork network = TemporalNetwork.create();
            double h = heuristic.estimate(initial, network);
            if (h == Double.POSITIVE_INFINITY) {
                deadEnds++;
                return SearchResult.failure(SearchResult.FailureReason.EXHAUSTED, "initial state is a dead end", statistics());
            }
            SearchNode root = SearchNode.root(initial, network, h);
            closed.admit(config.getDuplicateDetection().keyOf(initial, network), rank(root));
            open.push(nodes.add(root), priority(0.0d, h), h);

            try {
                while (!open.isEmpty()) {
                    FrontierEntry entry = open.poll();
                    SearchNode node = nodes.get(entry.nodeId());
                    if (closed.isStale(config.getDuplicateDetection().keyOf(node.state(), node.network()), rank(node))) {
                        continue;
                    }
                    if (model.isGoal(node.state())) {
                        return SearchResult.solution(extractPlan(entry.nodeId()), statistics());
                    }
                    budget.checkExpansions(expanded + 1);
                    budget.checkDeadline();
                    expanded++;
                    expand(entry.nodeId(), node);
                }
            } catch (SearchBudget.BudgetExceededException ex) {
                log.debug("Search stopped: {}", ex.getMessage());
                return SearchResult.failure(SearchResult.FailureReason.BUDGET_EXCEEDED, ex.reasonCode(), statistics());
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                return SearchResult.failure(SearchResult.FailureReason.INTERRUPTED, "interrupted", statistics());
            }
            return SearchResult.failure(SearchResult.FailureReason.EXHAUSTED, "frontier exhausted", statistics());
        }

        private void expand(int nodeId, SearchNode node) throws InterruptedException {
            List<Happening> happenings = model.enabledHappenings(node.state());
            if (workers == null) {
                for (Happening happening : happenings) {
                    Candidate candidate = successor(node, happening, false);
                    if (candidate.network() == null) {
                        prunedInconsistent++;
                        continue;
                    }
                    Object key = config.getDuplicateDetection().keyOf(candidate.transition().successor(), candidate.network());
                    if (!closed.admit(key, rankOf(candidate.g()))) {
                        prunedDuplicate++;
                        continue;
                    }
                    double h = heuristic.estimate(candidate.transition().successor(), candidate.network());
                    push(nodeId, node, new Candidate(candidate.transition(), candidate.network(), candidate.g(), h));
                }
                return;
            }

            List<Callable<Candidate>> tasks = new ArrayList<>(happenings.size());
            for (Happening happening : happenings) {
                tasks.add(() -> successor(node, happening, true));
            }
            for (Future<Candidate> future : workers.invokeAll(tasks)) {
                Candidate candidate = resolve(future);
                if (candidate.network() == null) {
                    prunedInconsistent++;
                    continue;
                }
                Object key = config.getDuplicateDetection().keyOf(candidate.transition().successor(), candidate.network());
                if (!closed.admit(key, rankOf(candidate.g()))) {
                    prunedDuplicate++;
                    continue;
                }
                push(nodeId, node, candidate);
            }
        }

        private Candidate successor(SearchNode node, Happening happening, boolean withHeuristic) {
            Transition transition = model.apply(node.state(), happening);
            Extension extension = transition.delta().applyTo(node.network());
            if (!extension.isConsistent()) {
                return new Candidate(transition, null, Double.NaN, Double.NaN);
            }
            double g = node.g() + stepCost(transition);
            double h = withHeuristic ? heuristic.estimate(transition.successor(), extension.network()) : Double.NaN;
            return new Candidate(transition, extension.network(), g, h);
        }

        private void push(int parentId, SearchNode parent, Candidate candidate) {
            if (candidate.h() == Double.POSITIVE_INFINITY) {
                deadEnds++;
                return;
            }
            SearchNode child = new SearchNode(
                    candidate.transition().successor(),
                    candidate.network(),
                    candidate.g(),
                    candidate.h(),
                    parentId,
                    candidate.transition().happening(),
                    parent.depth() + 1
            );
            generated++;
            open.push(nodes.add(child), priority(child.g(), child.h()), child.h());
        }

        private Candidate resolve(Future<Candidate> future) throws InterruptedException {
            try {
                return future.get();
            } catch (ExecutionException ex) {
                Throwable cause = ex.getCause();
                if (cause instanceof RuntimeException runtime) {
                    throw runtime;
                }
                throw new IllegalStateException("successor evaluation failed", cause);
            }
        }

        private double stepCost(Transition transition) {
            Happening happening = transition.happening();
            if (!happening.isStart()) {
                return 0.0d;
            }
            return config.getCostModel().of(happening.action(), transition.duration());
        }

        private double priority(double g, double h) {
            switch (config.getAlgorithm()) {
                case UNIFORM_COST:
                    return g;
                case GREEDY_BEST_FIRST:
                    return h;
                default:
                    return g + h;
            }
        }

        private double rank(SearchNode node) {
            return rankOf(node.g());
        }

        /**
         * Greedy search keeps the first path to a state, the others keep the cheapest.
         */
        private double rankOf(double g) {
            return config.getAlgorithm() == SearchAlgorithm.GREEDY_BEST_FIRST ? 0.0d : g;
        }

        private Plan extractPlan(int goalId) {
            SearchNode goal = nodes.get(goalId);
            TemporalNetwork network = goal.network();
            Deque<PlanStep> steps = new ArrayDeque<>();
            for (SearchNode node = goal; !node.isRoot(); node = nodes.get(node.parentId())) {
                Happening happening = node.happening();
                if (!happening.isStart()) {
                    continue;
                }
                GroundAction action = happening.action();
                int startPoint = node.state().lastPoint();
                double start = network.earliest(startPoint);
                double duration = network.earliest(startPoint + 1) - start;
                steps.addFirst(new PlanStep(action.getId(), action.getName(), action.getArguments(), start, duration));
            }
            List<PlanStep> ordered = new ArrayList<>(steps);
            double makespan = 0.0d;
            for (PlanStep step : ordered) {
                makespan = Math.max(makespan, step.end());
            }
            return new Plan(ordered, makespan, goal.g());
        }

        private SearchStatistics statistics() {
            return SearchStatistics.builder()
                    .expanded(expanded)
                    .generated(generated)
                    .prunedInconsistent(prunedInconsistent)
                    .prunedDuplicate(prunedDuplicate)
                    .deadEnds(deadEnds)
                    .peakFrontier(open.peakSize())
                    .elapsedMillis(budget.elapsedMillis())
                    .build();
        }
    }
}
