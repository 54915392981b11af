package org.Aayush.tempus.search;

import org.Aayush.tempus.heuristic.HeuristicType;
import org.Aayush.tempus.pddl.PddlParser;
import org.Aayush.tempus.state.State;
import org.Aayush.tempus.state.TransitionModel;
import org.Aayush.tempus.task.Task;
import org.Aayush.tempus.testutil.Fixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Temporal Best-First Search Tests")
class TemporalBestFirstSearchTest {

    private static final double EPS = 1e-6;

    private static SearchResult solve(Task task, SearchConfig config) {
        return new TemporalBestFirstSearch(new TransitionModel(task), config).solve();
    }

    private static SearchResult solve(Task task) {
        return solve(task, SearchConfig.builder().build());
    }

    private static List<String> names(Plan plan) {
        return plan.getSteps().stream().map(PlanStep::name).collect(Collectors.toList());
    }

    private static void assertReplaysToGoal(Task task, Plan plan) {
        TransitionModel model = new TransitionModel(task);
        State last = model.replay(plan.schedule());
        assertTrue(model.isGoal(last), "plan does not reach the goal:\n" + plan.format());
    }

    private static Task withoutHandEmpty() {
        return new PddlParser().parse(
                Fixtures.domain(Fixtures.SIMPLE_ROBOT),
                Fixtures.problem(Fixtures.SIMPLE_DELIVERY).replace("(hand-empty robot1)", "")
        );
    }

    @Nested
    @DisplayName("A* with temporal critical path")
    class AStar {

        @Test
        @DisplayName("Simple delivery: both packages delivered one after another")
        void testSimpleDelivery() {
            Task task = Fixtures.simpleDelivery();
            SearchResult result = solve(task);

            assertTrue(result.isSolution());
            assertTrue(result.failureReason().isEmpty());
            Plan plan = result.plan().orElseThrow();
            assertEquals(List.of("pick-up", "deliver", "pick-up", "deliver"), names(plan));
            assertEquals(4.0d, plan.getCost(), EPS);
            assertEquals(4.0d, plan.getMakespan(), 0.01d);

            PlanStep firstDelivery = plan.getSteps().get(1);
            PlanStep secondPickUp = plan.getSteps().get(2);
            assertEquals(2.0d, firstDelivery.duration(), EPS);
            assertTrue(secondPickUp.start() >= firstDelivery.end() - EPS,
                    "second pick-up needs the hand freed by the first delivery");
            assertEquals(0.0d, plan.getSteps().get(0).start(), EPS);
            assertReplaysToGoal(task, plan);
        }

        @Test
        @DisplayName("Stack blocks: two slow stacks built bottom-up")
        void testStackBlocks() {
            Task task = Fixtures.stackBlocks();
            Plan plan = solve(task).plan().orElseThrow();

            assertEquals(6.0d, plan.getCost(), EPS);
            assertEquals(List.of(
                    "(pick-up b)", "(stack-slow b c)", "(pick-up a)", "(stack-slow a b)"
            ), plan.getSteps().stream().map(PlanStep::signature).collect(Collectors.toList()));
            assertReplaysToGoal(task, plan);
        }

        @Test
        @DisplayName("Factory: numeric durations and conditions lead to an inspected widget")
        void testFactoryProduction() {
            SearchResult result = solve(Fixtures.factoryProduction(),
                    SearchConfig.builder().maxExpansions(200_000).build());

            assertTrue(result.isSolution(), () -> "unexpected " + result.failureReason() + " " + result.getDetail());
            Plan plan = result.plan().orElseThrow();
            List<String> signatures = plan.getSteps().stream().map(PlanStep::signature).collect(Collectors.toList());
            assertTrue(signatures.stream().anyMatch(s -> s.startsWith("(produce-product") && s.contains("widget")));
            assertTrue(signatures.stream().anyMatch(s -> s.startsWith("(inspect-product") && s.contains("widget")));
            assertTrue(names(plan).stream().filter("process-ingredient"::equals).count() >= 2);
            assertTrue(plan.getMakespan() > 0.0d);
        }

        @Test
        @DisplayName("Repeated solves return the identical plan")
        void testDeterministic() {
            Task task = Fixtures.simpleDelivery();
            TemporalBestFirstSearch search = new TemporalBestFirstSearch(new TransitionModel(task), SearchConfig.builder().build());

            Plan first = search.solve().plan().orElseThrow();
            Plan second = search.solve().plan().orElseThrow();
            assertEquals(first, second);
            assertEquals(first.format(), second.format());
        }

        @Test
        @DisplayName("Statistics count expansions, generated nodes and mutex pruning")
        void testStatistics() {
            SearchStatistics stats = solve(Fixtures.simpleDelivery()).getStatistics();

            assertTrue(stats.getExpanded() >= 4);
            assertTrue(stats.getGenerated() >= stats.getExpanded());
            assertTrue(stats.getPeakFrontier() >= 1);
            // moving away while a delivery runs breaks its over-all condition
            assertTrue(stats.getPrunedInconsistent() >= 1);
            assertTrue(stats.getElapsedMillis() >= 0L);
        }
    }

    @Nested
    @DisplayName("Configurations")
    class Configurations {

        @Test
        @DisplayName("Uniform-cost search ignores the heuristic and stays optimal")
        void testUniformCost() {
            SearchConfig config = SearchConfig.builder()
                    .algorithm(SearchAlgorithm.UNIFORM_COST)
                    .heuristic(HeuristicType.TEMPORAL_FF)
                    .build();
            TemporalBestFirstSearch search = new TemporalBestFirstSearch(new TransitionModel(Fixtures.simpleDelivery()), config);

            assertEquals(HeuristicType.NONE, search.heuristicType());
            assertEquals(4.0d, search.solve().plan().orElseThrow().getCost(), EPS);
        }

        @Test
        @DisplayName("Greedy best-first finds a valid plan")
        void testGreedy() {
            Task task = Fixtures.simpleDelivery();
            SearchResult result = solve(task, SearchConfig.builder()
                    .algorithm(SearchAlgorithm.GREEDY_BEST_FIRST)
                    .heuristic(HeuristicType.TEMPORAL_FF)
                    .build());

            assertReplaysToGoal(task, result.plan().orElseThrow());
        }

        @Test
        @DisplayName("A* with the relaxed-plan heuristic finds a valid plan")
        void testRelaxedPlanHeuristic() {
            Task task = Fixtures.stackBlocks();
            SearchResult result = solve(task, SearchConfig.builder().heuristic(HeuristicType.TEMPORAL_FF).build());

            assertReplaysToGoal(task, result.plan().orElseThrow());
        }

        @Test
        @DisplayName("Unit cost counts started actions")
        void testUnitCost() {
            SearchResult result = solve(Fixtures.simpleDelivery(), SearchConfig.builder().costModel(CostModel.UNIT).build());

            Plan plan = result.plan().orElseThrow();
            assertEquals(4.0d, plan.getCost(), EPS);
            assertEquals(4, plan.size());
        }

        @Test
        @DisplayName("Schedule-aware duplicate detection still finds the optimal plan")
        void testScheduleAwareDuplicates() {
            SearchResult result = solve(Fixtures.simpleDelivery(), SearchConfig.builder()
                    .duplicateDetection(DuplicateDetection.STATE_AND_SCHEDULE)
                    .build());

            assertEquals(4.0d, result.plan().orElseThrow().getCost(), EPS);
        }

        @Test
        @DisplayName("Parallel successor evaluation matches the sequential plan")
        void testParallelMatchesSequential() {
            Task task = Fixtures.stackBlocks();
            SearchResult sequential = solve(task);
            SearchResult parallel = solve(task, SearchConfig.builder().parallelism(2).build());

            assertEquals(sequential.plan().orElseThrow(), parallel.plan().orElseThrow());
            assertEquals(sequential.getStatistics().getExpanded(), parallel.getStatistics().getExpanded());
            assertEquals(sequential.getStatistics().getGenerated(), parallel.getStatistics().getGenerated());
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("Expansion budget stops the search with its reason code")
        void testExpansionBudget() {
            SearchResult result = solve(Fixtures.simpleDelivery(), SearchConfig.builder().maxExpansions(1).build());

            assertFalse(result.isSolution());
            assertTrue(result.plan().isEmpty());
            assertEquals(SearchResult.FailureReason.BUDGET_EXCEEDED, result.failureReason().orElseThrow());
            assertEquals(SearchBudget.REASON_EXPANSIONS_EXCEEDED, result.getDetail());
            assertEquals(1, result.getStatistics().getExpanded());
        }

        @Test
        @DisplayName("Initial dead end fails without expanding")
        void testInitialDeadEnd() {
            SearchResult result = solve(withoutHandEmpty());

            assertEquals(SearchResult.FailureReason.EXHAUSTED, result.failureReason().orElseThrow());
            assertEquals(0, result.getStatistics().getExpanded());
            assertEquals(1, result.getStatistics().getDeadEnds());
        }

        @Test
        @DisplayName("Blind search on an unsolvable task exhausts the frontier")
        void testExhausted() {
            SearchResult result = solve(withoutHandEmpty(),
                    SearchConfig.builder().algorithm(SearchAlgorithm.UNIFORM_COST).build());

            assertEquals(SearchResult.FailureReason.EXHAUSTED, result.failureReason().orElseThrow());
            assertTrue(result.getStatistics().getExpanded() > 0);
            assertTrue(result.getStatistics().getPrunedDuplicate() > 0);
        }
    }
}
