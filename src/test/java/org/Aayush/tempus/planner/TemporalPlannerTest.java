package org.Aayush.tempus.planner;

import org.Aayush.tempus.heuristic.HeuristicType;
import org.Aayush.tempus.search.SearchAlgorithm;
import org.Aayush.tempus.search.SearchConfig;
import org.Aayush.tempus.search.SearchResult;
import org.Aayush.tempus.task.Task;
import org.Aayush.tempus.testutil.Fixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Temporal Planner Facade Tests")
class TemporalPlannerTest {

    private final TemporalPlanner planner = new TemporalPlanner(PlannerConfig.builder().build());

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("Planner config must be non-null")
        void testConfigRequired() {
            PlannerException ex = assertThrows(PlannerException.class, () -> new TemporalPlanner(null));
            assertEquals(TemporalPlanner.REASON_CONFIG_REQUIRED, ex.reasonCode());
            assertTrue(ex.getMessage().startsWith("[" + TemporalPlanner.REASON_CONFIG_REQUIRED + "]"));
        }

        @Test
        @DisplayName("Search config inside the planner config must be non-null")
        void testSearchConfigRequired() {
            PlannerConfig config = PlannerConfig.builder().search(null).build();
            PlannerException ex = assertThrows(PlannerException.class, () -> new TemporalPlanner(config));
            assertEquals(TemporalPlanner.REASON_CONFIG_REQUIRED, ex.reasonCode());
        }

        @Test
        @DisplayName("Solve requires a task")
        void testTaskRequired() {
            PlannerException ex = assertThrows(PlannerException.class, () -> planner.solve(null));
            assertEquals(TemporalPlanner.REASON_TASK_REQUIRED, ex.reasonCode());
        }

        @Test
        @DisplayName("Parse requires both texts")
        void testTextRequired() {
            PlannerException ex = assertThrows(PlannerException.class,
                    () -> planner.parse(Fixtures.domain(Fixtures.SIMPLE_ROBOT), null));
            assertEquals(TemporalPlanner.REASON_TEXT_REQUIRED, ex.reasonCode());
        }

        @Test
        @DisplayName("Unknown integer result codes are rejected")
        void testResultCodes() {
            assertEquals(PlannerResultCode.SOLUTION_FOUND, PlannerResultCode.fromCode(1));
            assertEquals(5, PlannerResultCode.INVALID_HANDLE.code());
            for (PlannerResultCode code : PlannerResultCode.values()) {
                assertEquals(code, PlannerResultCode.fromCode(code.code()));
            }
            assertThrows(IllegalArgumentException.class, () -> PlannerResultCode.fromCode(42));
        }
    }

    @Nested
    @DisplayName("Outcomes")
    class Outcomes {

        @Test
        @DisplayName("Text input: solution found with its plan length")
        void testSolveFromText() {
            PlannerOutcome outcome = planner.solveFromText(
                    Fixtures.domain(Fixtures.SIMPLE_ROBOT), Fixtures.problem(Fixtures.SIMPLE_DELIVERY));

            assertEquals(PlannerResultCode.SOLUTION_FOUND, outcome.getCode());
            assertEquals(4, outcome.getPlanLength());
            assertEquals(4, outcome.plan().orElseThrow().size());
            assertTrue(outcome.errorMessage().isEmpty());
            assertTrue(outcome.searchResult().orElseThrow().isSolution());
        }

        @Test
        @DisplayName("Text input: malformed domain is a parse error")
        void testParseError() {
            PlannerOutcome outcome = planner.solveFromText(
                    "(define (domain broken) (:predicates (at ?x)", Fixtures.problem(Fixtures.SIMPLE_DELIVERY));

            assertEquals(PlannerResultCode.PARSE_ERROR, outcome.getCode());
            assertEquals(0, outcome.getPlanLength());
            assertTrue(outcome.plan().isEmpty());
            assertTrue(outcome.errorMessage().orElseThrow().startsWith("["));
            assertTrue(outcome.searchResult().isEmpty());
        }

        @Test
        @DisplayName("Text input: unsolvable task is no solution")
        void testNoSolution() {
            PlannerOutcome outcome = planner.solveFromText(
                    Fixtures.domain(Fixtures.SIMPLE_ROBOT),
                    Fixtures.problem(Fixtures.SIMPLE_DELIVERY).replace("(hand-empty robot1)", ""));

            assertEquals(PlannerResultCode.NO_SOLUTION, outcome.getCode());
            assertEquals(SearchResult.FailureReason.EXHAUSTED,
                    outcome.searchResult().orElseThrow().failureReason().orElseThrow());
        }

        @Test
        @DisplayName("Path input: fixture files solve")
        void testSolveFromPaths() {
            PlannerOutcome outcome = planner.solveFromPaths(
                    Fixtures.domainPath(Fixtures.BLOCKS_WORLD), Fixtures.problemPath(Fixtures.STACK_BLOCKS));

            assertEquals(PlannerResultCode.SOLUTION_FOUND, outcome.getCode());
            assertEquals(4, outcome.getPlanLength());
        }

        @Test
        @DisplayName("Path input: missing file is a file error")
        void testMissingFile(@TempDir Path dir) {
            PlannerOutcome outcome = planner.solveFromPaths(
                    dir.resolve("absent-domain.pddl"), Fixtures.problemPath(Fixtures.SIMPLE_DELIVERY));

            assertEquals(PlannerResultCode.FILE_ERROR, outcome.getCode());
            assertTrue(outcome.errorMessage().orElseThrow().contains(TemporalPlanner.REASON_FILE_READ_FAILED));
        }

        @Test
        @DisplayName("Parsing files directly surfaces the read failure code")
        void testParseFilesMissing(@TempDir Path dir) {
            PlannerException ex = assertThrows(PlannerException.class,
                    () -> planner.parseFiles(dir.resolve("nope.pddl"), dir.resolve("nope.pddl")));
            assertEquals(TemporalPlanner.REASON_FILE_READ_FAILED, ex.reasonCode());
        }

        @Test
        @DisplayName("Validate parses without solving")
        void testValidate() {
            assertEquals(PlannerResultCode.SUCCESS, planner.validate(
                    Fixtures.domain(Fixtures.FACTORY_AUTOMATION), Fixtures.problem(Fixtures.FACTORY_PRODUCTION)).getCode());
            // problem bound to another domain
            assertEquals(PlannerResultCode.PARSE_ERROR, planner.validate(
                    Fixtures.domain(Fixtures.BLOCKS_WORLD), Fixtures.problem(Fixtures.SIMPLE_DELIVERY)).getCode());
        }
    }

    @Test
    @DisplayName("Per-call search config overrides the planner's")
    void testSearchOverride() {
        Task task = Fixtures.simpleDelivery();
        SearchResult limited = planner.solve(task, SearchConfig.builder().maxExpansions(1).build());

        assertFalse(limited.isSolution());
        assertEquals(SearchResult.FailureReason.BUDGET_EXCEEDED, limited.failureReason().orElseThrow());
        assertTrue(planner.solve(task).isSolution());
    }

    @Test
    @DisplayName("Info reports version and configured search")
    void testInfo() {
        PlannerInfo info = planner.info();
        assertEquals(TemporalPlanner.VERSION, info.getVersion());
        assertEquals("A_STAR + TEMPORAL_MAX", info.getAlgorithm());
        assertTrue(info.isSupportsDurativeActions());
        assertTrue(info.isSupportsNumericFluents());

        TemporalPlanner ucs = new TemporalPlanner(PlannerConfig.builder()
                .search(SearchConfig.builder().algorithm(SearchAlgorithm.UNIFORM_COST).heuristic(HeuristicType.TEMPORAL_FF).build())
                .build());
        assertEquals("UNIFORM_COST + NONE", ucs.info().getAlgorithm());
    }
}
