package org.Aayush.tempus.search;

import org.Aayush.tempus.heuristic.HeuristicType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

@DisplayName("Search Config Tests")
class SearchConfigTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty(SearchConfig.PROP_MAX_EXPANSIONS);
        System.clearProperty(SearchConfig.PROP_TIMEOUT_MILLIS);
        System.clearProperty(SearchConfig.PROP_PARALLELISM);
        System.clearProperty(SearchConfig.PROP_HEURISTIC);
        System.clearProperty(SearchConfig.PROP_ALGORITHM);
    }

    @Test
    @DisplayName("Builder defaults: A* with critical path, duration cost, unbounded")
    void testBuilderDefaults() {
        SearchConfig config = SearchConfig.builder().build();

        assertEquals(SearchAlgorithm.A_STAR, config.getAlgorithm());
        assertEquals(HeuristicType.TEMPORAL_MAX, config.getHeuristic());
        assertEquals(CostModel.DURATION, config.getCostModel());
        assertEquals(DuplicateDetection.STATE_FINGERPRINT, config.getDuplicateDetection());
        assertEquals(0, config.getMaxExpansions());
        assertEquals(0L, config.getTimeoutMillis());
        assertEquals(1, config.getParallelism());
        assertEquals(config, SearchConfig.defaults());
    }

    @Test
    @DisplayName("System properties override defaults")
    void testPropertiesApplied() {
        System.setProperty(SearchConfig.PROP_MAX_EXPANSIONS, "500");
        System.setProperty(SearchConfig.PROP_TIMEOUT_MILLIS, "12000");
        System.setProperty(SearchConfig.PROP_PARALLELISM, "4");
        System.setProperty(SearchConfig.PROP_HEURISTIC, "temporal_ff");
        System.setProperty(SearchConfig.PROP_ALGORITHM, " GREEDY_BEST_FIRST ");

        SearchConfig config = SearchConfig.defaults();
        assertEquals(500, config.getMaxExpansions());
        assertEquals(12_000L, config.getTimeoutMillis());
        assertEquals(4, config.getParallelism());
        assertEquals(HeuristicType.TEMPORAL_FF, config.getHeuristic());
        assertEquals(SearchAlgorithm.GREEDY_BEST_FIRST, config.getAlgorithm());
    }

    @Test
    @DisplayName("Malformed properties fall back to defaults")
    void testMalformedPropertiesIgnored() {
        System.setProperty(SearchConfig.PROP_MAX_EXPANSIONS, "lots");
        System.setProperty(SearchConfig.PROP_PARALLELISM, "99999999999");
        System.setProperty(SearchConfig.PROP_HEURISTIC, "landmarks");

        SearchConfig config = SearchConfig.defaults();
        assertEquals(0, config.getMaxExpansions());
        assertEquals(1, config.getParallelism());
        assertEquals(HeuristicType.TEMPORAL_MAX, config.getHeuristic());
    }

    @Test
    @DisplayName("Uniform-cost search binds no heuristic")
    void testEffectiveHeuristic() {
        SearchConfig ucs = SearchConfig.builder().algorithm(SearchAlgorithm.UNIFORM_COST).build();
        assertEquals(HeuristicType.NONE, ucs.effectiveHeuristic());
        assertEquals(HeuristicType.TEMPORAL_MAX, ucs.getHeuristic());
        assertEquals(HeuristicType.TEMPORAL_FF,
                ucs.toBuilder().algorithm(SearchAlgorithm.A_STAR).heuristic(HeuristicType.TEMPORAL_FF).build().effectiveHeuristic());
    }
}
