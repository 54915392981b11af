package org.Aayush.tempus.search;

import lombok.Builder;
import lombok.Value;
import org.Aayush.tempus.heuristic.HeuristicType;

import java.util.Locale;

/**
 * Search configuration.
 *
 * <p>Bounds of zero or less mean unbounded. {@link #defaults()} reads the
 * {@code tempus.search.*} system properties and falls back to the builder defaults when a
 * property is absent or malformed.</p>
 */
@Value
@Builder(toBuilder = true)
public class SearchConfig {
    static final String PROP_MAX_EXPANSIONS = "tempus.search.maxExpansions";
    static final String PROP_TIMEOUT_MILLIS = "tempus.search.timeoutMillis";
    static final String PROP_PARALLELISM = "tempus.search.parallelism";
    static final String PROP_HEURISTIC = "tempus.search.heuristic";
    static final String PROP_ALGORITHM = "tempus.search.algorithm";

    @Builder.Default
    SearchAlgorithm algorithm = SearchAlgorithm.A_STAR;
    @Builder.Default
    HeuristicType heuristic = HeuristicType.TEMPORAL_MAX;
    @Builder.Default
    CostModel costModel = CostModel.DURATION;
    @Builder.Default
    DuplicateDetection duplicateDetection = DuplicateDetection.STATE_FINGERPRINT;
    /** Maximum node expansions. */
    @Builder.Default
    int maxExpansions = 0;
    /** Wall-clock limit in milliseconds. */
    @Builder.Default
    long timeoutMillis = 0L;
    /** Worker threads evaluating successors; 1 runs everything on the calling thread. */
    @Builder.Default
    int parallelism = 1;

    /**
     * Loads configuration from deterministic system properties.
     */
    public static SearchConfig defaults() {
        SearchConfig fallback = SearchConfig.builder().build();
        return SearchConfig.builder()
                .algorithm(readEnum(PROP_ALGORITHM, SearchAlgorithm.class, fallback.getAlgorithm()))
                .heuristic(readEnum(PROP_HEURISTIC, HeuristicType.class, fallback.getHeuristic()))
                .maxExpansions((int) readLong(PROP_MAX_EXPANSIONS, fallback.getMaxExpansions()))
                .timeoutMillis(readLong(PROP_TIMEOUT_MILLIS, fallback.getTimeoutMillis()))
                .parallelism((int) readLong(PROP_PARALLELISM, fallback.getParallelism()))
                .build();
    }

    /**
     * Heuristic actually bound: uniform-cost search never consults one.
     */
    public HeuristicType effectiveHeuristic() {
        return algorithm == SearchAlgorithm.UNIFORM_COST ? HeuristicType.NONE : heuristic;
    }

    private static long readLong(String property, long fallback) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            long value = Long.parseLong(raw.trim());
            return value > Integer.MAX_VALUE && !PROP_TIMEOUT_MILLIS.equals(property) ? fallback : value;
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }

    private static <E extends Enum<E>> E readEnum(String property, Class<E> type, E fallback) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Enum.valueOf(type, raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return fallback;
        }
    }
}
