package org.Aayush.tempus.search;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Per-search bounds on expansions and wall-clock time.
 */
final class SearchBudget {
    static final int UNBOUNDED = Integer.MAX_VALUE;
    static final long UNBOUNDED_MILLIS = Long.MAX_VALUE;

    static final String REASON_EXPANSIONS_EXCEEDED = "S01_BUDGET_EXPANSIONS_EXCEEDED";
    static final String REASON_TIMEOUT_EXCEEDED = "S01_BUDGET_TIMEOUT_EXCEEDED";

    private final int maxExpansions;
    private final long timeoutMillis;
    private final long startNanos;

    private SearchBudget(int maxExpansions, long timeoutMillis, long startNanos) {
        this.maxExpansions = normalizeBound(maxExpansions);
        this.timeoutMillis = normalizeMillis(timeoutMillis);
        this.startNanos = startNanos;
    }

    /**
     * Starts a budget clock now.
     */
    static SearchBudget start(int maxExpansions, long timeoutMillis) {
        return new SearchBudget(maxExpansions, timeoutMillis, System.nanoTime());
    }

    /**
     * Validates the number of expansions performed so far, counting the one about to start.
     */
    void checkExpansions(int expansions) {
        if (expansions > maxExpansions) {
            throw new BudgetExceededException(
                    REASON_EXPANSIONS_EXCEEDED,
                    "expansion budget exceeded: " + expansions + " > " + maxExpansions
            );
        }
    }

    /**
     * Validates elapsed wall-clock time against the configured timeout.
     */
    void checkDeadline() {
        if (timeoutMillis == UNBOUNDED_MILLIS) {
            return;
        }
        long elapsed = elapsedMillis();
        if (elapsed > timeoutMillis) {
            throw new BudgetExceededException(
                    REASON_TIMEOUT_EXCEEDED,
                    "time budget exceeded: " + elapsed + "ms > " + timeoutMillis + "ms"
            );
        }
    }

    long elapsedMillis() {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }

    static int normalizeBound(int bound) {
        if (bound <= 0) {
            return UNBOUNDED;
        }
        return bound;
    }

    static long normalizeMillis(long millis) {
        if (millis <= 0L) {
            return UNBOUNDED_MILLIS;
        }
        return millis;
    }

    /**
     * Fail-fast signal raised at an expansion boundary; the search turns it into a failure result.
     */
    static final class BudgetExceededException extends RuntimeException {
        @Getter
        @Accessors(fluent = true)
        private final String reasonCode;

        BudgetExceededException(String reasonCode, String message) {
            super(message);
            this.reasonCode = reasonCode;
        }
    }
}
