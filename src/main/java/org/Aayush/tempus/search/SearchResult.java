package org.Aayush.tempus.search;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.Value;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one search: a solution with its plan, or a failure.
 *
 * <p>A failure is a valid outcome, not an error. {@link FailureReason} tells an exhausted
 * search apart from one stopped by its budget.</p>
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SearchResult {

    public enum FailureReason {
        /** The frontier emptied; no plan exists under the configured pruning. */
        EXHAUSTED,
        /** An expansion or time bound stopped the search. */
        BUDGET_EXCEEDED,
        /** The search thread was interrupted. */
        INTERRUPTED
    }

    @Getter(AccessLevel.NONE)
    Plan plan;
    @Getter(AccessLevel.NONE)
    FailureReason failureReason;
    /** Budget reason code or other detail for failures, null for solutions. */
    String detail;
    SearchStatistics statistics;

    public static SearchResult solution(Plan plan, SearchStatistics statistics) {
        return new SearchResult(Objects.requireNonNull(plan, "plan"), null, null, statistics);
    }

    public static SearchResult failure(FailureReason reason, String detail, SearchStatistics statistics) {
        return new SearchResult(null, Objects.requireNonNull(reason, "reason"), detail, statistics);
    }

    public boolean isSolution() {
        return plan != null;
    }

    public Optional<Plan> plan() {
        return Optional.ofNullable(plan);
    }

    public Optional<FailureReason> failureReason() {
        return Optional.ofNullable(failureReason);
    }
}
