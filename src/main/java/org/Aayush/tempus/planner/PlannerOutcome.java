package org.Aayush.tempus.planner;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.Value;
import org.Aayush.tempus.search.Plan;
import org.Aayush.tempus.search.SearchResult;

import java.util.Objects;
import java.util.Optional;

/**
 * Flat result of a text- or file-driven planning call.
 *
 * <p>{@code planLength} is the number of plan steps, 0 without a plan.</p>
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PlannerOutcome {
    PlannerResultCode code;
    @Getter(AccessLevel.NONE)
    Plan plan;
    int planLength;
    @Getter(AccessLevel.NONE)
    String errorMessage;
    @Getter(AccessLevel.NONE)
    SearchResult searchResult;

    static PlannerOutcome of(SearchResult result) {
        Objects.requireNonNull(result, "result");
        if (result.isSolution()) {
            Plan plan = result.plan().orElseThrow();
            return new PlannerOutcome(PlannerResultCode.SOLUTION_FOUND, plan, plan.size(), null, result);
        }
        return new PlannerOutcome(PlannerResultCode.NO_SOLUTION, null, 0, null, result);
    }

    static PlannerOutcome valid() {
        return new PlannerOutcome(PlannerResultCode.SUCCESS, null, 0, null, null);
    }

    static PlannerOutcome error(PlannerResultCode code, String message) {
        return new PlannerOutcome(code, null, 0, message, null);
    }

    public Optional<Plan> plan() {
        return Optional.ofNullable(plan);
    }

    public Optional<String> errorMessage() {
        return Optional.ofNullable(errorMessage);
    }

    /**
     * Search result behind a solve outcome; empty for parse and file errors.
     */
    public Optional<SearchResult> searchResult() {
        return Optional.ofNullable(searchResult);
    }
}
