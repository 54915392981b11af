package org.Aayush.tempus.planner;

import org.Aayush.tempus.search.SearchResult;
import org.Aayush.tempus.task.Task;

import java.nio.file.Path;

/**
 * Public planning contract.
 *
 * <p>Parsing failures surface as reason-coded exceptions from {@link #parse}; the
 * convenience compositions fold every failure into a {@link PlannerOutcome} code instead.</p>
 */
public interface PlannerService {
    /**
     * Parses domain and problem text into a task.
     *
     * @throws org.Aayush.tempus.pddl.PddlParseException when the text is invalid.
     */
    Task parse(String domainText, String problemText);

    /**
     * Searches for a plan for a parsed task.
     */
    SearchResult solve(Task task);

    /**
     * Parses then solves, reporting parse errors as {@link PlannerResultCode#PARSE_ERROR}.
     */
    PlannerOutcome solveFromText(String domainText, String problemText);

    /**
     * Reads, parses then solves, reporting unreadable files as {@link PlannerResultCode#FILE_ERROR}.
     */
    PlannerOutcome solveFromPaths(Path domainFile, Path problemFile);

    PlannerInfo info();
}
