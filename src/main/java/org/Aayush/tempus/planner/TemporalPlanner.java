package org.Aayush.tempus.planner;

import lombok.extern.slf4j.Slf4j;
import org.Aayush.tempus.pddl.PddlParseException;
import org.Aayush.tempus.pddl.PddlParser;
import org.Aayush.tempus.search.SearchConfig;
import org.Aayush.tempus.search.SearchResult;
import org.Aayush.tempus.search.TemporalBestFirstSearch;
import org.Aayush.tempus.state.TransitionModel;
import org.Aayush.tempus.task.Task;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Planner facade: parse, ground, search.
 *
 * <p>Execution flow of one solve:</p>
 * <ul>
 * <li>Parse domain and problem text into an immutable {@link Task}.</li>
 * <li>Ground it into a {@link TransitionModel}.</li>
 * <li>Run {@link TemporalBestFirstSearch} with the configured algorithm, heuristic and budget.</li>
 * </ul>
 *
 * <p>Instances hold only configuration and are thread-safe.</p>
 */
@Slf4j
public final class TemporalPlanner implements PlannerService {
    public static final String VERSION = "0.1.0";

    public static final String REASON_TASK_REQUIRED = "P01_TASK_REQUIRED";
    public static final String REASON_CONFIG_REQUIRED = "P01_CONFIG_REQUIRED";
    public static final String REASON_TEXT_REQUIRED = "P01_TEXT_REQUIRED";
    public static final String REASON_FILE_READ_FAILED = "P02_FILE_READ_FAILED";

    private final PddlParser parser = new PddlParser();
    private final PlannerConfig config;

    public TemporalPlanner() {
        this(PlannerConfig.defaults());
    }

    public TemporalPlanner(PlannerConfig config) {
        if (config == null || config.getSearch() == null || config.getCharset() == null) {
            throw new PlannerException(REASON_CONFIG_REQUIRED, "planner config with search settings and charset must be provided");
        }
        this.config = config;
    }

    public PlannerConfig config() {
        return config;
    }

    @Override
    public Task parse(String domainText, String problemText) {
        requireText(domainText, "domain");
        requireText(problemText, "problem");
        return parser.parse(domainText, problemText);
    }

    /**
     * Reads and parses a domain and problem file.
     *
     * @throws PlannerException with {@link #REASON_FILE_READ_FAILED} when a file cannot be read.
     */
    public Task parseFiles(Path domainFile, Path problemFile) {
        return parse(read(domainFile), read(problemFile));
    }

    @Override
    public SearchResult solve(Task task) {
        return solve(task, config.getSearch());
    }

    /**
     * Solves with search settings overriding the planner's own.
     */
    public SearchResult solve(Task task, SearchConfig searchConfig) {
        if (task == null) {
            throw new PlannerException(REASON_TASK_REQUIRED, "task must be provided");
        }
        if (searchConfig == null) {
            throw new PlannerException(REASON_CONFIG_REQUIRED, "search config must be provided");
        }
        TransitionModel model = new TransitionModel(task);
        return new TemporalBestFirstSearch(model, searchConfig).solve();
    }

    @Override
    public PlannerOutcome solveFromText(String domainText, String problemText) {
        Task task;
        try {
            task = parse(domainText, problemText);
        } catch (PddlParseException ex) {
            log.debug("Parse failed: {}", ex.getMessage());
            return PlannerOutcome.error(PlannerResultCode.PARSE_ERROR, ex.getMessage());
        }
        return PlannerOutcome.of(solve(task));
    }

    @Override
    public PlannerOutcome solveFromPaths(Path domainFile, Path problemFile) {
        String domainText;
        String problemText;
        try {
            domainText = read(domainFile);
            problemText = read(problemFile);
        } catch (PlannerException ex) {
            log.debug("File read failed: {}", ex.getMessage());
            return PlannerOutcome.error(PlannerResultCode.FILE_ERROR, ex.getMessage());
        }
        return solveFromText(domainText, problemText);
    }

    /**
     * Parses without solving.
     *
     * @return {@link PlannerResultCode#SUCCESS} or {@link PlannerResultCode#PARSE_ERROR}.
     */
    public PlannerOutcome validate(String domainText, String problemText) {
        try {
            parse(domainText, problemText);
            return PlannerOutcome.valid();
        } catch (PddlParseException ex) {
            return PlannerOutcome.error(PlannerResultCode.PARSE_ERROR, ex.getMessage());
        }
    }

    @Override
    public PlannerInfo info() {
        SearchConfig search = config.getSearch();
        return PlannerInfo.builder()
                .version(VERSION)
                .algorithm(search.getAlgorithm() + " + " + search.effectiveHeuristic())
                .supportsDurativeActions(true)
                .supportsNumericFluents(true)
                .build();
    }

    private String read(Path file) {
        if (file == null) {
            throw new PlannerException(REASON_FILE_READ_FAILED, "file path must be provided");
        }
        try {
            return Files.readString(file, config.getCharset());
        } catch (IOException ex) {
            throw new PlannerException(REASON_FILE_READ_FAILED, "cannot read " + file + ": " + ex.getMessage(), ex);
        }
    }

    private static void requireText(String text, String what) {
        if (text == null) {
            throw new PlannerException(REASON_TEXT_REQUIRED, what + " text must be provided");
        }
    }
}
