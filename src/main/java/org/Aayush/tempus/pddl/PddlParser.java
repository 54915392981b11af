package org.Aayush.tempus.pddl;

import lombok.extern.slf4j.Slf4j;
import org.Aayush.tempus.task.Domain;
import org.Aayush.tempus.task.Problem;
import org.Aayush.tempus.task.Task;

/**
 * Entry point turning domain and problem text into a validated {@link Task}.
 *
 * <p>Parsing is pure: callers supply text already read from wherever it lives. Every
 * failure is a {@link PddlParseException} with a distinct {@link ParseErrorKind}.</p>
 *
 * <p>Instances are stateless and thread-safe.</p>
 */
@Slf4j
public final class PddlParser {

    /**
     * Parses a domain and a problem and merges them into one task.
     *
     * @param domainText domain definition text.
     * @param problemText problem definition text for that domain.
     * @return immutable task.
     * @throws PddlParseException when either text is malformed or inconsistent.
     */
    public Task parse(String domainText, String problemText) {
        DomainReader domainReader = new DomainReader();
        Domain domain = domainReader.read(new SExpressionReader(DomainReader.SOURCE).readSingle(domainText));
        Problem problem = new ProblemReader(domain, domainReader.declarations())
                .read(new SExpressionReader(ProblemReader.SOURCE).readSingle(problemText));
        Task task = problem.toTask(domain);
        log.debug("Parsed domain '{}' ({} types, {} predicates, {} functions, {} actions) with problem '{}' ({} objects, {} facts, {} fluents)",
                domain.getName(),
                domain.getTypes().typeNames().size(),
                domain.getPredicates().size(),
                domain.getFunctions().size(),
                domain.getActions().size(),
                problem.getName(),
                task.getObjects().size(),
                problem.getInitialFacts().size(),
                problem.getInitialFluents().size());
        return task;
    }

    /**
     * Parses a domain on its own, for validation or inspection.
     */
    public Domain parseDomain(String domainText) {
        return new DomainReader().read(new SExpressionReader(DomainReader.SOURCE).readSingle(domainText));
    }
}
