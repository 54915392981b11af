package org.Aayush.tempus.pddl;

import org.Aayush.tempus.task.Atom;
import org.Aayush.tempus.task.Domain;
import org.Aayush.tempus.task.FluentAssignment;
import org.Aayush.tempus.task.Metric;
import org.Aayush.tempus.task.NumericExpression;
import org.Aayush.tempus.task.PddlObject;
import org.Aayush.tempus.task.PredicateSignature;
import org.Aayush.tempus.task.Problem;
import org.Aayush.tempus.task.TypedParameter;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Interprets a {@code (define (problem ...) ...)} tree against an already-read domain.
 */
final class ProblemReader {
    static final String SOURCE = "problem";
    private static final String TOTAL_TIME = "total-time";

    private final Domain domain;
    private final Declarations declarations;
    private final FormulaReader formulas;

    ProblemReader(Domain domain, Declarations domainDeclarations) {
        this.domain = domain;
        this.declarations = domainDeclarations.forSource(SOURCE);
        this.formulas = new FormulaReader(declarations);
    }

    Problem read(SExpression root) {
        String name = DomainReader.readHeader(root, SOURCE);
        Problem.ProblemBuilder builder = Problem.builder().name(name);

        SExpression domainSection = null;
        SExpression objectsSection = null;
        SExpression initSection = null;
        SExpression goalSection = null;
        SExpression metricSection = null;
        for (int i = 2; i < root.size(); i++) {
            SExpression section = root.get(i);
            String keyword = section.head();
            if (keyword == null) {
                throw declarations.error(ParseErrorKind.SYNTAX, section, section.toString(), "expected a (:section ...) form");
            }
            switch (keyword) {
                case ":domain" -> domainSection = section;
                case ":requirements" -> {
                    // requirements of the domain govern; problem flags are accepted and ignored
                }
                case ":objects" -> objectsSection = section;
                case ":init" -> initSection = section;
                case ":goal" -> goalSection = section;
                case ":metric" -> metricSection = section;
                case ":constraints" -> throw declarations.error(ParseErrorKind.UNSUPPORTED_CONSTRUCT, section, keyword,
                        "problem constraints are not supported");
                default -> throw declarations.error(ParseErrorKind.UNEXPECTED_SECTION, section, keyword,
                        "unexpected problem section '" + keyword + "'");
            }
        }

        if (domainSection == null || domainSection.size() != 2 || !domainSection.get(1).isAtom()) {
            throw declarations.error(ParseErrorKind.SYNTAX, domainSection == null ? root : domainSection, ":domain",
                    "problem '" + name + "' must name its domain with (:domain <name>)");
        }
        String domainName = domainSection.get(1).atom();
        if (!domainName.equals(domain.getName())) {
            throw declarations.error(ParseErrorKind.DOMAIN_NAME_MISMATCH, domainSection, domainName,
                    "problem '" + name + "' targets domain '" + domainName + "' but domain '" + domain.getName() + "' was given");
        }
        builder.domainName(domainName);

        if (objectsSection != null) {
            readObjects(objectsSection, builder);
        }
        if (initSection != null) {
            readInit(initSection, builder);
        }
        if (goalSection == null || goalSection.size() != 2) {
            throw declarations.error(ParseErrorKind.SYNTAX, goalSection == null ? root : goalSection, ":goal",
                    "problem '" + name + "' needs exactly one (:goal <formula>)");
        }
        builder.goal(formulas.readCondition(goalSection.get(1), FormulaReader.Scope.GROUND));
        if (metricSection != null) {
            builder.metric(readMetric(metricSection));
        }
        return builder.build();
    }

    private void readObjects(SExpression section, Problem.ProblemBuilder builder) {
        for (TypedParameter object : declarations.readTypedList(section, 1, false)) {
            declarations.requireType(object.type(), section);
            if (declarations.objects.putIfAbsent(object.name(), object.type()) != null) {
                throw declarations.error(ParseErrorKind.DUPLICATE_OBJECT, section, object.name(),
                        "object '" + object.name() + "' declared twice or shadows a constant");
            }
            builder.object(new PddlObject(object.name(), object.type()));
        }
    }

    private void readInit(SExpression section, Problem.ProblemBuilder builder) {
        Set<String> assignedFluents = new HashSet<>();
        for (int i = 1; i < section.size(); i++) {
            SExpression entry = section.get(i);
            String head = entry.head();
            if (head == null) {
                throw declarations.error(ParseErrorKind.SYNTAX, entry, entry.toString(), "expected a fact or (= (f ...) value)");
            }
            if ("=".equals(head) && entry.size() == 3 && entry.get(1).isList()) {
                NumericExpression.FluentTerm fluent = formulas.readFluent(entry.get(1), FormulaReader.Scope.GROUND);
                checkArgumentTypes(entry, fluent.function(), fluent.arguments(),
                        declarations.functions.get(fluent.function()).parameters());
                if (!entry.get(2).isAtom()) {
                    throw declarations.error(ParseErrorKind.INVALID_NUMBER, entry.get(2), entry.get(2).toString(),
                            "initial fluent values must be numbers");
                }
                if (!assignedFluents.add(fluent.signature())) {
                    throw declarations.error(ParseErrorKind.SYNTAX, entry, fluent.signature(),
                            "fluent " + fluent.signature() + " is initialized twice");
                }
                builder.initialFluent(new FluentAssignment(fluent, formulas.readNumber(entry.get(2))));
                continue;
            }
            if ("at".equals(head) && entry.size() == 3 && entry.get(1).isAtom() && entry.get(2).isList()) {
                throw declarations.error(ParseErrorKind.UNSUPPORTED_CONSTRUCT, entry, "at", "timed initial literals are not supported");
            }
            if ("not".equals(head)) {
                // closed world: negative initial facts are implied
                continue;
            }
            Atom fact = formulas.readAtom(entry, FormulaReader.Scope.GROUND);
            PredicateSignature signature = declarations.predicates.get(fact.predicate());
            checkArgumentTypes(entry, fact.predicate(), fact.arguments(), signature.parameters());
            builder.initialFact(fact);
        }
    }

    private void checkArgumentTypes(SExpression at, String symbol, List<String> arguments, List<TypedParameter> parameters) {
        for (int i = 0; i < arguments.size(); i++) {
            String object = arguments.get(i);
            String actual = declarations.objects.get(object);
            String expected = parameters.get(i).type();
            if (!declarations.types.isSubtypeOf(actual, expected)) {
                throw declarations.error(ParseErrorKind.TYPE_MISMATCH, at, object,
                        "argument " + (i + 1) + " of '" + symbol + "' expects type '" + expected
                                + "' but '" + object + "' is '" + actual + "'");
            }
        }
    }

    private Metric readMetric(SExpression section) {
        if (section.size() != 3 || !section.get(1).isAtom()) {
            throw declarations.error(ParseErrorKind.SYNTAX, section, ":metric", "expected (:metric minimize|maximize <expression>)");
        }
        Metric.Direction direction = switch (section.get(1).atom()) {
            case "minimize" -> Metric.Direction.MINIMIZE;
            case "maximize" -> Metric.Direction.MAXIMIZE;
            default -> throw declarations.error(ParseErrorKind.SYNTAX, section.get(1), section.get(1).atom(),
                    "metric direction must be minimize or maximize");
        };
        return new Metric(direction, readMetricExpression(section.get(2)));
    }

    private NumericExpression readMetricExpression(SExpression expression) {
        if (expression.isList() && expression.size() == 1 && TOTAL_TIME.equals(expression.head())
                && !declarations.functions.containsKey(TOTAL_TIME)) {
            return new NumericExpression.FluentTerm(TOTAL_TIME, List.of());
        }
        if (expression.isAtom() && TOTAL_TIME.equals(expression.atom())) {
            return new NumericExpression.FluentTerm(TOTAL_TIME, List.of());
        }
        return formulas.readNumeric(expression, FormulaReader.Scope.GROUND);
    }
}
