package org.Aayush.tempus.pddl;

import org.Aayush.tempus.task.Action;
import org.Aayush.tempus.task.Domain;
import org.Aayush.tempus.task.DurationConstraint;
import org.Aayush.tempus.task.Effect;
import org.Aayush.tempus.task.Formula;
import org.Aayush.tempus.task.FunctionSignature;
import org.Aayush.tempus.task.NumericExpression;
import org.Aayush.tempus.task.PddlObject;
import org.Aayush.tempus.task.PredicateSignature;
import org.Aayush.tempus.task.TypeHierarchy;
import org.Aayush.tempus.task.TypedParameter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Interprets a {@code (define (domain ...) ...)} tree.
 *
 * <p>Declaration sections are read before any action, so actions may appear anywhere in
 * the file.</p>
 */
final class DomainReader {
    static final String SOURCE = "domain";

    private final Declarations declarations = new Declarations(SOURCE);
    private final FormulaReader formulas = new FormulaReader(declarations);

    Declarations declarations() {
        return declarations;
    }

    Domain read(SExpression root) {
        String name = readHeader(root, "domain");
        Domain.DomainBuilder builder = Domain.builder().name(name);

        List<SExpression> actionSections = new ArrayList<>();
        for (int i = 2; i < root.size(); i++) {
            SExpression section = root.get(i);
            String keyword = section.head();
            if (keyword == null) {
                throw declarations.error(ParseErrorKind.SYNTAX, section, section.toString(), "expected a (:section ...) form");
            }
            switch (keyword) {
                case ":requirements" -> readRequirements(section, builder);
                case ":types" -> readTypes(section);
                case ":constants" -> readConstants(section);
                case ":predicates" -> readPredicates(section);
                case ":functions" -> readFunctions(section);
                case ":action", ":durative-action" -> actionSections.add(section);
                case ":derived", ":process", ":event", ":constraints" -> throw declarations.error(
                        ParseErrorKind.UNSUPPORTED_CONSTRUCT, section, keyword, "section '" + keyword + "' is not supported");
                default -> throw declarations.error(
                        ParseErrorKind.UNEXPECTED_SECTION, section, keyword, "unexpected domain section '" + keyword + "'");
            }
        }

        Set<String> actionNames = new HashSet<>();
        for (SExpression section : actionSections) {
            Action action = readAction(section);
            if (!actionNames.add(action.getName())) {
                throw declarations.error(ParseErrorKind.DUPLICATE_ACTION, section, action.getName(),
                        "action '" + action.getName() + "' declared twice");
            }
            builder.action(action);
        }

        declarations.objects.forEach((objectName, type) -> builder.constant(new PddlObject(objectName, type)));
        return builder
                .types(declarations.types)
                .predicates(Collections.unmodifiableMap(new LinkedHashMap<>(declarations.predicates)))
                .functions(Collections.unmodifiableMap(new LinkedHashMap<>(declarations.functions)))
                .build();
    }

    /**
     * Validates {@code (define (kind name) ...)} and returns the name.
     */
    static String readHeader(SExpression root, String kind) {
        Declarations context = new Declarations(kind);
        if (!"define".equals(root.head()) || root.size() < 2) {
            throw context.error(ParseErrorKind.SYNTAX, root, root.head(), "expected (define (" + kind + " <name>) ...)");
        }
        SExpression header = root.get(1);
        if (!kind.equals(header.head()) || header.size() != 2 || !header.get(1).isAtom()) {
            throw context.error(ParseErrorKind.SYNTAX, header, header.toString(), "expected (" + kind + " <name>)");
        }
        return header.get(1).atom();
    }

    private void readRequirements(SExpression section, Domain.DomainBuilder builder) {
        for (int i = 1; i < section.size(); i++) {
            SExpression flag = section.get(i);
            if (!flag.isAtom() || !flag.atom().startsWith(":")) {
                throw declarations.error(ParseErrorKind.SYNTAX, flag, flag.toString(), "requirement flags start with ':'");
            }
            builder.requirement(flag.atom());
        }
    }

    private void readTypes(SExpression section) {
        Map<String, String> parents = new LinkedHashMap<>();
        Set<String> explicit = new HashSet<>();
        for (TypedParameter entry : declarations.readTypedList(section, 1, false)) {
            String type = entry.name();
            if (TypeHierarchy.ROOT.equals(type)) {
                continue;
            }
            if (!explicit.add(type)) {
                throw declarations.error(ParseErrorKind.DUPLICATE_TYPE, section, type, "type '" + type + "' declared twice");
            }
            parents.put(type, entry.type());
            // parent types named only after '-' are declared implicitly under the root
            if (!TypeHierarchy.ROOT.equals(entry.type())) {
                parents.putIfAbsent(entry.type(), TypeHierarchy.ROOT);
            }
        }
        for (String type : parents.keySet()) {
            Set<String> seen = new HashSet<>();
            String cursor = type;
            while (cursor != null && !TypeHierarchy.ROOT.equals(cursor)) {
                if (!seen.add(cursor)) {
                    throw declarations.error(ParseErrorKind.SYNTAX, section, type, "cyclic type hierarchy through '" + type + "'");
                }
                cursor = parents.get(cursor);
            }
        }
        declarations.types = new TypeHierarchy(parents);
    }

    private void readConstants(SExpression section) {
        for (TypedParameter constant : declarations.readTypedList(section, 1, false)) {
            declarations.requireType(constant.type(), section);
            if (declarations.objects.putIfAbsent(constant.name(), constant.type()) != null) {
                throw declarations.error(ParseErrorKind.DUPLICATE_OBJECT, section, constant.name(),
                        "constant '" + constant.name() + "' declared twice");
            }
        }
    }

    private void readPredicates(SExpression section) {
        for (int i = 1; i < section.size(); i++) {
            SExpression declaration = section.get(i);
            String name = declaration.head();
            if (name == null) {
                throw declarations.error(ParseErrorKind.SYNTAX, declaration, declaration.toString(), "expected (predicate ?x - type ...)");
            }
            List<TypedParameter> parameters = readParameters(declaration, 1);
            if (declarations.predicates.putIfAbsent(name, new PredicateSignature(name, parameters)) != null) {
                throw declarations.error(ParseErrorKind.DUPLICATE_PREDICATE, declaration, name,
                        "predicate '" + name + "' declared twice");
            }
        }
    }

    private void readFunctions(SExpression section) {
        for (int i = 1; i < section.size(); i++) {
            SExpression declaration = section.get(i);
            if (declaration.isAtom("-")) {
                // result type annotation such as "- number"
                i++;
                continue;
            }
            String name = declaration.head();
            if (name == null) {
                throw declarations.error(ParseErrorKind.SYNTAX, declaration, declaration.toString(), "expected (function ?x - type ...)");
            }
            List<TypedParameter> parameters = readParameters(declaration, 1);
            if (declarations.functions.putIfAbsent(name, new FunctionSignature(name, parameters)) != null) {
                throw declarations.error(ParseErrorKind.DUPLICATE_FUNCTION, declaration, name,
                        "function '" + name + "' declared twice");
            }
        }
    }

    private List<TypedParameter> readParameters(SExpression list, int from) {
        List<TypedParameter> parameters = declarations.readTypedList(list, from, true);
        Set<String> names = new HashSet<>();
        for (TypedParameter parameter : parameters) {
            declarations.requireType(parameter.type(), list);
            if (!names.add(parameter.name())) {
                throw declarations.error(ParseErrorKind.SYNTAX, list, parameter.name(),
                        "parameter '" + parameter.name() + "' declared twice");
            }
        }
        return parameters;
    }

    private Action readAction(SExpression section) {
        boolean durative = ":durative-action".equals(section.head());
        if (section.size() < 2 || !section.get(1).isAtom()) {
            throw declarations.error(ParseErrorKind.SYNTAX, section, section.head(), "action needs a name");
        }
        String name = section.get(1).atom();
        Map<String, SExpression> fields = new LinkedHashMap<>();
        for (int i = 2; i < section.size(); i += 2) {
            SExpression key = section.get(i);
            if (!key.isAtom() || !key.atom().startsWith(":") || i + 1 >= section.size()) {
                throw declarations.error(ParseErrorKind.SYNTAX, key, key.toString(),
                        "expected ':keyword value' pairs in action '" + name + "'");
            }
            if (!allowedField(key.atom(), durative)) {
                throw declarations.error(ParseErrorKind.UNEXPECTED_SECTION, key, key.atom(),
                        "unexpected field '" + key.atom() + "' in action '" + name + "'");
            }
            if (fields.put(key.atom(), section.get(i + 1)) != null) {
                throw declarations.error(ParseErrorKind.SYNTAX, key, key.atom(),
                        "field '" + key.atom() + "' repeated in action '" + name + "'");
            }
        }

        List<TypedParameter> parameters = List.of();
        SExpression parameterList = fields.get(":parameters");
        if (parameterList != null) {
            if (!parameterList.isList()) {
                throw declarations.error(ParseErrorKind.SYNTAX, parameterList, parameterList.atom(), "parameters must be a list");
            }
            parameters = readParameters(parameterList, 0);
        }
        Map<String, String> variables = new LinkedHashMap<>();
        parameters.forEach(p -> variables.put(p.name(), p.type()));
        FormulaReader.Scope scope = new FormulaReader.Scope(variables, durative);

        Action.ActionBuilder builder = Action.builder()
                .name(name)
                .parameters(parameters)
                .durative(durative);

        if (durative) {
            SExpression duration = fields.get(":duration");
            if (duration == null) {
                throw declarations.error(ParseErrorKind.INVALID_DURATION, section, name,
                        "durative action '" + name + "' has no :duration");
            }
            builder.duration(readDuration(duration, new FormulaReader.Scope(variables, false), name));
            SExpression condition = fields.get(":condition");
            if (condition != null) {
                readTimedConditions(condition, scope, builder, null);
            }
            SExpression effect = fields.get(":effect");
            if (effect != null) {
                readTimedEffects(effect, scope, builder, null);
            }
        } else {
            builder.duration(DurationConstraint.INSTANTANEOUS);
            SExpression precondition = fields.get(":precondition");
            if (precondition != null) {
                addConjuncts(formulas.readCondition(precondition, scope), builder::conditionAtStart);
            }
            SExpression effect = fields.get(":effect");
            if (effect != null) {
                readEffect(effect, scope, builder::effectAtStart);
            }
        }
        return builder.build();
    }

    private static boolean allowedField(String keyword, boolean durative) {
        if (":parameters".equals(keyword) || ":effect".equals(keyword)) {
            return true;
        }
        return durative
                ? ":duration".equals(keyword) || ":condition".equals(keyword)
                : ":precondition".equals(keyword);
    }

    private DurationConstraint readDuration(SExpression expression, FormulaReader.Scope scope, String action) {
        NumericExpression[] bounds = new NumericExpression[2];
        boolean[] fixed = new boolean[1];
        if (expression.isAtom()) {
            NumericExpression value = new NumericExpression.Constant(formulas.readNumber(expression));
            bounds[0] = value;
            bounds[1] = value;
            fixed[0] = true;
        } else {
            readDurationBounds(expression, scope, bounds, fixed);
        }
        if (bounds[0] == null && bounds[1] == null) {
            throw declarations.error(ParseErrorKind.INVALID_DURATION, expression, action,
                    "duration of '" + action + "' constrains neither bound");
        }
        DurationConstraint constraint = fixed[0] && bounds[0] == bounds[1]
                ? DurationConstraint.fixed(bounds[0])
                : new DurationConstraint(bounds[0], bounds[1]);
        validateConstantBounds(constraint, expression, action);
        return constraint;
    }

    private void readDurationBounds(SExpression expression, FormulaReader.Scope scope, NumericExpression[] bounds, boolean[] fixed) {
        String head = expression.head();
        if ("and".equals(head)) {
            for (int i = 1; i < expression.size(); i++) {
                readDurationBounds(expression.get(i), scope, bounds, fixed);
            }
            return;
        }
        if (FormulaReader.temporalQualifier(expression) != null) {
            throw declarations.error(ParseErrorKind.UNSUPPORTED_CONSTRUCT, expression, head,
                    "timed duration constraints are not supported");
        }
        if (head == null || expression.size() != 3 || !expression.get(1).isAtom(FormulaReader.DURATION_VARIABLE)) {
            throw declarations.error(ParseErrorKind.SYNTAX, expression, expression.toString(),
                    "expected (= ?duration <expression>) or a bound on ?duration");
        }
        NumericExpression value = formulas.readNumeric(expression.get(2), scope);
        switch (head) {
            case "=" -> {
                bounds[0] = value;
                bounds[1] = value;
                fixed[0] = true;
            }
            case ">=" -> bounds[0] = value;
            case "<=" -> bounds[1] = value;
            default -> throw declarations.error(ParseErrorKind.UNSUPPORTED_CONSTRUCT, expression, head,
                    "duration comparator '" + head + "' is not supported");
        }
    }

    private void validateConstantBounds(DurationConstraint constraint, SExpression at, String action) {
        OptionalDouble lower = constantOf(constraint.lower());
        OptionalDouble upper = constantOf(constraint.upper());
        if (upper.isPresent() && upper.getAsDouble() <= 0.0d) {
            throw declarations.error(ParseErrorKind.INVALID_DURATION, at, action,
                    "duration of durative action '" + action + "' must be positive, found " + upper.getAsDouble());
        }
        if (lower.isPresent() && lower.getAsDouble() < 0.0d) {
            throw declarations.error(ParseErrorKind.INVALID_DURATION, at, action,
                    "minimum duration of '" + action + "' is negative: " + lower.getAsDouble());
        }
        if (lower.isPresent() && upper.isPresent() && lower.getAsDouble() > upper.getAsDouble()) {
            throw declarations.error(ParseErrorKind.INVALID_DURATION, at, action,
                    "duration window of '" + action + "' is empty: [" + lower.getAsDouble() + ", " + upper.getAsDouble() + "]");
        }
    }

    private static OptionalDouble constantOf(NumericExpression expression) {
        if (expression instanceof NumericExpression.Constant constant) {
            return OptionalDouble.of(constant.value());
        }
        return OptionalDouble.empty();
    }

    /**
     * Splits a durative condition into its groups. Unqualified conjuncts are checked at start.
     */
    private void readTimedConditions(SExpression expression, FormulaReader.Scope scope, Action.ActionBuilder builder, String inherited) {
        if (expression.isList() && expression.size() == 0) {
            return;
        }
        if ("and".equals(expression.head())) {
            for (int i = 1; i < expression.size(); i++) {
                readTimedConditions(expression.get(i), scope, builder, inherited);
            }
            return;
        }
        String qualifier = FormulaReader.temporalQualifier(expression);
        if (qualifier != null) {
            readTimedConditions(expression.get(2), scope, builder, qualifier);
            return;
        }
        Formula condition = formulas.readCondition(expression, scope);
        String when = inherited == null ? "start" : inherited;
        switch (when) {
            case "all" -> addConjuncts(condition, builder::conditionOverAll);
            case "end" -> addConjuncts(condition, builder::conditionAtEnd);
            default -> addConjuncts(condition, builder::conditionAtStart);
        }
    }

    /**
     * Splits a durative effect into start and end groups. Unqualified effects happen at end.
     */
    private void readTimedEffects(SExpression expression, FormulaReader.Scope scope, Action.ActionBuilder builder, String inherited) {
        if (expression.isList() && expression.size() == 0) {
            return;
        }
        if ("and".equals(expression.head())) {
            for (int i = 1; i < expression.size(); i++) {
                readTimedEffects(expression.get(i), scope, builder, inherited);
            }
            return;
        }
        String qualifier = FormulaReader.temporalQualifier(expression);
        if (qualifier != null) {
            if ("all".equals(qualifier)) {
                throw declarations.error(ParseErrorKind.SYNTAX, expression, "over",
                        "effects cannot be qualified 'over all'");
            }
            readTimedEffects(expression.get(2), scope, builder, qualifier);
            return;
        }
        if ("start".equals(inherited)) {
            readEffect(expression, scope, builder::effectAtStart);
        } else {
            readEffect(expression, scope, builder::effectAtEnd);
        }
    }

    private void readEffect(SExpression expression, FormulaReader.Scope scope, Consumer<Effect> sink) {
        if (!expression.isList()) {
            throw declarations.error(ParseErrorKind.SYNTAX, expression, expression.atom(), "expected an effect list");
        }
        if (expression.size() == 0) {
            return;
        }
        String head = expression.head();
        if ("and".equals(head)) {
            for (int i = 1; i < expression.size(); i++) {
                readEffect(expression.get(i), scope, sink);
            }
            return;
        }
        if ("forall".equals(head) || "when".equals(head)) {
            throw declarations.error(ParseErrorKind.UNSUPPORTED_CONSTRUCT, expression, head,
                    "'" + head + "' effects are not supported");
        }
        if (FormulaReader.temporalQualifier(expression) != null) {
            throw declarations.error(ParseErrorKind.SYNTAX, expression, head,
                    "temporal qualifiers are only allowed in durative actions at the top of the effect");
        }
        if ("not".equals(head)) {
            formulas.requireSize(expression, 2);
            sink.accept(new Effect.Literal(formulas.readAtom(expression.get(1), scope), false));
            return;
        }
        Effect.NumericOperator operator = Effect.NumericOperator.fromKeyword(head);
        if (operator != null) {
            formulas.requireSize(expression, 3);
            sink.accept(new Effect.NumericUpdate(
                    operator,
                    formulas.readFluent(expression.get(1), scope),
                    formulas.readNumeric(expression.get(2), scope)
            ));
            return;
        }
        sink.accept(new Effect.Literal(formulas.readAtom(expression, scope), true));
    }

    private static void addConjuncts(Formula formula, Consumer<Formula> sink) {
        if (formula instanceof Formula.And and) {
            for (Formula operand : and.operands()) {
                addConjuncts(operand, sink);
            }
            return;
        }
        sink.accept(formula);
    }
}
