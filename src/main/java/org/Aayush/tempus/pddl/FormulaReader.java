package org.Aayush.tempus.pddl;

import org.Aayush.tempus.task.Atom;
import org.Aayush.tempus.task.Formula;
import org.Aayush.tempus.task.FunctionSignature;
import org.Aayush.tempus.task.NumericExpression;
import org.Aayush.tempus.task.PredicateSignature;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Interprets condition formulas, atoms and numeric expressions against declared symbols.
 */
final class FormulaReader {
    static final String DURATION_VARIABLE = "?duration";
    static final String EQUALITY = "=";

    private final Declarations declarations;

    FormulaReader(Declarations declarations) {
        this.declarations = declarations;
    }

    /**
     * Variables visible to a formula.
     *
     * @param variables variable name to declared type.
     * @param durationAllowed whether {@code ?duration} may appear.
     */
    record Scope(Map<String, String> variables, boolean durationAllowed) {
        static final Scope GROUND = new Scope(Map.of(), false);
    }

    Formula readCondition(SExpression expression, Scope scope) {
        if (!expression.isList()) {
            throw declarations.error(ParseErrorKind.SYNTAX, expression, expression.atom(),
                    "expected a parenthesized formula, found '" + expression.atom() + "'");
        }
        if (expression.size() == 0) {
            return Formula.TRUE;
        }
        String head = expression.head();
        if (head == null) {
            throw declarations.error(ParseErrorKind.SYNTAX, expression, expression.toString(), "formula must start with a name");
        }
        switch (head) {
            case "and":
                return new Formula.And(readOperands(expression, scope));
            case "or":
                return new Formula.Or(readOperands(expression, scope));
            case "not":
                requireSize(expression, 2);
                return new Formula.Not(readCondition(expression.get(1), scope));
            case "imply":
                requireSize(expression, 3);
                return new Formula.Or(List.of(
                        new Formula.Not(readCondition(expression.get(1), scope)),
                        readCondition(expression.get(2), scope)
                ));
            case "forall":
            case "exists":
                throw declarations.error(ParseErrorKind.UNSUPPORTED_CONSTRUCT, expression, head,
                        "quantified formulas are not supported");
            default:
                break;
        }
        if (temporalQualifier(expression) != null) {
            throw declarations.error(ParseErrorKind.SYNTAX, expression, head,
                    "temporal qualifier '" + head + " " + expression.get(1).atom()
                            + "' is only allowed at the top of a durative condition or effect");
        }
        Formula.Comparator comparator = Formula.Comparator.fromSymbol(head);
        if (comparator != null) {
            requireSize(expression, 3);
            if (comparator == Formula.Comparator.EQUAL && isObjectTerm(expression.get(1)) && isObjectTerm(expression.get(2))) {
                return new Formula.AtomFormula(new Atom(EQUALITY, List.of(
                        readTerm(expression.get(1), scope),
                        readTerm(expression.get(2), scope)
                )));
            }
            return new Formula.Comparison(
                    comparator,
                    readNumeric(expression.get(1), scope),
                    readNumeric(expression.get(2), scope)
            );
        }
        return new Formula.AtomFormula(readAtom(expression, scope));
    }

    /**
     * Reads a predicate atom, validating declaration, arity and every argument.
     */
    Atom readAtom(SExpression expression, Scope scope) {
        String name = expression.head();
        if (name == null) {
            throw declarations.error(ParseErrorKind.SYNTAX, expression, expression.toString(), "expected a predicate atom");
        }
        PredicateSignature signature = declarations.predicates.get(name);
        if (signature == null) {
            throw declarations.error(ParseErrorKind.UNDECLARED_PREDICATE, expression, name,
                    "undeclared predicate '" + name + "'");
        }
        int arity = expression.size() - 1;
        if (arity != signature.arity()) {
            throw declarations.error(ParseErrorKind.ARITY_MISMATCH, expression, name,
                    "predicate '" + name + "' declared with " + signature.arity() + " parameter(s), used with " + arity);
        }
        List<String> arguments = new ArrayList<>(arity);
        for (int i = 1; i < expression.size(); i++) {
            arguments.add(readTerm(expression.get(i), scope));
        }
        return new Atom(name, arguments);
    }

    NumericExpression readNumeric(SExpression expression, Scope scope) {
        if (expression.isAtom()) {
            String text = expression.atom();
            if (DURATION_VARIABLE.equals(text)) {
                if (!scope.durationAllowed()) {
                    throw declarations.error(ParseErrorKind.UNDECLARED_PARAMETER, expression, text,
                            "?duration is only visible inside durative actions");
                }
                return new NumericExpression.DurationVariable();
            }
            return new NumericExpression.Constant(readNumber(expression));
        }
        String head = expression.head();
        if (head == null) {
            throw declarations.error(ParseErrorKind.SYNTAX, expression, expression.toString(), "malformed numeric expression");
        }
        NumericExpression.Operator operator = NumericExpression.Operator.fromSymbol(head);
        if (operator != null) {
            if (operator == NumericExpression.Operator.SUBTRACT && expression.size() == 2) {
                return new NumericExpression.Negation(readNumeric(expression.get(1), scope));
            }
            if (expression.size() < 3) {
                throw declarations.error(ParseErrorKind.SYNTAX, expression, head,
                        "operator '" + head + "' needs at least two operands");
            }
            NumericExpression folded = readNumeric(expression.get(1), scope);
            for (int i = 2; i < expression.size(); i++) {
                folded = new NumericExpression.Binary(operator, folded, readNumeric(expression.get(i), scope));
            }
            return folded;
        }
        return readFluent(expression, scope);
    }

    NumericExpression.FluentTerm readFluent(SExpression expression, Scope scope) {
        String name = expression.head();
        if (name == null) {
            throw declarations.error(ParseErrorKind.SYNTAX, expression, expression.toString(), "expected a fluent term");
        }
        FunctionSignature signature = declarations.functions.get(name);
        if (signature == null) {
            throw declarations.error(ParseErrorKind.UNDECLARED_FUNCTION, expression, name,
                    "undeclared function '" + name + "'");
        }
        int arity = expression.size() - 1;
        if (arity != signature.arity()) {
            throw declarations.error(ParseErrorKind.ARITY_MISMATCH, expression, name,
                    "function '" + name + "' declared with " + signature.arity() + " parameter(s), used with " + arity);
        }
        List<String> arguments = new ArrayList<>(arity);
        for (int i = 1; i < expression.size(); i++) {
            arguments.add(readTerm(expression.get(i), scope));
        }
        return new NumericExpression.FluentTerm(name, arguments);
    }

    double readNumber(SExpression expression) {
        try {
            double value = Double.parseDouble(expression.atom());
            if (!Double.isFinite(value)) {
                throw new NumberFormatException("non-finite");
            }
            return value;
        } catch (NumberFormatException ex) {
            throw declarations.error(ParseErrorKind.INVALID_NUMBER, expression, expression.atom(),
                    "expected a number, found '" + expression.atom() + "'");
        }
    }

    private String readTerm(SExpression expression, Scope scope) {
        if (!expression.isAtom()) {
            throw declarations.error(ParseErrorKind.SYNTAX, expression, expression.toString(),
                    "expected a variable or object name");
        }
        String term = expression.atom();
        if (Atom.isVariable(term)) {
            if (!scope.variables().containsKey(term)) {
                throw declarations.error(ParseErrorKind.UNDECLARED_PARAMETER, expression, term,
                        "variable '" + term + "' is not a parameter in scope");
            }
            return term;
        }
        if (!declarations.objects.containsKey(term)) {
            throw declarations.error(ParseErrorKind.UNDECLARED_OBJECT, expression, term,
                    "undeclared object or constant '" + term + "'");
        }
        return term;
    }

    /**
     * Returns {@code start}, {@code end} or {@code all} when {@code expression} is
     * {@code (at start f)}, {@code (at end f)} or {@code (over all f)}, otherwise null.
     *
     * <p>The wrapped formula must be a list, which keeps predicates named {@code at} readable.</p>
     */
    static String temporalQualifier(SExpression expression) {
        if (!expression.isList() || expression.size() != 3 || !expression.get(1).isAtom() || !expression.get(2).isList()) {
            return null;
        }
        String head = expression.head();
        String when = expression.get(1).atom();
        if ("at".equals(head) && ("start".equals(when) || "end".equals(when))) {
            return when;
        }
        if ("over".equals(head) && "all".equals(when)) {
            return when;
        }
        return null;
    }

    private boolean isObjectTerm(SExpression expression) {
        if (!expression.isAtom()) {
            return false;
        }
        String text = expression.atom();
        return (Atom.isVariable(text) && !DURATION_VARIABLE.equals(text)) || declarations.objects.containsKey(text);
    }

    private List<Formula> readOperands(SExpression expression, Scope scope) {
        List<Formula> operands = new ArrayList<>(expression.size() - 1);
        for (int i = 1; i < expression.size(); i++) {
            operands.add(readCondition(expression.get(i), scope));
        }
        return operands;
    }

    void requireSize(SExpression expression, int size) {
        if (expression.size() != size) {
            throw declarations.error(ParseErrorKind.SYNTAX, expression, expression.head(),
                    "'" + expression.head() + "' expects " + (size - 1) + " operand(s), found " + (expression.size() - 1));
        }
    }
}
