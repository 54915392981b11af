package org.Aayush.tempus.pddl;

import org.Aayush.tempus.task.FunctionSignature;
import org.Aayush.tempus.task.PredicateSignature;
import org.Aayush.tempus.task.TypeHierarchy;
import org.Aayush.tempus.task.TypedParameter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Symbol tables collected while reading a domain and then a problem.
 */
final class Declarations {
    final String source;
    TypeHierarchy types = new TypeHierarchy(Map.of());
    final Map<String, PredicateSignature> predicates = new LinkedHashMap<>();
    final Map<String, FunctionSignature> functions = new LinkedHashMap<>();
    /** Object or constant name to type, in declaration order. */
    final Map<String, String> objects = new LinkedHashMap<>();

    Declarations(String source) {
        this.source = source;
    }

    /**
     * Copies domain symbols for use while reading a problem.
     */
    Declarations forSource(String newSource) {
        Declarations copy = new Declarations(newSource);
        copy.types = types;
        copy.predicates.putAll(predicates);
        copy.functions.putAll(functions);
        copy.objects.putAll(objects);
        return copy;
    }

    PddlParseException error(ParseErrorKind kind, SExpression at, String symbol, String message) {
        return new PddlParseException(kind, source, symbol, at == null ? 0 : at.line(), message);
    }

    void requireType(String type, SExpression at) {
        if (!types.isDeclared(type)) {
            throw error(ParseErrorKind.UNDECLARED_TYPE, at, type, "undeclared type '" + type + "'");
        }
    }

    /**
     * Reads a typed list {@code a b - t c - u d} starting at {@code from}.
     *
     * <p>Names without a trailing {@code - type} default to {@link TypeHierarchy#ROOT}.</p>
     */
    List<TypedParameter> readTypedList(SExpression list, int from, boolean variables) {
        List<TypedParameter> result = new ArrayList<>();
        List<String> pending = new ArrayList<>();
        int i = from;
        while (i < list.size()) {
            SExpression item = list.get(i);
            if (!item.isAtom()) {
                throw error(ParseErrorKind.SYNTAX, item, item.toString(), "expected a name in typed list");
            }
            if (item.isAtom("-")) {
                if (pending.isEmpty() || i + 1 >= list.size()) {
                    throw error(ParseErrorKind.SYNTAX, item, "-", "dangling '-' in typed list");
                }
                SExpression typeExpression = list.get(i + 1);
                if (!typeExpression.isAtom()) {
                    if ("either".equals(typeExpression.head())) {
                        throw error(ParseErrorKind.UNSUPPORTED_CONSTRUCT, typeExpression, "either",
                                "(either ...) types are not supported");
                    }
                    throw error(ParseErrorKind.SYNTAX, typeExpression, typeExpression.toString(), "expected a type name");
                }
                for (String name : pending) {
                    result.add(new TypedParameter(name, typeExpression.atom()));
                }
                pending.clear();
                i += 2;
                continue;
            }
            String name = item.atom();
            if (variables != name.startsWith("?")) {
                throw error(ParseErrorKind.SYNTAX, item, name,
                        variables ? "expected a ?variable, found '" + name + "'" : "unexpected variable '" + name + "'");
            }
            pending.add(name);
            i++;
        }
        for (String name : pending) {
            result.add(new TypedParameter(name, TypeHierarchy.ROOT));
        }
        return result;
    }
}
