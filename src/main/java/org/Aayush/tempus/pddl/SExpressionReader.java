package org.Aayush.tempus.pddl;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;

/**
 * Tokenizes planning-definition text and builds the s-expression tree.
 *
 * <p>{@code ;} starts a comment running to end of line. Atoms are lower-cased since the
 * language is case-insensitive.</p>
 */
final class SExpressionReader {
    private final String source;

    SExpressionReader(String source) {
        this.source = source;
    }

    /**
     * Reads exactly one top-level list from {@code text}.
     *
     * @throws PddlParseException with {@link ParseErrorKind#SYNTAX} on unbalanced input,
     *                            stray atoms or trailing content.
     */
    SExpression readSingle(String text) {
        List<SExpression> roots = readAll(text);
        if (roots.isEmpty()) {
            throw syntax(null, 1, "expected a (define ...) form, found no content");
        }
        if (roots.size() > 1) {
            SExpression extra = roots.get(1);
            throw syntax(extra.toString(), extra.line(), "unexpected content after the (define ...) form");
        }
        SExpression root = roots.get(0);
        if (!root.isList()) {
            throw syntax(root.atom(), root.line(), "expected '(' at top level");
        }
        return root;
    }

    List<SExpression> readAll(String text) {
        if (text == null) {
            throw syntax(null, 0, "input text must not be null");
        }
        List<SExpression> roots = new ArrayList<>();
        Deque<List<SExpression>> stack = new ArrayDeque<>();
        Deque<Integer> openLines = new ArrayDeque<>();
        int line = 1;
        int i = 0;
        int length = text.length();

        while (i < length) {
            char c = text.charAt(i);
            if (c == '\n') {
                line++;
                i++;
            } else if (Character.isWhitespace(c)) {
                i++;
            } else if (c == ';') {
                while (i < length && text.charAt(i) != '\n') {
                    i++;
                }
            } else if (c == '(') {
                stack.push(new ArrayList<>());
                openLines.push(line);
                i++;
            } else if (c == ')') {
                if (stack.isEmpty()) {
                    throw syntax(")", line, "unbalanced ')'");
                }
                List<SExpression> children = stack.pop();
                SExpression list = SExpression.list(children, openLines.pop());
                if (stack.isEmpty()) {
                    roots.add(list);
                } else {
                    stack.peek().add(list);
                }
                i++;
            } else {
                int start = i;
                while (i < length && !isDelimiter(text.charAt(i))) {
                    i++;
                }
                SExpression atom = SExpression.atom(text.substring(start, i).toLowerCase(Locale.ROOT), line);
                if (stack.isEmpty()) {
                    roots.add(atom);
                } else {
                    stack.peek().add(atom);
                }
            }
        }
        if (!stack.isEmpty()) {
            throw syntax("(", openLines.peek(), "unbalanced '(' (missing " + stack.size() + " closing parenthesis)");
        }
        return roots;
    }

    private static boolean isDelimiter(char c) {
        return c == '(' || c == ')' || c == ';' || Character.isWhitespace(c);
    }

    private PddlParseException syntax(String symbol, int line, String message) {
        return new PddlParseException(ParseErrorKind.SYNTAX, source, symbol, line, message);
    }
}
