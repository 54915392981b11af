package org.Aayush.tempus.pddl;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Reason-coded parse failure.
 *
 * <p>Messages are prefixed with the reason code of {@link #kind()} and carry the offending
 * symbol and 1-based source line when known ({@code line == 0} means unknown).</p>
 */
@Getter
@Accessors(fluent = true)
public final class PddlParseException extends RuntimeException {
    private final ParseErrorKind kind;
    private final String symbol;
    private final int line;
    private final String source;

    /**
     * Creates a parse failure.
     *
     * @param kind failure kind.
     * @param source {@code domain} or {@code problem}.
     * @param symbol offending symbol, may be null.
     * @param line 1-based line, or 0 when unknown.
     * @param message descriptive message.
     */
    public PddlParseException(ParseErrorKind kind, String source, String symbol, int line, String message) {
        super(formatMessage(kind, source, line, message));
        this.kind = kind;
        this.source = source;
        this.symbol = symbol;
        this.line = line;
    }

    public String reasonCode() {
        return kind.reasonCode();
    }

    private static String formatMessage(ParseErrorKind kind, String source, int line, String message) {
        Objects.requireNonNull(kind, "kind");
        StringBuilder builder = new StringBuilder()
                .append('[').append(kind.reasonCode()).append("] ");
        if (source != null) {
            builder.append(source);
            if (line > 0) {
                builder.append(':').append(line);
            }
            builder.append(": ");
        }
        return builder.append(Objects.requireNonNull(message, "message")).toString();
    }
}
