package de.upb.sse.jrefactor.ast;

import lombok.Getter;

/**
 * Whitespace and comments captured verbatim around a node.
 *
 * The prefix precedes the node's first token. The suffix holds whatever sits between the node's
 * last token and the delimiter that follows it (a comma, a closing parenthesis, a semicolon, ...).
 * {@link #EMPTY} marks content that was synthesized rather than read from source; a node parsed
 * without any surrounding whitespace gets a separate instance with empty strings.
 */
@Getter
public final class Formatting {
    public static final Formatting EMPTY = new Formatting("", "");

    private final String prefix;
    private final String suffix;

    private Formatting(String prefix, String suffix) {
        this.prefix = prefix;
        this.suffix = suffix;
    }

    public static Formatting format(String prefix) {
        return new Formatting(prefix, "");
    }

    public static Formatting format(String prefix, String suffix) {
        return new Formatting(prefix, suffix);
    }

    public boolean isEmpty() {
        return this == EMPTY;
    }

    public Formatting withPrefix(String prefix) {
        return prefix.equals(this.prefix) ? this : new Formatting(prefix, suffix);
    }

    public Formatting withSuffix(String suffix) {
        return suffix.equals(this.suffix) ? this : new Formatting(prefix, suffix);
    }

    @Override
    public String toString() {
        return "Formatting{prefix='" + prefix + "', suffix='" + suffix + "'}";
    }
}
