package jfmt;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Whitespace policy for formatted output.
 *
 * <p> {@link Indent#NONE} produces compact output with no whitespace between tokens. Any other indent
 * produces one line per structural element, indented by one unit per nesting level.
 *
 * <h3>Example</h3>
 * <pre>{@code
 * Jfmt.format("{\"a\":[1,2]}", FormatPolicy.spaces(2));
 * // ->
 * // {
 * //   "a": [
 * //     1,
 * //     2
 * //   ]
 * // }
 * }</pre>
 *
 * @param indent indentation style
 * @param width  number of spaces per level, only meaningful for {@link Indent#SPACES}
 * @since 0.1.0
 */
public record FormatPolicy(Indent indent, int width) {

    private static final FormatPolicy COMPACT = new FormatPolicy(Indent.NONE, 0);
    private static final FormatPolicy TABS = new FormatPolicy(Indent.TABS, 1);

    public enum Indent {
        NONE,
        TABS,
        SPACES
    }

    public FormatPolicy {
        Objects.requireNonNull(indent, "indent");
        if (width < 0) throw new IllegalArgumentException("Indent width must not be negative: " + width);
        if (indent == Indent.NONE) width = 0;
        if (indent == Indent.TABS) width = 1;
    }

    public static FormatPolicy compact() {
        return COMPACT;
    }

    public static FormatPolicy tabs() {
        return TABS;
    }

    public static FormatPolicy spaces(int count) {
        return new FormatPolicy(Indent.SPACES, count);
    }

    public boolean isPretty() {
        return indent != Indent.NONE;
    }

    /**
     * @return the bytes written once per nesting level, empty in compact mode
     */
    byte[] indentUnit() {
        return switch (indent) {
            case NONE -> new byte[0];
            case TABS -> new byte[] {'\t'};
            case SPACES -> " ".repeat(width).getBytes(StandardCharsets.US_ASCII);
        };
    }
}
