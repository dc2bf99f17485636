package jfmt;

import java.util.Objects;

/**
 * A string, kept as its source lexeme including the surrounding quotes.
 *
 * @param lexeme the literal exactly as written, e.g. {@code "café"}
 */
public record JsonString(String lexeme) implements JsonValue {

    /**
     * Escape sequences are not checked here; see {@link #value()}.
     *
     * @throws IllegalArgumentException if {@code lexeme} is not a single quoted literal
     */
    public JsonString {
        Objects.requireNonNull(lexeme, "lexeme");
        if (!isQuoted(lexeme))
            throw new IllegalArgumentException("String lexeme must be enclosed in quotes: " + lexeme);
    }

    /**
     * Decode the escape sequences of this literal.
     *
     * @return the string value
     * @throws JfmtException if the literal contains an invalid escape sequence
     */
    public String value() {
        return decode(lexeme);
    }

    @Override
    public String stringify() {
        return lexeme;
    }

    // One opening and one closing quote, with every quote in between escaped.
    static boolean isQuoted(String s) {
        int last = s.length() - 1;
        if (last < 1 || s.charAt(0) != '"' || s.charAt(last) != '"') return false;
        int i = 1;
        while (i < last) {
            char c = s.charAt(i);
            if (c == '"') return false;
            i += c == '\\' ? 2 : 1;
        }
        return i == last;
    }

    static String decode(String lexeme) {
        int end = lexeme.length() - 1;
        var sb = new StringBuilder(end);
        int i = 1;
        while (i < end) {
            char c = lexeme.charAt(i++);
            if (c != '\\') {
                sb.append(c);
                continue;
            }
            if (i >= end) throw new JfmtException("Unterminated escape sequence in " + lexeme);
            char e = lexeme.charAt(i++);
            switch (e) {
                case '"' -> sb.append('"');
                case '\\' -> sb.append('\\');
                case '/' -> sb.append('/');
                case 'b' -> sb.append('\b');
                case 'f' -> sb.append('\f');
                case 'n' -> sb.append('\n');
                case 'r' -> sb.append('\r');
                case 't' -> sb.append('\t');
                case 'u' -> {
                    if (i + 4 > end) throw new JfmtException("Truncated \\u escape sequence in " + lexeme);
                    sb.append((char) readHex4(lexeme, i));
                    i += 4;
                }
                default -> throw new JfmtException("Invalid escape sequence: \\" + e + " in " + lexeme);
            }
        }
        return sb.toString();
    }

    private static int readHex4(String s, int from) {
        int cp = 0;
        for (int k = from; k < from + 4; k++) {
            int v = Character.digit(s.charAt(k), 16);
            if (v < 0) throw new JfmtException("Invalid hexadecimal digit in \\u escape sequence in " + s);
            cp = (cp << 4) | v;
        }
        return cp;
    }
}
