package jfmt;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A number, kept as its source lexeme.
 *
 * @param lexeme the number exactly as written, e.g. {@code 2.00} or {@code -1e10}
 */
public record JsonNumber(String lexeme) implements JsonValue {

    private static final Pattern GRAMMAR = Pattern.compile("-?(0|[1-9][0-9]*)(\\.[0-9]+)?([eE][+-]?[0-9]+)?");

    /**
     * @throws IllegalArgumentException if {@code lexeme} is not a JSON number
     */
    public JsonNumber {
        Objects.requireNonNull(lexeme, "lexeme");
        if (!GRAMMAR.matcher(lexeme).matches())
            throw new IllegalArgumentException("Not a JSON number: " + lexeme);
    }

    public BigDecimal toBigDecimal() {
        return new BigDecimal(lexeme);
    }

    @Override
    public String stringify() {
        return lexeme;
    }
}
