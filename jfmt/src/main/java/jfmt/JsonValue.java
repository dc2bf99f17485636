package jfmt;

/**
 * A node of a parsed JSON document.
 *
 * <p> Scalars keep their source lexeme, so writing a tree back out reproduces the
 * original digits and escape sequences exactly. Containers own their children and
 * keep them in source order.
 *
 * @since 0.1.0
 */
public sealed interface JsonValue permits JsonArray, JsonBoolean, JsonNull, JsonNumber, JsonObject, JsonString {

    /**
     * Render this value as compact JSON text.
     *
     * @return non-null JSON text
     */
    default String stringify() {
        return Jfmt.write(this, FormatPolicy.compact());
    }
}
