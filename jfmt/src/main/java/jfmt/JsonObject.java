package jfmt;

import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * An object, with its members in source order.
 *
 * <p> Duplicate keys are kept as they appear in the input.
 */
public record JsonObject(List<Member> members) implements JsonValue {

    public JsonObject {
        members = List.copyOf(members);
    }

    /**
     * Look up a member value by its decoded name. When the name occurs more than once the last one wins.
     *
     * @param name decoded member name
     * @return the value, or {@code null} if absent
     */
    public @Nullable JsonValue get(String name) {
        Objects.requireNonNull(name, "name");
        JsonValue found = null;
        for (var member : members) {
            if (member.name().equals(name)) found = member.value();
        }
        return found;
    }

    /**
     * @param key   the key lexeme including quotes
     * @param value the member value
     */
    public record Member(String key, JsonValue value) {

        public Member {
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(value, "value");
            if (!JsonString.isQuoted(key)) throw new IllegalArgumentException("Key must be a quoted string: " + key);
        }

        public String name() {
            return JsonString.decode(key);
        }
    }
}
