package jfmt;

public record JsonBoolean(boolean value) implements JsonValue {
    @Override
    public String stringify() {
        return value ? "true" : "false";
    }
}
