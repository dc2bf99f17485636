package jfmt;

public record JsonNull() implements JsonValue {
    @Override
    public String stringify() {
        return "null";
    }
}
