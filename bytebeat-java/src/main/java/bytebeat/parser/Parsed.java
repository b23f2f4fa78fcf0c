package bytebeat.parser;

/** Result of one grammar rule: a value plus the cursor after it, or an error. */
public record Parsed<T>(T value, Cursor rest, ParseError error) {

    public static <T> Parsed<T> ok(T value, Cursor rest) {
        return new Parsed<>(value, rest, null);
    }

    public static <T> Parsed<T> fail(ParseError error) {
        return new Parsed<>(null, null, error);
    }

    public boolean isOk() {
        return error == null;
    }
}
